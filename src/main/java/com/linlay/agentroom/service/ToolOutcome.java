package com.linlay.agentroom.service;

import com.linlay.agentroom.tool.FileChangePreview;
import com.linlay.agentroom.tool.ToolCall;

public record ToolOutcome(
        ToolCall call,
        Status status,
        String output,
        boolean autoExecuted,
        FileChangePreview preview
) {

    public enum Status {
        EXECUTED,
        DECLINED,
        PENDING_CONFIRMATION
    }
}
