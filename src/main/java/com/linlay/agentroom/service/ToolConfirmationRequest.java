package com.linlay.agentroom.service;

import com.linlay.agentroom.tool.FileChangePreview;
import com.linlay.agentroom.tool.ToolCall;

import java.util.Map;

/**
 * @param preview proposed file change, {@code null} unless the tool mutates files
 */
public record ToolConfirmationRequest(
        String agentName,
        ToolCall call,
        Map<String, String> arguments,
        FileChangePreview preview
) {
}
