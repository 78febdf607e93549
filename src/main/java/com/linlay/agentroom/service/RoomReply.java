package com.linlay.agentroom.service;

import java.util.List;

public record RoomReply(
        String room,
        List<String> agents,
        boolean fallback,
        List<AgentTurnResult> turns
) {
}
