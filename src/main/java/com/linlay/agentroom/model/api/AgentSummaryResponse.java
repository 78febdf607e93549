package com.linlay.agentroom.model.api;

public record AgentSummaryResponse(
        String name,
        String provider,
        String model,
        boolean isDefault,
        boolean trusted,
        long trustRemainingSeconds
) {
}
