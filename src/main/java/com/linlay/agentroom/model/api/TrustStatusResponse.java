package com.linlay.agentroom.model.api;

public record TrustStatusResponse(
        String agent,
        boolean trusted,
        long remainingSeconds
) {
}
