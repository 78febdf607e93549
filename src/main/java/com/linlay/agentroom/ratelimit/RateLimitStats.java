package com.linlay.agentroom.ratelimit;

public record RateLimitStats(
        String providerId,
        int availableTokens,
        int capacity,
        double waitTimeSeconds,
        int retryCount,
        boolean configured
) {
}
