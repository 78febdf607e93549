package com.linlay.agentroom.provider;

public record ProviderTokenUsage(
        Integer promptTokens,
        Integer completionTokens,
        Integer totalTokens
) {
}
