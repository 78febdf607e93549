package com.linlay.agentroom.agent;

import java.util.Locale;
import java.util.Objects;

public record AgentProfile(
        String name,
        String providerId,
        String modelId,
        String systemPrompt,
        double temperature,
        int maxTokens,
        String baseUrl,
        String apiKeyEnv
) {

    public AgentProfile {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank");
        }
        name = name.trim();
        providerId = Objects.requireNonNullElse(providerId, "").trim().toLowerCase(Locale.ROOT);
        modelId = Objects.requireNonNullElse(modelId, "").trim();
        systemPrompt = Objects.requireNonNullElse(systemPrompt, "");
        maxTokens = maxTokens > 0 ? maxTokens : 4096;
        baseUrl = baseUrl == null || baseUrl.isBlank() ? null : baseUrl.trim();
        apiKeyEnv = apiKeyEnv == null || apiKeyEnv.isBlank() ? null : apiKeyEnv.trim();
    }
}
