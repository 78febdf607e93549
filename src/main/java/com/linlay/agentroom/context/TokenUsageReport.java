package com.linlay.agentroom.context;

public record TokenUsageReport(
        int totalTokens,
        int maxTokens,
        int usagePercent
) {
}
