package com.linlay.agentroom.service;

import com.linlay.agentroom.context.TokenUsageReport;
import com.linlay.agentroom.provider.ProviderTokenUsage;

import java.util.List;

/**
 * @param handoff       agent suggested by an @mention in the reply, {@code null} when none
 * @param providerUsage provider-reported usage, {@code null} when the backend reports none
 */
public record AgentTurnResult(
        String agentName,
        String reply,
        List<ToolOutcome> toolOutcomes,
        String handoff,
        TokenUsageReport contextUsage,
        ProviderTokenUsage providerUsage
) {

    public AgentTurnResult {
        toolOutcomes = toolOutcomes == null ? List.of() : List.copyOf(toolOutcomes);
    }
}
