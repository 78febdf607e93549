package com.linlay.agentroom.agent;

import java.util.List;

/**
 * @param agents      canonical agent names, de-duplicated, in answer order; never empty
 * @param cleanedText message text with the selected mentions removed
 * @param fallback    {@code true} when no mention resolved and the default agent was chosen
 */
public record AgentSelection(
        List<String> agents,
        String cleanedText,
        boolean fallback
) {

    public AgentSelection {
        agents = List.copyOf(agents);
        cleanedText = cleanedText == null ? "" : cleanedText;
    }

    public String primaryAgent() {
        return agents.get(0);
    }
}
