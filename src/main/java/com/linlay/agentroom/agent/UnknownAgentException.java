package com.linlay.agentroom.agent;

import com.linlay.agentroom.config.ConfigurationException;

public class UnknownAgentException extends ConfigurationException {

    private final String agentName;

    public UnknownAgentException(String agentName, Iterable<String> available) {
        super("Agent '" + agentName + "' not found in configuration. Available: " + available);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
