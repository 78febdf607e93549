package com.linlay.agentroom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.critic")
public class CriticProperties {

    private boolean enabled = true;
    private String agentName = "Critic";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAgentName() {
        return agentName;
    }

    public void setAgentName(String agentName) {
        this.agentName = agentName == null || agentName.isBlank() ? "Critic" : agentName.trim();
    }
}
