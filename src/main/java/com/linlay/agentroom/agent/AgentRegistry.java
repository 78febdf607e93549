package com.linlay.agentroom.agent;

import com.linlay.agentroom.config.AgentRoomProperties;
import com.linlay.agentroom.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentProfile> agents;
    private final String defaultAgentName;

    @Autowired
    public AgentRegistry(AgentRoomProperties properties) {
        this(toProfiles(properties.getAgents()), properties.getDefaultAgent());
    }

    public AgentRegistry(Collection<AgentProfile> profiles, String defaultAgentName) {
        Map<String, AgentProfile> byName = new LinkedHashMap<>();
        for (AgentProfile profile : profiles) {
            if (byName.putIfAbsent(profile.name(), profile) != null) {
                log.warn("Duplicate agent '{}' ignored", profile.name());
            }
        }
        this.agents = Map.copyOf(byName);
        if (defaultAgentName == null || defaultAgentName.isBlank()) {
            throw new ConfigurationException("Default agent must be configured");
        }
        this.defaultAgentName = defaultAgentName.trim();
        if (find(this.defaultAgentName).isEmpty()) {
            log.warn("Default agent '{}' is not among the configured agents {}", this.defaultAgentName, names());
        }
        log.debug("Loaded {} agent profile(s), default='{}'", agents.size(), this.defaultAgentName);
    }

    /**
     * Exact name match first, then a case-insensitive match.
     *
     * @throws UnknownAgentException when neither matches
     */
    public AgentProfile get(String name) {
        return find(name).orElseThrow(() -> new UnknownAgentException(name, names()));
    }

    public Optional<AgentProfile> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String candidate = name.trim();
        AgentProfile exact = agents.get(candidate);
        if (exact != null) {
            return Optional.of(exact);
        }
        return agents.values().stream()
                .filter(profile -> profile.name().equalsIgnoreCase(candidate))
                .findFirst();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public String defaultAgentName() {
        return defaultAgentName;
    }

    public List<String> names() {
        return agents.keySet().stream().sorted().toList();
    }

    public List<AgentProfile> list() {
        return names().stream().map(agents::get).toList();
    }

    private static List<AgentProfile> toProfiles(Map<String, AgentRoomProperties.AgentConfig> configs) {
        return configs.entrySet().stream()
                .filter(entry -> entry.getValue() != null)
                .map(entry -> {
                    AgentRoomProperties.AgentConfig config = entry.getValue();
                    return new AgentProfile(
                            entry.getKey(),
                            config.getProvider(),
                            config.getModel(),
                            config.getSystemPrompt(),
                            config.getTemperature(),
                            config.getMaxTokens(),
                            config.getBaseUrl(),
                            config.getApiKeyEnv()
                    );
                })
                .toList();
    }
}
