package com.linlay.agentroom.agent;

import com.linlay.agentroom.config.AgentRoomProperties;
import com.linlay.agentroom.provider.ChatProvider;
import com.linlay.agentroom.provider.ProviderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides which agents answer a message and suggests handoffs found in replies.
 * <p>
 * Provider handles are cached per agent for the lifetime of the router; a credential change needs
 * a new router instance.
 */
@Component
public class AgentRouter {

    private static final Logger log = LoggerFactory.getLogger(AgentRouter.class);

    private final AgentRegistry registry;
    private final ProviderFactory providerFactory;
    private final DispatchPolicy dispatchPolicy;
    private final Map<String, ChatProvider> providers = new ConcurrentHashMap<>();

    @Autowired
    public AgentRouter(AgentRegistry registry, ProviderFactory providerFactory, AgentRoomProperties properties) {
        this(registry, providerFactory, properties.getDispatchPolicy());
    }

    public AgentRouter(AgentRegistry registry, ProviderFactory providerFactory, DispatchPolicy dispatchPolicy) {
        this.registry = registry;
        this.providerFactory = providerFactory;
        this.dispatchPolicy = dispatchPolicy == null ? DispatchPolicy.ALL_MENTIONS : dispatchPolicy;
    }

    public AgentSelection selectAgents(String text) {
        String raw = text == null ? "" : text;
        Set<String> selected = new LinkedHashSet<>();
        String cleaned = raw;
        for (String mention : MentionParser.parse(raw)) {
            Optional<AgentProfile> profile = registry.find(mention);
            if (profile.isEmpty()) {
                log.debug("Ignoring mention of unknown agent '@{}'", mention);
                continue;
            }
            selected.add(profile.get().name());
            cleaned = MentionParser.strip(cleaned, mention);
            if (dispatchPolicy == DispatchPolicy.FIRST_MENTION) {
                break;
            }
        }

        if (selected.isEmpty()) {
            return new AgentSelection(List.of(registry.defaultAgentName()), raw.trim(), true);
        }
        return new AgentSelection(new ArrayList<>(selected), cleaned.trim(), false);
    }

    /**
     * First configured agent mentioned in {@code reply} other than {@code currentAgent}.
     */
    public Optional<String> detectHandoff(String reply, String currentAgent) {
        for (String mention : MentionParser.parse(reply)) {
            Optional<AgentProfile> profile = registry.find(mention);
            if (profile.isEmpty()) {
                continue;
            }
            String name = profile.get().name();
            if (currentAgent == null || !name.equalsIgnoreCase(currentAgent.trim())) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws UnknownAgentException when the agent is not configured
     */
    public ChatProvider providerFor(String agentName, String apiKey) {
        AgentProfile profile = registry.get(agentName);
        return providers.computeIfAbsent(profile.name(), name -> {
            log.info("Initializing provider '{}' for agent '{}'", profile.providerId(), name);
            return providerFactory.create(profile, apiKey);
        });
    }

    public DispatchPolicy dispatchPolicy() {
        return dispatchPolicy;
    }

    public AgentRegistry registry() {
        return registry;
    }
}
