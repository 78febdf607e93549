package com.linlay.agentroom.critic;

import com.linlay.agentroom.agent.AgentProfile;
import com.linlay.agentroom.agent.AgentRegistry;
import com.linlay.agentroom.config.CriticProperties;
import com.linlay.agentroom.model.ChatMessage;
import com.linlay.agentroom.provider.ChatProvider;
import com.linlay.agentroom.provider.CompletionResult;
import com.linlay.agentroom.provider.CredentialResolver;
import com.linlay.agentroom.provider.ProviderFactory;
import com.linlay.agentroom.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Background auditor: after an agent acts, asks the critic agent whether the action is risky and
 * publishes an alert when it is. Never affects the turn it observes.
 */
@Component
public class ShadowCritic {

    private static final Logger log = LoggerFactory.getLogger(ShadowCritic.class);

    static final int MAX_EXCERPT_CHARS = 2000;
    static final double AUDIT_TEMPERATURE = 0.1;
    static final int AUDIT_MAX_TOKENS = 500;

    private final CriticProperties properties;
    private final AgentRegistry agentRegistry;
    private final ProviderFactory providerFactory;
    private final CredentialResolver credentialResolver;
    private final RateLimiter rateLimiter;
    private final List<CriticAlertListener> listeners;
    // audit handles keep their own sampling options, separate from the critic's chat handle
    private final Map<String, ChatProvider> auditProviders = new ConcurrentHashMap<>();

    @Autowired
    public ShadowCritic(
            CriticProperties properties,
            AgentRegistry agentRegistry,
            ProviderFactory providerFactory,
            CredentialResolver credentialResolver,
            RateLimiter rateLimiter,
            ObjectProvider<CriticAlertListener> listeners
    ) {
        this(properties, agentRegistry, providerFactory, credentialResolver, rateLimiter,
                listeners.orderedStream().toList());
    }

    public ShadowCritic(
            CriticProperties properties,
            AgentRegistry agentRegistry,
            ProviderFactory providerFactory,
            CredentialResolver credentialResolver,
            RateLimiter rateLimiter,
            List<CriticAlertListener> listeners
    ) {
        this.properties = properties;
        this.agentRegistry = agentRegistry;
        this.providerFactory = providerFactory;
        this.credentialResolver = credentialResolver;
        this.rateLimiter = rateLimiter;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Fire-and-forget audit on the bounded-elastic scheduler.
     */
    public Disposable audit(String agentName, String action, String result, String context) {
        return review(agentName, action, result, context)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(this::publish);
    }

    /**
     * Emits an alert when the critic flags the action; completes empty when it is clear, skipped
     * (including when the critic's provider has no capacity left), or the audit failed.
     */
    public Mono<CriticAlert> review(String agentName, String action, String result, String context) {
        if (!properties.isEnabled() || properties.getAgentName().equalsIgnoreCase(agentName)) {
            return Mono.empty();
        }
        Optional<AgentProfile> critic = agentRegistry.find(properties.getAgentName());
        if (critic.isEmpty()) {
            log.debug("No '{}' agent configured, skipping audit", properties.getAgentName());
            return Mono.empty();
        }
        AgentProfile profile = auditProfile(critic.get());
        String apiKey = credentialResolver.resolveFor(profile);
        if (ProviderFactory.requiresApiKey(profile.providerId()) && apiKey.isBlank()) {
            log.debug("No api key for critic provider '{}', skipping audit", profile.providerId());
            return Mono.empty();
        }

        String prompt = auditPrompt(agentName, action, result, context);
        return Mono.defer(() -> {
                    if (!rateLimiter.checkLimit(profile.providerId())) {
                        log.debug("Provider '{}' has no capacity left, skipping audit of '{}'",
                                profile.providerId(), agentName);
                        return Mono.<CompletionResult>empty();
                    }
                    return auditProvider(profile, apiKey).complete(List.of(ChatMessage.user(prompt)), null);
                })
                .map(CompletionResult::content)
                .flatMap(reply -> Mono.justOrEmpty(CriticAlert.parse(agentName, reply)))
                .onErrorResume(ex -> {
                    log.warn("Shadow audit of '{}' failed: {}", agentName, ex.getMessage());
                    return Mono.empty();
                });
    }

    private void publish(CriticAlert alert) {
        log.warn("Critic alert for '@{}' [{}]: {} (fix: {})",
                alert.targetAgent(), alert.severity(), alert.issue(), alert.fix());
        for (CriticAlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (RuntimeException ex) {
                log.warn("Critic alert listener failed", ex);
            }
        }
    }

    private ChatProvider auditProvider(AgentProfile profile, String apiKey) {
        return auditProviders.computeIfAbsent(profile.name(), name -> providerFactory.create(profile, apiKey));
    }

    private AgentProfile auditProfile(AgentProfile critic) {
        return new AgentProfile(
                critic.name(),
                critic.providerId(),
                critic.modelId(),
                critic.systemPrompt(),
                AUDIT_TEMPERATURE,
                AUDIT_MAX_TOKENS,
                critic.baseUrl(),
                critic.apiKeyEnv()
        );
    }

    static String auditPrompt(String agentName, String action, String result, String context) {
        return """
                [SHADOW AUDIT REQUEST]
                Agent '@%s' just performed an action.

                ACTION: %s
                RESULT: %s

                CONTEXT OF THE MISSION:
                %s

                Your task:
                1. Review this action for security risks, bugs, or major architectural violations.
                2. If the action is SAFE and correct, respond with exactly: "STATUS: CLEAR"
                3. If you find a MAJOR or CRITICAL issue, respond with:
                   "STATUS: ALERT"
                   "SEVERITY: [Critical/Major]"
                   "ISSUE: [Brief description]"
                   "FIX: [Brief recommendation]"

                Be concise. Do not chat.
                """.formatted(agentName, action, excerpt(result), excerpt(context));
    }

    private static String excerpt(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_EXCERPT_CHARS ? text : text.substring(0, MAX_EXCERPT_CHARS) + "... (truncated)";
    }
}
