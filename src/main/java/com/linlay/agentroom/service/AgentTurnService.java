package com.linlay.agentroom.service;

import com.linlay.agentroom.agent.AgentProfile;
import com.linlay.agentroom.agent.AgentRegistry;
import com.linlay.agentroom.agent.AgentRouter;
import com.linlay.agentroom.config.AgentRoomProperties;
import com.linlay.agentroom.config.ConfigurationException;
import com.linlay.agentroom.context.ContextBudgeter;
import com.linlay.agentroom.context.TokenUsageReport;
import com.linlay.agentroom.critic.ShadowCritic;
import com.linlay.agentroom.model.ChatMessage;
import com.linlay.agentroom.model.MessageRole;
import com.linlay.agentroom.provider.ChatProvider;
import com.linlay.agentroom.provider.CompletionResult;
import com.linlay.agentroom.provider.CredentialResolver;
import com.linlay.agentroom.provider.ProviderException;
import com.linlay.agentroom.provider.ProviderFactory;
import com.linlay.agentroom.provider.StreamingNotSupportedException;
import com.linlay.agentroom.ratelimit.RateLimiter;
import com.linlay.agentroom.tool.FileChangePreview;
import com.linlay.agentroom.tool.GateDecision;
import com.linlay.agentroom.tool.ToolCall;
import com.linlay.agentroom.tool.ToolCallParser;
import com.linlay.agentroom.tool.ToolGate;
import com.linlay.agentroom.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One agent answering one conversation state: admission, context trimming, provider call with
 * retry, then tool gating and handoff detection on the reply.
 */
@Service
public class AgentTurnService {

    private static final Logger log = LoggerFactory.getLogger(AgentTurnService.class);

    private static final int REQUEST_COST = 1;

    private final AgentRegistry agentRegistry;
    private final AgentRouter agentRouter;
    private final CredentialResolver credentialResolver;
    private final RateLimiter rateLimiter;
    private final ContextBudgeter contextBudgeter;
    private final ToolRegistry toolRegistry;
    private final ToolGate toolGate;
    private final ShadowCritic shadowCritic;
    private final int preserveFirstN;

    public AgentTurnService(
            AgentRegistry agentRegistry,
            AgentRouter agentRouter,
            CredentialResolver credentialResolver,
            RateLimiter rateLimiter,
            ContextBudgeter contextBudgeter,
            ToolRegistry toolRegistry,
            ToolGate toolGate,
            ShadowCritic shadowCritic,
            AgentRoomProperties properties
    ) {
        this.agentRegistry = agentRegistry;
        this.agentRouter = agentRouter;
        this.credentialResolver = credentialResolver;
        this.rateLimiter = rateLimiter;
        this.contextBudgeter = contextBudgeter;
        this.toolRegistry = toolRegistry;
        this.toolGate = toolGate;
        this.shadowCritic = shadowCritic;
        this.preserveFirstN = properties.getContext().getPreserveFirstN();
    }

    public Mono<AgentTurnResult> runTurn(String agentName, List<ChatMessage> history, ConfirmationHandler confirmations) {
        ConfirmationHandler handler = confirmations == null ? ConfirmationHandler.DEFER_ALL : confirmations;
        return Mono.defer(() -> {
            TurnContext turn = prepare(agentName, history);
            return rateLimiter.awaitCapacity(turn.provider().providerId(), REQUEST_COST)
                    .then(completeWithRetry(turn))
                    .publishOn(Schedulers.boundedElastic())
                    .map(result -> finish(turn, result, handler));
        });
    }

    /**
     * Streams the reply text. Providers without streaming fall back to a single completion chunk.
     */
    public Flux<String> streamReply(String agentName, List<ChatMessage> history) {
        return Flux.defer(() -> {
            TurnContext turn = prepare(agentName, history);
            ChatProvider provider = turn.provider();
            return rateLimiter.awaitCapacity(provider.providerId(), REQUEST_COST)
                    .thenMany(provider.stream(turn.context(), turn.systemPrompt()))
                    .onErrorResume(StreamingNotSupportedException.class, ex -> {
                        log.debug("Provider '{}' cannot stream, falling back to completion", provider.providerId());
                        return completeWithRetry(turn).map(CompletionResult::content).flux();
                    });
        });
    }

    private TurnContext prepare(String agentName, List<ChatMessage> history) {
        AgentProfile profile = agentRegistry.get(agentName);
        String apiKey = credentialResolver.resolveFor(profile);
        if (ProviderFactory.requiresApiKey(profile.providerId()) && apiKey.isBlank()) {
            String reference = profile.apiKeyEnv() != null ? profile.apiKeyEnv() : profile.providerId();
            throw new ConfigurationException("API key for '" + reference + "' not found (agent '" + profile.name() + "')");
        }
        ChatProvider provider = agentRouter.providerFor(profile.name(), apiKey);
        String systemPrompt = systemPrompt(profile);
        List<ChatMessage> context = contextBudgeter.trim(
                history == null ? List.of() : history, systemPrompt, profile.maxTokens(), preserveFirstN);
        // the system prompt travels separately
        List<ChatMessage> conversation = context.stream()
                .filter(message -> !(message.isSystem() && message.content().equals(systemPrompt)))
                .toList();
        return new TurnContext(profile, provider, systemPrompt, conversation);
    }

    private String systemPrompt(AgentProfile profile) {
        String tools = toolRegistry.describeTools();
        if (tools.isEmpty()) {
            return profile.systemPrompt();
        }
        if (profile.systemPrompt().isBlank()) {
            return tools;
        }
        return profile.systemPrompt() + "\n\n" + tools;
    }

    private Mono<CompletionResult> completeWithRetry(TurnContext turn) {
        String providerId = turn.provider().providerId();
        return turn.provider().complete(turn.context(), turn.systemPrompt())
                .doOnNext(result -> rateLimiter.resetRetryCount(providerId))
                .onErrorResume(ProviderException.class, ex -> {
                    if (!rateLimiter.shouldRetry(providerId)) {
                        rateLimiter.resetRetryCount(providerId);
                        return Mono.error(ex);
                    }
                    Duration backoff = rateLimiter.getBackoffTime(providerId);
                    int attempt = rateLimiter.incrementRetryCount(providerId);
                    log.warn("Provider '{}' failed for agent '{}' (attempt {}), retrying in {} ms: {}",
                            providerId, turn.profile().name(), attempt, backoff.toMillis(), ex.getMessage());
                    return Mono.delay(backoff)
                            .then(rateLimiter.awaitCapacity(providerId, REQUEST_COST))
                            .then(Mono.defer(() -> completeWithRetry(turn)));
                });
    }

    private AgentTurnResult finish(TurnContext turn, CompletionResult result, ConfirmationHandler confirmations) {
        String agentName = turn.profile().name();
        String reply = result.content();

        List<ToolOutcome> outcomes = new ArrayList<>();
        for (ToolCall call : ToolCallParser.parse(reply)) {
            ToolOutcome outcome = gate(agentName, call, confirmations);
            outcomes.add(outcome);
            if (outcome.status() == ToolOutcome.Status.EXECUTED) {
                shadowCritic.audit(agentName, describe(call), outcome.output(), lastUserMessage(turn.context()));
            }
        }

        String handoff = agentRouter.detectHandoff(reply, agentName).orElse(null);
        List<ChatMessage> exchanged = new ArrayList<>(turn.context());
        exchanged.add(ChatMessage.assistant(reply, agentName));
        TokenUsageReport usage = contextBudgeter.tokenUsage(exchanged, turn.profile().maxTokens());
        return new AgentTurnResult(agentName, reply, outcomes, handoff, usage, result.usage());
    }

    private ToolOutcome gate(String agentName, ToolCall call, ConfirmationHandler confirmations) {
        GateDecision decision = toolGate.decide(agentName, call.name());
        if (decision.autoExecute()) {
            log.info("Auto-executing '{}' for trusted agent '{}'", call.name(), agentName);
            return new ToolOutcome(call, ToolOutcome.Status.EXECUTED, toolGate.execute(call), true, null);
        }

        FileChangePreview preview = decision.diffPreviewRequired() ? toolGate.preview(call).orElse(null) : null;
        ConfirmationDecision answer = confirmations.confirm(
                new ToolConfirmationRequest(agentName, call, toolGate.resolveArguments(call), preview));
        return switch (answer) {
            case APPROVED -> new ToolOutcome(call, ToolOutcome.Status.EXECUTED, toolGate.execute(call), false, preview);
            case DECLINED -> new ToolOutcome(call, ToolOutcome.Status.DECLINED, "Declined by operator.", false, preview);
            case DEFERRED -> new ToolOutcome(call, ToolOutcome.Status.PENDING_CONFIRMATION, "", false, preview);
        };
    }

    private String describe(ToolCall call) {
        return "tool_call " + call.name() + " " + toolGate.resolveArguments(call);
    }

    private String lastUserMessage(List<ChatMessage> context) {
        for (int i = context.size() - 1; i >= 0; i--) {
            if (context.get(i).role() == MessageRole.USER) {
                return context.get(i).content();
            }
        }
        return "";
    }

    private record TurnContext(
            AgentProfile profile,
            ChatProvider provider,
            String systemPrompt,
            List<ChatMessage> context
    ) {
    }
}
