package com.linlay.agentroom.context;

import com.linlay.agentroom.model.ChatMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trims a conversation to a token ceiling while keeping pinned messages.
 * <p>
 * Pinned messages are the system message at index 0 (when present) and the {@code preserveFirstN}
 * messages right after it. The rest is filled from the most recent message backwards and stops at
 * the first message that does not fit; older history is dropped whole.
 */
@Component
public class ContextBudgeter {

    static final int PER_MESSAGE_OVERHEAD = 4;
    static final int BASELINE = 3;

    private final TokenEstimator estimator;

    public ContextBudgeter() {
        this(new CharRatioTokenEstimator());
    }

    @Autowired
    public ContextBudgeter(TokenEstimator estimator) {
        this.estimator = estimator;
    }

    public List<ChatMessage> trim(List<ChatMessage> messages, String systemPrompt, int maxTokens) {
        return trim(messages, systemPrompt, maxTokens, 0);
    }

    public List<ChatMessage> trim(List<ChatMessage> messages, String systemPrompt, int maxTokens, int preserveFirstN) {
        List<ChatMessage> candidates = new ArrayList<>();
        boolean hasPrompt = StringUtils.hasLength(systemPrompt);
        if (hasPrompt) {
            candidates.add(ChatMessage.system(systemPrompt));
        }
        if (messages != null) {
            for (ChatMessage message : messages) {
                if (hasPrompt && message.isSystem()) {
                    continue;
                }
                candidates.add(message);
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        int pinnedCount = candidates.get(0).isSystem() ? 1 : 0;
        pinnedCount = Math.min(candidates.size(), pinnedCount + Math.max(0, preserveFirstN));
        List<ChatMessage> pinned = candidates.subList(0, pinnedCount);

        int fixedTokens = countTokens(pinned);
        if (BASELINE + fixedTokens > maxTokens) {
            return pinned.isEmpty() ? List.of() : List.of(pinned.get(0));
        }

        int budget = maxTokens - BASELINE - fixedTokens;
        List<ChatMessage> recent = new ArrayList<>();
        int used = 0;
        for (int i = candidates.size() - 1; i >= pinnedCount; i--) {
            int cost = messageTokens(candidates.get(i));
            if (used + cost > budget) {
                break;
            }
            recent.add(candidates.get(i));
            used += cost;
        }
        Collections.reverse(recent);

        List<ChatMessage> result = new ArrayList<>(pinned.size() + recent.size());
        result.addAll(pinned);
        result.addAll(recent);
        return List.copyOf(result);
    }

    public TokenUsageReport tokenUsage(List<ChatMessage> messages, int maxTokens) {
        int total = countTokens(messages == null ? List.of() : messages) + BASELINE;
        int percent = maxTokens > 0 ? (int) Math.floor((double) total / maxTokens * 100) : 0;
        return new TokenUsageReport(total, maxTokens, percent);
    }

    public int countTokens(List<ChatMessage> messages) {
        int total = 0;
        for (ChatMessage message : messages) {
            total += messageTokens(message);
        }
        return total;
    }

    private int messageTokens(ChatMessage message) {
        return estimator.estimate(message.content()) + PER_MESSAGE_OVERHEAD;
    }
}
