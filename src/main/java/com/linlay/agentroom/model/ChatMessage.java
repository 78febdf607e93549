package com.linlay.agentroom.model;

import java.util.Objects;

/**
 * A single conversation message. Never mutated after creation.
 *
 * @param agentTag name of the agent that produced an assistant message, {@code null} otherwise
 */
public record ChatMessage(
        MessageRole role,
        String content,
        String agentTag
) {

    public ChatMessage {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
        agentTag = agentTag == null || agentTag.isBlank() ? null : agentTag.trim();
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, null);
    }

    public static ChatMessage assistant(String content, String agentTag) {
        return new ChatMessage(MessageRole.ASSISTANT, content, agentTag);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, null);
    }

    public boolean isSystem() {
        return role == MessageRole.SYSTEM;
    }
}
