package com.linlay.agentroom.model;

import java.util.Locale;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Message role must not be blank");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> USER;
            case "assistant" -> ASSISTANT;
            case "system" -> SYSTEM;
            default -> throw new IllegalArgumentException("Unknown message role: " + raw);
        };
    }
}
