package com.linlay.agentroom.model.api;

import com.linlay.agentroom.model.ChatMessage;

public record MessageResponse(
        String role,
        String content,
        String agent
) {

    public static MessageResponse from(ChatMessage message) {
        return new MessageResponse(message.role().wireValue(), message.content(), message.agentTag());
    }
}
