package com.linlay.agentroom.service;

import com.linlay.agentroom.model.ChatMessage;

import java.util.List;

/**
 * Room message storage collaborator.
 */
public interface MessageStore {

    void append(String room, ChatMessage message);

    /**
     * The most recent {@code limit} messages of the room, oldest first.
     */
    List<ChatMessage> history(String room, int limit);

    List<String> rooms();
}
