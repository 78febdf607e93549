package com.linlay.agentroom.service;

import com.linlay.agentroom.model.ChatMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryMessageStore implements MessageStore {

    private final Map<String, List<ChatMessage>> messagesByRoom = new ConcurrentHashMap<>();

    @Override
    public void append(String room, ChatMessage message) {
        List<ChatMessage> messages = messagesByRoom.computeIfAbsent(room, key -> new ArrayList<>());
        synchronized (messages) {
            messages.add(message);
        }
    }

    @Override
    public List<ChatMessage> history(String room, int limit) {
        List<ChatMessage> messages = messagesByRoom.get(room);
        if (messages == null || limit <= 0) {
            return List.of();
        }
        synchronized (messages) {
            int from = Math.max(0, messages.size() - limit);
            return List.copyOf(messages.subList(from, messages.size()));
        }
    }

    @Override
    public List<String> rooms() {
        return messagesByRoom.keySet().stream().sorted().toList();
    }
}
