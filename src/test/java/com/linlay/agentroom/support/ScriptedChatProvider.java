package com.linlay.agentroom.support;

import com.linlay.agentroom.model.ChatMessage;
import com.linlay.agentroom.provider.ChatProvider;
import com.linlay.agentroom.provider.CompletionResult;
import com.linlay.agentroom.provider.StreamingNotSupportedException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Replays queued replies or failures, one per completion request, and records what it was sent.
 */
public class ScriptedChatProvider implements ChatProvider {

    private final String providerId;
    private final Queue<Object> script = new ConcurrentLinkedQueue<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    public ScriptedChatProvider(String providerId) {
        this.providerId = providerId;
    }

    public ScriptedChatProvider reply(String content) {
        script.add(content);
        return this;
    }

    public ScriptedChatProvider fail(RuntimeException error) {
        script.add(error);
        return this;
    }

    public List<Request> requests() {
        return new ArrayList<>(requests);
    }

    public Request lastRequest() {
        return requests.get(requests.size() - 1);
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public Mono<CompletionResult> complete(List<ChatMessage> messages, String systemPrompt) {
        return Mono.defer(() -> {
            requests.add(new Request(List.copyOf(messages), systemPrompt));
            Object next = script.poll();
            if (next instanceof RuntimeException error) {
                return Mono.error(error);
            }
            String content = next == null ? "" : (String) next;
            return Mono.just(new CompletionResult(content, "scripted-model", null));
        });
    }

    @Override
    public Flux<String> stream(List<ChatMessage> messages, String systemPrompt) {
        return Flux.error(new StreamingNotSupportedException(providerId));
    }

    public record Request(List<ChatMessage> messages, String systemPrompt) {
    }
}
