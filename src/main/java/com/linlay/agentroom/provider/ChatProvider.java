package com.linlay.agentroom.provider;

import com.linlay.agentroom.model.ChatMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A configured handle onto one LLM backend.
 * <p>
 * Both operations are lazy: nothing is sent before subscription, cancelling the subscription
 * abandons the call, and deadlines are applied with {@code timeout(...)} by the caller.
 * Upstream failures surface as {@link ProviderException}.
 */
public interface ChatProvider {

    String providerId();

    Mono<CompletionResult> complete(List<ChatMessage> messages, String systemPrompt);

    /**
     * One-shot stream of text chunks; a second subscription issues a new request.
     * Emits {@link StreamingNotSupportedException} when the backend cannot stream, so the caller
     * can fall back to {@link #complete(List, String)}.
     */
    Flux<String> stream(List<ChatMessage> messages, String systemPrompt);
}
