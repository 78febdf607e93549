package com.linlay.agentroom.provider;

import com.linlay.agentroom.model.ChatMessage;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ChatProvider} backed by a Spring AI {@link ChatModel} whose default options already carry
 * the agent's model, temperature and output limit.
 */
public class SpringAiChatProvider implements ChatProvider {

    private final String providerId;
    private final String modelId;
    private final ChatModel chatModel;

    public SpringAiChatProvider(String providerId, String modelId, ChatModel chatModel) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.modelId = modelId;
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    public String providerId() {
        return providerId;
    }

    public String modelId() {
        return modelId;
    }

    @Override
    public Mono<CompletionResult> complete(List<ChatMessage> messages, String systemPrompt) {
        return Mono.fromCallable(() -> chatModel.call(toPrompt(messages, systemPrompt)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toCompletionResult)
                .switchIfEmpty(Mono.error(() -> new ProviderException(providerId, "Empty response")))
                .onErrorMap(this::isUpstreamFailure, ex -> new ProviderException(providerId, describe(ex), ex));
    }

    @Override
    public Flux<String> stream(List<ChatMessage> messages, String systemPrompt) {
        return Flux.defer(() -> chatModel.stream(toPrompt(messages, systemPrompt)))
                .map(this::textOf)
                .filter(StringUtils::hasLength)
                .onErrorMap(UnsupportedOperationException.class, ex -> new StreamingNotSupportedException(providerId))
                .onErrorMap(this::isUpstreamFailure, ex -> new ProviderException(providerId, describe(ex), ex));
    }

    private boolean isUpstreamFailure(Throwable ex) {
        return !(ex instanceof ProviderException) && !(ex instanceof StreamingNotSupportedException);
    }

    Prompt toPrompt(List<ChatMessage> messages, String systemPrompt) {
        List<Message> converted = new ArrayList<>();
        if (StringUtils.hasText(systemPrompt)) {
            converted.add(new SystemMessage(systemPrompt));
        }
        if (messages != null) {
            for (ChatMessage message : messages) {
                converted.add(switch (message.role()) {
                    case SYSTEM -> new SystemMessage(message.content());
                    case ASSISTANT -> new AssistantMessage(message.content());
                    case USER -> new UserMessage(message.content());
                });
            }
        }
        return new Prompt(converted);
    }

    private CompletionResult toCompletionResult(ChatResponse response) {
        String model = modelId;
        ProviderTokenUsage usage = null;
        if (response.getMetadata() != null) {
            if (StringUtils.hasText(response.getMetadata().getModel())) {
                model = response.getMetadata().getModel();
            }
            usage = toUsage(response.getMetadata().getUsage());
        }
        return new CompletionResult(textOf(response), model, usage);
    }

    private ProviderTokenUsage toUsage(Usage usage) {
        if (usage == null) {
            return null;
        }
        Integer prompt = usage.getPromptTokens();
        Integer completion = usage.getCompletionTokens();
        if ((prompt == null || prompt == 0) && (completion == null || completion == 0)) {
            return null;
        }
        return new ProviderTokenUsage(prompt, completion, usage.getTotalTokens());
    }

    private String textOf(ChatResponse response) {
        if (response == null) {
            return "";
        }
        Generation generation = response.getResult();
        if (generation == null || generation.getOutput() == null) {
            return "";
        }
        String text = generation.getOutput().getText();
        return text == null ? "" : text;
    }

    private String describe(Throwable ex) {
        String message = ex.getMessage();
        return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
    }
}
