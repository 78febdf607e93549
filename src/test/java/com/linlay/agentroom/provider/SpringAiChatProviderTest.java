package com.linlay.agentroom.provider;

import com.linlay.agentroom.model.ChatMessage;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SpringAiChatProviderTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final SpringAiChatProvider provider = new SpringAiChatProvider("openai", "gpt-4o", chatModel);

    @Test
    void completeShouldReturnTextModelAndUsage() {
        ChatResponseMetadata metadata = ChatResponseMetadata.builder()
                .model("gpt-4o-2024-08-06")
                .usage(new DefaultUsage(12, 3))
                .build();
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("Hello!"))), metadata));

        StepVerifier.create(provider.complete(List.of(ChatMessage.user("hi")), "Be brief"))
                .assertNext(result -> {
                    assertThat(result.content()).isEqualTo("Hello!");
                    assertThat(result.modelName()).isEqualTo("gpt-4o-2024-08-06");
                    assertThat(result.usage().promptTokens()).isEqualTo(12);
                    assertThat(result.usage().completionTokens()).isEqualTo(3);
                })
                .verifyComplete();
    }

    @Test
    void completeShouldBeLazyUntilSubscribed() {
        provider.complete(List.of(ChatMessage.user("hi")), null);

        verify(chatModel, never()).call(any(Prompt.class));
    }

    @Test
    void promptShouldStartWithSystemPromptAndKeepRoles() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("ok")))));
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);

        provider.complete(List.of(
                ChatMessage.user("question"),
                ChatMessage.assistant("answer", "Coder")
        ), "You are helpful").block();

        verify(chatModel).call(captor.capture());
        List<Message> instructions = captor.getValue().getInstructions();
        assertThat(instructions).extracting(Message::getMessageType)
                .containsExactly(MessageType.SYSTEM, MessageType.USER, MessageType.ASSISTANT);
        assertThat(instructions.get(0).getText()).isEqualTo("You are helpful");
    }

    @Test
    void missingUsageShouldBeReportedAsNull() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("ok")))));

        StepVerifier.create(provider.complete(List.of(), null))
                .assertNext(result -> {
                    assertThat(result.usage()).isNull();
                    assertThat(result.modelName()).isEqualTo("gpt-4o");
                })
                .verifyComplete();
    }

    @Test
    void upstreamFailureShouldSurfaceAsProviderException() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("401 Unauthorized"));

        StepVerifier.create(provider.complete(List.of(ChatMessage.user("hi")), null))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ProviderException.class)
                            .hasMessage("[openai] 401 Unauthorized");
                    assertThat(((ProviderException) error).getProviderId()).isEqualTo("openai");
                })
                .verify();
    }

    @Test
    void streamShouldEmitNonEmptyChunks() {
        when(chatModel.stream(any(Prompt.class))).thenReturn(Flux.just(
                new ChatResponse(List.of(new Generation(new AssistantMessage("Hel")))),
                new ChatResponse(List.of(new Generation(new AssistantMessage("")))),
                new ChatResponse(List.of(new Generation(new AssistantMessage("lo"))))
        ));

        StepVerifier.create(provider.stream(List.of(ChatMessage.user("hi")), null))
                .expectNext("Hel", "lo")
                .verifyComplete();
    }

    @Test
    void unsupportedStreamingShouldBeSignalledDistinctly() {
        when(chatModel.stream(any(Prompt.class))).thenThrow(new UnsupportedOperationException("no streaming"));

        StepVerifier.create(provider.stream(List.of(ChatMessage.user("hi")), null))
                .expectError(StreamingNotSupportedException.class)
                .verify();
    }
}
