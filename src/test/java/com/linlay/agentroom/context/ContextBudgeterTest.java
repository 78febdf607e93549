package com.linlay.agentroom.context;

import com.linlay.agentroom.model.ChatMessage;
import com.linlay.agentroom.model.MessageRole;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextBudgeterTest {

    // 40 chars -> 10 tokens + 4 overhead
    private static final int SMALL_COST = 14;

    private final ContextBudgeter budgeter = new ContextBudgeter();

    @Test
    void shouldKeepSystemPromptAndMostRecentMessagesThatFit() {
        List<ChatMessage> history = numbered(5);

        List<ChatMessage> trimmed = budgeter.trim(history, "sys", ContextBudgeter.BASELINE + 5 + SMALL_COST * 2);

        assertThat(trimmed).hasSize(3);
        assertThat(trimmed.get(0).role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(trimmed.get(0).content()).isEqualTo("sys");
        assertThat(trimmed.subList(1, 3)).containsExactly(history.get(3), history.get(4));
    }

    @Test
    void everythingShouldBeKeptWhenBudgetIsLarge() {
        List<ChatMessage> history = numbered(3);

        List<ChatMessage> trimmed = budgeter.trim(history, null, 10_000);

        assertThat(trimmed).containsExactlyElementsOf(history);
    }

    @Test
    void oversizedSystemPromptShouldYieldAtMostThatMessage() {
        String prompt = "p".repeat(400);

        List<ChatMessage> trimmed = budgeter.trim(numbered(3), prompt, 50);

        assertThat(trimmed).hasSize(1);
        assertThat(trimmed.get(0).content()).isEqualTo(prompt);
    }

    @Test
    void emptyInputShouldYieldEmptyOutput() {
        assertThat(budgeter.trim(List.of(), null, 100)).isEmpty();
        assertThat(budgeter.trim(null, "", 100)).isEmpty();
    }

    @Test
    void shouldStopAtFirstMessageThatDoesNotFit() {
        ChatMessage oldSmall = ChatMessage.user("o".repeat(40));
        ChatMessage large = ChatMessage.user("l".repeat(400));
        ChatMessage latest = ChatMessage.user("n".repeat(40));

        List<ChatMessage> trimmed = budgeter.trim(List.of(oldSmall, large, latest), null,
                ContextBudgeter.BASELINE + SMALL_COST * 2);

        assertThat(trimmed).containsExactly(latest);
    }

    @Test
    void existingSystemMessagesShouldBeReplacedByGivenPrompt() {
        List<ChatMessage> history = List.of(
                ChatMessage.system("old system"),
                ChatMessage.user("hi"),
                ChatMessage.system("stray"),
                ChatMessage.assistant("hello", "Coder")
        );

        List<ChatMessage> trimmed = budgeter.trim(history, "new system", 10_000);

        assertThat(trimmed).extracting(ChatMessage::content)
                .containsExactly("new system", "hi", "hello");
    }

    @Test
    void leadingSystemMessageShouldStayPinnedWithoutPrompt() {
        List<ChatMessage> history = new ArrayList<>();
        history.add(ChatMessage.system("pinned"));
        history.addAll(numbered(4));

        List<ChatMessage> trimmed = budgeter.trim(history, null, ContextBudgeter.BASELINE + 10 + SMALL_COST);

        assertThat(trimmed).extracting(ChatMessage::content)
                .containsExactly("pinned", history.get(4).content());
    }

    @Test
    void preserveFirstNShouldPinEarliestMessages() {
        List<ChatMessage> history = numbered(5);

        List<ChatMessage> trimmed = budgeter.trim(history, null, ContextBudgeter.BASELINE + SMALL_COST * 2, 1);

        assertThat(trimmed).containsExactly(history.get(0), history.get(4));
    }

    @Test
    void trimmedTotalShouldNeverExceedBudget() {
        List<ChatMessage> history = numbered(20);
        for (int max = 20; max <= 300; max += 17) {
            List<ChatMessage> trimmed = budgeter.trim(history, "s".repeat(12), max);
            assertThat(budgeter.countTokens(trimmed) + ContextBudgeter.BASELINE).isLessThanOrEqualTo(max);
        }
    }

    @Test
    void tokenUsageShouldIncludeBaselineAndFloorPercent() {
        TokenUsageReport report = budgeter.tokenUsage(numbered(2), 100);

        assertThat(report.totalTokens()).isEqualTo(SMALL_COST * 2 + ContextBudgeter.BASELINE);
        assertThat(report.maxTokens()).isEqualTo(100);
        assertThat(report.usagePercent()).isEqualTo(31);
        assertThat(budgeter.tokenUsage(List.of(), 0).usagePercent()).isZero();
    }

    private static List<ChatMessage> numbered(int count) {
        List<ChatMessage> messages = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String body = String.format("message %02d ", i) + "x".repeat(29);
            messages.add(i % 2 == 0 ? ChatMessage.user(body) : ChatMessage.assistant(body, "Coder"));
        }
        return messages;
    }
}
