package com.linlay.agentroom.context;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModelContextWindowsTest {

    @Test
    void knownFamiliesShouldResolveBySubstring() {
        assertThat(ModelContextWindows.maxContext("gemini-1.5-pro-latest")).isEqualTo(2_000_000);
        assertThat(ModelContextWindows.maxContext("claude-3-5-sonnet-latest")).isEqualTo(200_000);
        assertThat(ModelContextWindows.maxContext("gpt-4o-mini")).isEqualTo(128_000);
        assertThat(ModelContextWindows.maxContext("gpt-4-turbo-preview")).isEqualTo(128_000);
        assertThat(ModelContextWindows.maxContext("gpt-4-0613")).isEqualTo(8_192);
        assertThat(ModelContextWindows.maxContext("GPT-3.5-TURBO")).isEqualTo(16_385);
    }

    @Test
    void unknownModelShouldFallBack() {
        assertThat(ModelContextWindows.maxContext("llama3")).isEqualTo(ModelContextWindows.FALLBACK);
        assertThat(ModelContextWindows.maxContext(null)).isEqualTo(ModelContextWindows.FALLBACK);
        assertThat(ModelContextWindows.maxContext(" ")).isEqualTo(ModelContextWindows.FALLBACK);
    }
}
