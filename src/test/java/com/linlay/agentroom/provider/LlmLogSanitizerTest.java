package com.linlay.agentroom.provider;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.assertj.core.api.Assertions.assertThat;

class LlmLogSanitizerTest {

    @Test
    void sensitiveHeadersShouldBeMasked() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer sk-secret");
        headers.set("x-api-key", "ant-secret");
        headers.set("Content-Type", "application/json");

        HttpHeaders masked = LlmLogSanitizer.maskHeaders(headers, true);

        assertThat(masked.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("***");
        assertThat(masked.getFirst("x-api-key")).isEqualTo("***");
        assertThat(masked.getFirst("Content-Type")).isEqualTo("application/json");
        assertThat(headers.getFirst("x-api-key")).isEqualTo("ant-secret");
        assertThat(LlmLogSanitizer.maskHeaders(headers, false).getFirst("x-api-key")).isEqualTo("ant-secret");
    }

    @Test
    void secretJsonFieldsAndBearerTokensShouldBeMasked() {
        String body = "{\"api_key\": \"abc123\", \"model\": \"gpt-4o\"} Authorization: Bearer sk-live-42";

        String masked = LlmLogSanitizer.maskText(body, true);

        assertThat(masked).isEqualTo("{\"api_key\": \"***\", \"model\": \"gpt-4o\"} Authorization: Bearer ***");
        assertThat(LlmLogSanitizer.maskText(body, false)).isEqualTo(body);
    }

    @Test
    void apiKeyDisplayShouldRevealOnlySuffix() {
        assertThat(LlmLogSanitizer.maskApiKey("sk-1234567890abcd")).isEqualTo("****abcd");
        assertThat(LlmLogSanitizer.maskApiKey("short")).isEqualTo("****");
        assertThat(LlmLogSanitizer.maskApiKey("")).isEqualTo("(none)");
    }
}
