package com.linlay.agentroom.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.hamcrest.Matchers.containsString;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.MOCK,
        properties = {
                "agent.critic.enabled=false",
                "agent.tools.working-directory=${java.io.tmpdir}"
        }
)
@AutoConfigureWebTestClient
@Import(StubProviderConfig.class)
class RoomControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void mentionedAgentToolCallShouldComeBackPendingConfirmation() {
        webTestClient.post()
                .uri("/api/rooms/build-room/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"content\":\"@Coder write the notes\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.code").isEqualTo(0)
                .jsonPath("$.data.room").isEqualTo("build-room")
                .jsonPath("$.data.agents[0]").isEqualTo("Coder")
                .jsonPath("$.data.fallback").isEqualTo(false)
                .jsonPath("$.data.turns[0].reply").isEqualTo(StubProviderConfig.CODER_REPLY)
                .jsonPath("$.data.turns[0].toolOutcomes[0].status").isEqualTo("PENDING_CONFIRMATION")
                .jsonPath("$.data.turns[0].toolOutcomes[0].call.name").isEqualTo("write_file")
                .jsonPath("$.data.turns[0].toolOutcomes[0].preview.unifiedDiff").value(containsString("+hi"));

        webTestClient.get()
                .uri("/api/rooms/build-room/messages")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(2)
                .jsonPath("$.data[0].role").isEqualTo("user")
                .jsonPath("$.data[0].content").isEqualTo("@Coder write the notes")
                .jsonPath("$.data[1].role").isEqualTo("assistant")
                .jsonPath("$.data[1].agent").isEqualTo("Coder");
    }

    @Test
    void unaddressedMessageShouldBeAnsweredByDefaultAgent() {
        webTestClient.post()
                .uri("/api/rooms/lobby/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"content\":\"where do we start?\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.agents[0]").isEqualTo("Architect")
                .jsonPath("$.data.fallback").isEqualTo(true)
                .jsonPath("$.data.turns[0].reply").isEqualTo(StubProviderConfig.DEFAULT_REPLY)
                .jsonPath("$.data.turns[0].contextUsage.maxTokens").isEqualTo(8192);
    }

    @Test
    void reservedRoomNameShouldBeRejected() {
        webTestClient.post()
                .uri("/api/rooms/con/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"content\":\"hello\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo(400)
                .jsonPath("$.msg").value(containsString("reserved"));
    }

    @Test
    void blankContentShouldFailValidation() {
        webTestClient.post()
                .uri("/api/rooms/lobby/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"content\":\" \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.msg").isEqualTo("Validation failed");
    }
}
