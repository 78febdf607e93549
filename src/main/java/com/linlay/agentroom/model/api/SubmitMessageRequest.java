package com.linlay.agentroom.model.api;

import jakarta.validation.constraints.NotBlank;

public record SubmitMessageRequest(
        @NotBlank
        String content
) {
}
