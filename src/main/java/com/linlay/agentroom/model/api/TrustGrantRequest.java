package com.linlay.agentroom.model.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record TrustGrantRequest(
        @Min(1)
        @Max(86_400)
        long durationSeconds
) {
}
