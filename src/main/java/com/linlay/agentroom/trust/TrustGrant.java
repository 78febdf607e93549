package com.linlay.agentroom.trust;

import java.time.Instant;

public record TrustGrant(
        String agentName,
        Instant expiresAt
) {

    public boolean isActiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
