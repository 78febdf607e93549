package com.linlay.agentroom.trust;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-boxed trust ("flow state") per agent. While a grant is active the agent's tool calls run
 * without confirmation.
 * <p>
 * Expired grants are purged lazily by the read that notices them; there is no background sweep.
 */
@Component
public class TrustLedger {

    private static final Logger log = LoggerFactory.getLogger(TrustLedger.class);

    private final Map<String, TrustGrant> grants = new ConcurrentHashMap<>();
    private final Clock clock;

    public TrustLedger() {
        this(Clock.systemUTC());
    }

    @Autowired
    public TrustLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Sets or overwrites the agent's grant to expire {@code duration} from now.
     */
    public TrustGrant grant(String agentName, Duration duration) {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName must not be blank");
        }
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative");
        }
        TrustGrant grant = new TrustGrant(agentName, clock.instant().plus(duration));
        grants.put(agentName, grant);
        log.info("Trust granted to '{}' for {}s", agentName, duration.toSeconds());
        return grant;
    }

    public TrustGrant grant(String agentName, long durationSeconds) {
        return grant(agentName, Duration.ofSeconds(durationSeconds));
    }

    public void revoke(String agentName) {
        if (agentName != null && grants.remove(agentName) != null) {
            log.info("Trust revoked for '{}'", agentName);
        }
    }

    public boolean isTrusted(String agentName) {
        return activeGrant(agentName) != null;
    }

    /**
     * Whole seconds left on the grant, 0 when untrusted.
     */
    public long remainingSeconds(String agentName) {
        TrustGrant grant = activeGrant(agentName);
        if (grant == null) {
            return 0;
        }
        return Math.max(0, Duration.between(clock.instant(), grant.expiresAt()).getSeconds());
    }

    public List<TrustGrant> activeGrants() {
        List<TrustGrant> active = new ArrayList<>();
        for (String agentName : List.copyOf(grants.keySet())) {
            TrustGrant grant = activeGrant(agentName);
            if (grant != null) {
                active.add(grant);
            }
        }
        active.sort(Comparator.comparing(TrustGrant::agentName));
        return active;
    }

    private TrustGrant activeGrant(String agentName) {
        if (agentName == null) {
            return null;
        }
        Instant now = clock.instant();
        return grants.computeIfPresent(agentName, (name, grant) -> {
            if (grant.isActiveAt(now)) {
                return grant;
            }
            log.debug("Trust for '{}' expired at {}", name, grant.expiresAt());
            return null;
        });
    }
}
