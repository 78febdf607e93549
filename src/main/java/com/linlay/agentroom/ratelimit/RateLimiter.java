package com.linlay.agentroom.ratelimit;

import com.linlay.agentroom.config.RateLimitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider token buckets plus retry bookkeeping.
 * <p>
 * Exhaustion is reported through return values, never thrown. Providers without a configured
 * limit are always admitted and report {@link #UNLIMITED} tokens.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final int UNLIMITED = 999_999;
    private static final Duration MIN_POLL = Duration.ofMillis(1);

    private final Map<String, TokenBucket> buckets;
    private final Map<String, Integer> retryCounts = new ConcurrentHashMap<>();
    private final boolean autoRetry;
    private final int maxRetries;
    private final double backoffMultiplier;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public RateLimiter(RateLimitProperties properties) {
        this(properties, Clock.systemUTC(), Sleeper.THREAD);
    }

    @Autowired
    public RateLimiter(RateLimitProperties properties, Clock clock, Sleeper sleeper) {
        Map<String, TokenBucket> created = new LinkedHashMap<>();
        properties.effectiveLimits().forEach((providerId, limit) ->
                created.put(providerId, new TokenBucket(limit.getLimit(), limit.refillRatePerSecond(), clock)));
        this.buckets = Collections.unmodifiableMap(created);
        this.autoRetry = properties.isAutoRetry();
        this.maxRetries = properties.getMaxRetries();
        this.backoffMultiplier = properties.getBackoffMultiplier();
        this.baseDelay = properties.getBaseDelay();
        this.sleeper = sleeper;
        log.debug("Rate limits configured for providers {}", buckets.keySet());
    }

    public boolean checkLimit(String providerId) {
        return checkLimit(providerId, 1);
    }

    /**
     * Consumes {@code cost} tokens if affordable.
     */
    public boolean checkLimit(String providerId, int cost) {
        TokenBucket.requirePositive(cost);
        TokenBucket bucket = bucket(providerId);
        if (bucket == null) {
            return true;
        }
        return bucket.consume(cost);
    }

    public double getWaitTime(String providerId) {
        return getWaitTime(providerId, 1);
    }

    /**
     * Seconds until {@code cost} tokens are affordable; 0 for unknown providers.
     */
    public double getWaitTime(String providerId, int cost) {
        TokenBucket.requirePositive(cost);
        TokenBucket bucket = bucket(providerId);
        if (bucket == null) {
            return 0.0;
        }
        return bucket.waitTime(cost);
    }

    public Duration waitDuration(String providerId, int cost) {
        return Duration.ofNanos((long) Math.ceil(getWaitTime(providerId, cost) * 1_000_000_000L));
    }

    /**
     * Blocks the calling thread until {@code cost} tokens would be affordable. Does not consume.
     * Never call this on an event-loop thread; reactive callers use {@link #awaitCapacity}.
     */
    public void waitIfNeeded(String providerId, int cost) {
        Duration wait = waitDuration(providerId, cost);
        if (wait.isZero()) {
            return;
        }
        log.debug("Rate limit reached for '{}', waiting {} ms", providerId, wait.toMillis());
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Completes once {@code cost} tokens have been consumed, delaying on the parallel scheduler
     * while the bucket is empty.
     */
    public Mono<Void> awaitCapacity(String providerId, int cost) {
        if (cost <= 0) {
            return Mono.error(new IllegalArgumentException("cost must be positive: " + cost));
        }
        TokenBucket bucket = bucket(providerId);
        if (bucket != null && cost > bucket.capacity()) {
            return Mono.error(new IllegalArgumentException(
                    "Cost " + cost + " exceeds capacity " + bucket.capacity() + " of provider '" + providerId + "'"));
        }
        return Mono.defer(() -> {
            if (checkLimit(providerId, cost)) {
                return Mono.<Void>empty();
            }
            Duration wait = waitDuration(providerId, cost);
            log.debug("Rate limit reached for '{}', retrying admission in {} ms", providerId, wait.toMillis());
            return Mono.delay(wait.compareTo(MIN_POLL) < 0 ? MIN_POLL : wait)
                    .then(awaitCapacity(providerId, cost));
        });
    }

    public int getAvailableTokens(String providerId) {
        TokenBucket bucket = bucket(providerId);
        if (bucket == null) {
            return UNLIMITED;
        }
        return bucket.availableTokens();
    }

    public boolean isConfigured(String providerId) {
        return bucket(providerId) != null;
    }

    public Set<String> configuredProviders() {
        return buckets.keySet();
    }

    public int incrementRetryCount(String providerId) {
        return retryCounts.merge(key(providerId), 1, Integer::sum);
    }

    public void resetRetryCount(String providerId) {
        retryCounts.put(key(providerId), 0);
    }

    public int getRetryCount(String providerId) {
        return retryCounts.getOrDefault(key(providerId), 0);
    }

    public boolean shouldRetry(String providerId) {
        return autoRetry && getRetryCount(providerId) < maxRetries;
    }

    /**
     * {@code baseDelay * multiplier ^ retryCount}.
     */
    public Duration getBackoffTime(String providerId) {
        double factor = Math.pow(backoffMultiplier, getRetryCount(providerId));
        return Duration.ofNanos((long) (baseDelay.toNanos() * factor));
    }

    public RateLimitStats getStats(String providerId) {
        TokenBucket bucket = bucket(providerId);
        if (bucket == null) {
            return new RateLimitStats(providerId, UNLIMITED, UNLIMITED, 0.0, 0, false);
        }
        return new RateLimitStats(
                providerId,
                bucket.availableTokens(),
                bucket.capacity(),
                bucket.waitTime(1),
                getRetryCount(providerId),
                true
        );
    }

    private TokenBucket bucket(String providerId) {
        if (providerId == null) {
            return null;
        }
        return buckets.get(providerId);
    }

    private String key(String providerId) {
        return providerId == null ? "" : providerId;
    }
}
