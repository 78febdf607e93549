package com.linlay.agentroom.ratelimit;

import java.time.Clock;

/**
 * Admission-control bucket for one provider. Starts full, refills lazily from elapsed clock time.
 * All state changes happen under the bucket's own monitor.
 */
public class TokenBucket {

    private final int capacity;
    private final double refillRate;
    private final Clock clock;
    private double tokens;
    private long lastRefillMillis;

    public TokenBucket(int capacity, double refillRate, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (refillRate <= 0) {
            throw new IllegalArgumentException("refillRate must be positive: " + refillRate);
        }
        this.capacity = capacity;
        this.refillRate = refillRate;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
    }

    /**
     * @throws IllegalArgumentException when {@code cost} is not positive
     */
    public synchronized boolean consume(int cost) {
        requirePositive(cost);
        refill();
        if (tokens >= cost) {
            tokens -= cost;
            return true;
        }
        return false;
    }

    /**
     * Seconds until {@code cost} tokens are available, 0 when affordable now.
     */
    public synchronized double waitTime(int cost) {
        requirePositive(cost);
        refill();
        if (tokens >= cost) {
            return 0.0;
        }
        return (cost - tokens) / refillRate;
    }

    public synchronized int availableTokens() {
        refill();
        return (int) Math.floor(tokens);
    }

    public int capacity() {
        return capacity;
    }

    public double refillRate() {
        return refillRate;
    }

    static void requirePositive(int cost) {
        if (cost <= 0) {
            throw new IllegalArgumentException("cost must be positive: " + cost);
        }
    }

    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillMillis;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + (elapsed / 1000.0) * refillRate);
        }
        lastRefillMillis = Math.max(lastRefillMillis, now);
    }
}
