package com.linlay.agentroom.ratelimit;

import com.linlay.agentroom.config.ConfigurationException;
import com.linlay.agentroom.config.RateLimitProperties;
import com.linlay.agentroom.support.MutableClock;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RateLimiterTest {

    private final MutableClock clock = new MutableClock();
    private final List<Duration> sleeps = new ArrayList<>();

    private RateLimiter limiter(RateLimitProperties properties) {
        return new RateLimiter(properties, clock, sleeps::add);
    }

    @Test
    void unknownProviderShouldAlwaysBeAdmitted() {
        RateLimiter limiter = limiter(new RateLimitProperties());

        for (int i = 0; i < 2_000; i++) {
            assertThat(limiter.checkLimit("mystery")).isTrue();
        }
        assertThat(limiter.getWaitTime("mystery", 5)).isZero();
        assertThat(limiter.getAvailableTokens("mystery")).isEqualTo(RateLimiter.UNLIMITED);
        assertThat(limiter.isConfigured("mystery")).isFalse();
        assertThat(limiter.getStats("mystery").capacity()).isEqualTo(RateLimiter.UNLIMITED);
    }

    @Test
    void defaultLimitsShouldApplyPerProvider() {
        RateLimiter limiter = limiter(new RateLimitProperties());

        assertThat(limiter.configuredProviders()).containsExactlyInAnyOrder("gemini", "anthropic", "openai", "ollama");
        assertThat(limiter.getStats("anthropic").capacity()).isEqualTo(50);
        assertThat(limiter.getStats("gemini").capacity()).isEqualTo(100);
        assertThat(limiter.getStats("openai").capacity()).isEqualTo(60);
        assertThat(limiter.getStats("ollama").capacity()).isEqualTo(1000);
    }

    @Test
    void configuredLimitsShouldOverrideAndExtendDefaults() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setProviders(Map.of(
                "openai", new RateLimitProperties.Limit(2, Duration.ofSeconds(10)),
                "local", new RateLimitProperties.Limit(5, Duration.ofSeconds(1))
        ));
        RateLimiter limiter = limiter(properties);

        assertThat(limiter.checkLimit("openai")).isTrue();
        assertThat(limiter.checkLimit("openai")).isTrue();
        assertThat(limiter.checkLimit("openai")).isFalse();
        assertThat(limiter.getWaitTime("openai", 1)).isCloseTo(5.0, within(1e-9));
        assertThat(limiter.isConfigured("local")).isTrue();
        assertThat(limiter.getStats("gemini").capacity()).isEqualTo(100);
    }

    @Test
    void exhaustedBucketShouldReportWaitWithoutThrowing() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setProviders(Map.of("openai", new RateLimitProperties.Limit(1, Duration.ofSeconds(2))));
        RateLimiter limiter = limiter(properties);

        assertThat(limiter.checkLimit("openai")).isTrue();
        assertThat(limiter.checkLimit("openai")).isFalse();
        assertThat(limiter.waitDuration("openai", 1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(limiter.getStats("openai").availableTokens()).isZero();

        clock.advance(Duration.ofSeconds(2));
        assertThat(limiter.checkLimit("openai")).isTrue();
    }

    @Test
    void waitIfNeededShouldSleepForTheWaitTimeWithoutConsuming() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setProviders(Map.of("openai", new RateLimitProperties.Limit(1, Duration.ofSeconds(2))));
        RateLimiter limiter = limiter(properties);

        limiter.waitIfNeeded("openai", 1);
        assertThat(sleeps).isEmpty();
        assertThat(limiter.getAvailableTokens("openai")).isEqualTo(1);

        limiter.checkLimit("openai");
        limiter.waitIfNeeded("openai", 1);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void backoffShouldGrowExponentiallyWithRetryCount() {
        RateLimiter limiter = limiter(new RateLimitProperties());

        assertThat(limiter.getBackoffTime("gemini")).isEqualTo(Duration.ofSeconds(1));
        limiter.incrementRetryCount("gemini");
        assertThat(limiter.getBackoffTime("gemini")).isEqualTo(Duration.ofSeconds(2));
        limiter.incrementRetryCount("gemini");
        assertThat(limiter.getBackoffTime("gemini")).isEqualTo(Duration.ofSeconds(4));
        assertThat(limiter.getBackoffTime("openai")).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void retryBookkeepingShouldStopAtMaxRetriesAndResetOnSuccess() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setMaxRetries(2);
        RateLimiter limiter = limiter(properties);

        assertThat(limiter.shouldRetry("openai")).isTrue();
        assertThat(limiter.incrementRetryCount("openai")).isEqualTo(1);
        assertThat(limiter.incrementRetryCount("openai")).isEqualTo(2);
        assertThat(limiter.shouldRetry("openai")).isFalse();
        assertThat(limiter.shouldRetry("gemini")).isTrue();

        limiter.resetRetryCount("openai");
        assertThat(limiter.getRetryCount("openai")).isZero();
        assertThat(limiter.shouldRetry("openai")).isTrue();
    }

    @Test
    void disabledAutoRetryShouldNeverRetry() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setAutoRetry(false);

        assertThat(limiter(properties).shouldRetry("openai")).isFalse();
    }

    @Test
    void awaitCapacityShouldConsumeImmediatelyWhenAffordable() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setProviders(Map.of("openai", new RateLimitProperties.Limit(3, Duration.ofSeconds(60))));
        RateLimiter limiter = limiter(properties);

        StepVerifier.create(limiter.awaitCapacity("openai", 2)).verifyComplete();
        assertThat(limiter.getAvailableTokens("openai")).isEqualTo(1);
        StepVerifier.create(limiter.awaitCapacity("unknown", 1)).verifyComplete();
    }

    @Test
    void awaitCapacityShouldDelayUntilRefilled() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setProviders(Map.of("fast", new RateLimitProperties.Limit(1, Duration.ofMillis(50))));
        RateLimiter limiter = new RateLimiter(properties);

        assertThat(limiter.checkLimit("fast")).isTrue();
        StepVerifier.create(limiter.awaitCapacity("fast", 1))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void awaitCapacityShouldRejectCostAboveCapacity() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setProviders(Map.of("openai", new RateLimitProperties.Limit(2, Duration.ofSeconds(60))));

        StepVerifier.create(limiter(properties).awaitCapacity("openai", 3))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void nonPositiveCostShouldBeRejectedForKnownAndUnknownProviders() {
        RateLimiter limiter = limiter(new RateLimitProperties());

        assertThatThrownBy(() -> limiter.checkLimit("openai", -10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter.checkLimit("mystery", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter.getWaitTime("openai", -1)).isInstanceOf(IllegalArgumentException.class);
        StepVerifier.create(limiter.awaitCapacity("openai", 0))
                .expectError(IllegalArgumentException.class)
                .verify();
        assertThat(limiter.getAvailableTokens("openai")).isEqualTo(60);
    }

    @Test
    void invalidLimitShouldFailConstruction() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setProviders(Map.of("openai", new RateLimitProperties.Limit(0, Duration.ofSeconds(60))));

        assertThatThrownBy(() -> limiter(properties)).isInstanceOf(ConfigurationException.class);
    }
}
