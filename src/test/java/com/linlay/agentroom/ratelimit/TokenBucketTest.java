package com.linlay.agentroom.ratelimit;

import com.linlay.agentroom.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void shouldStartFullAndDecreaseByConsumedCost() {
        TokenBucket bucket = new TokenBucket(10, 1.0, clock);

        assertThat(bucket.availableTokens()).isEqualTo(10);
        assertThat(bucket.consume(3)).isTrue();
        assertThat(bucket.availableTokens()).isEqualTo(7);
        assertThat(bucket.consume(7)).isTrue();
        assertThat(bucket.availableTokens()).isZero();
    }

    @Test
    void shouldRejectWhenInsufficientWithoutChangingTokens() {
        TokenBucket bucket = new TokenBucket(2, 1.0, clock);
        bucket.consume(2);

        assertThat(bucket.consume(1)).isFalse();
        assertThat(bucket.availableTokens()).isZero();
    }

    @Test
    void shouldRefillFromElapsedTimeButNeverAboveCapacity() {
        TokenBucket bucket = new TokenBucket(5, 2.0, clock);
        bucket.consume(5);

        clock.advance(Duration.ofSeconds(1));
        assertThat(bucket.availableTokens()).isEqualTo(2);

        clock.advance(Duration.ofHours(1));
        assertThat(bucket.availableTokens()).isEqualTo(5);
    }

    @Test
    void waitTimeShouldBeZeroWhenAffordableElseMissingOverRate() {
        TokenBucket bucket = new TokenBucket(4, 2.0, clock);
        assertThat(bucket.waitTime(1)).isZero();

        bucket.consume(4);
        assertThat(bucket.waitTime(1)).isEqualTo(0.5);
        assertThat(bucket.waitTime(3)).isEqualTo(1.5);

        clock.advance(Duration.ofMillis(500));
        assertThat(bucket.waitTime(1)).isZero();
    }

    @Test
    void nonPositiveCostShouldBeRejectedWithoutOverfilling() {
        TokenBucket bucket = new TokenBucket(5, 1.0, clock);

        assertThatThrownBy(() -> bucket.consume(-10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bucket.consume(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bucket.waitTime(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(bucket.availableTokens()).isEqualTo(5);
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new TokenBucket(0, 1.0, clock)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenBucket(1, 0, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}
