package com.linlay.agentroom.ratelimit;

import java.time.Duration;

/**
 * Blocking pause used by {@link RateLimiter#waitIfNeeded(String, int)}.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
