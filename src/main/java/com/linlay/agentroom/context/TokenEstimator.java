package com.linlay.agentroom.context;

/**
 * Approximate token counting. Implementations must be deterministic: the same text always yields
 * the same count.
 */
public interface TokenEstimator {

    int estimate(String text);
}
