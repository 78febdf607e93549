package com.linlay.agentroom.context;

/**
 * Four characters per token, at least one token for non-empty text.
 */
public class CharRatioTokenEstimator implements TokenEstimator {

    private static final double CHARS_PER_TOKEN = 4.0;

    @Override
    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return Math.max(1, (int) Math.floor(text.length() / CHARS_PER_TOKEN));
    }
}
