package com.linlay.agentroom.provider;

/**
 * Backend has no streaming endpoint. Not a failure: callers fall back to a plain completion.
 */
public class StreamingNotSupportedException extends RuntimeException {

    public StreamingNotSupportedException(String providerId) {
        super("Streaming is not supported by provider '" + providerId + "'");
    }
}
