package com.linlay.agentroom.provider;

/**
 * Upstream call failed (transport, auth, quota). Recoverable through the rate limiter's retry
 * policy until it is exhausted.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;

    public ProviderException(String providerId, String message, Throwable cause) {
        super("[" + providerId + "] " + message, cause);
        this.providerId = providerId;
    }

    public ProviderException(String providerId, String message) {
        this(providerId, message, null);
    }

    public String getProviderId() {
        return providerId;
    }
}
