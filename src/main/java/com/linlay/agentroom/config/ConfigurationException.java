package com.linlay.agentroom.config;

/**
 * Caller supplied an identifier (agent, provider, credential reference) that the current
 * configuration cannot satisfy. Fatal for the operation and never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
