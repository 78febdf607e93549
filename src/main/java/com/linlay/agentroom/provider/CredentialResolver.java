package com.linlay.agentroom.provider;

import com.linlay.agentroom.agent.AgentProfile;

/**
 * Looks up the API key for a credential reference (an environment variable name or a provider id).
 * An empty result means "not configured" and is not an error.
 */
@FunctionalInterface
public interface CredentialResolver {

    String resolveKey(String reference);

    /**
     * Key for an agent: its {@code api-key-env} reference when set, otherwise its provider id.
     */
    default String resolveFor(AgentProfile profile) {
        String reference = profile.apiKeyEnv() != null ? profile.apiKeyEnv() : profile.providerId();
        String key = resolveKey(reference);
        return key == null ? "" : key;
    }
}
