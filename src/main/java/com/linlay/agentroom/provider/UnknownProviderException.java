package com.linlay.agentroom.provider;

import com.linlay.agentroom.config.ConfigurationException;

import java.util.Collection;

public class UnknownProviderException extends ConfigurationException {

    public UnknownProviderException(String providerId, Collection<String> supported) {
        super("Unknown provider '" + providerId + "'. Valid options: " + String.join(", ", supported));
    }
}
