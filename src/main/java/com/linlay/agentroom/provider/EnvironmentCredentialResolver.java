package com.linlay.agentroom.provider;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Resolves keys from the Spring {@link Environment}: the reference itself first
 * (e.g. {@code OPENAI_API_KEY}), then {@code <PROVIDER>_API_KEY} when a bare provider id is given.
 */
@Component
public class EnvironmentCredentialResolver implements CredentialResolver {

    private final Environment environment;

    public EnvironmentCredentialResolver(Environment environment) {
        this.environment = environment;
    }

    @Override
    public String resolveKey(String reference) {
        if (!StringUtils.hasText(reference)) {
            return "";
        }
        String name = reference.trim();
        String value = environment.getProperty(name);
        if (!StringUtils.hasText(value) && !name.contains("_")) {
            value = environment.getProperty(name.toUpperCase(Locale.ROOT) + "_API_KEY");
        }
        return StringUtils.hasText(value) ? value.trim() : "";
    }
}
