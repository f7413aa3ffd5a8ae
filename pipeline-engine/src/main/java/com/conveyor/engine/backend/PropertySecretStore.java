package com.conveyor.engine.backend;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Secrets from the Spring {@link Environment}: secret {@code s3_access_key}
 * is read from property {@code conveyor.secrets.s3_access_key}, which can
 * come from application.yml, a system property or an environment variable.
 */
@Component
public class PropertySecretStore implements SecretStore {

    static final String PREFIX = "conveyor.secrets.";

    private final Environment environment;

    public PropertySecretStore(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> resolve(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(environment.getProperty(PREFIX + name));
    }
}
