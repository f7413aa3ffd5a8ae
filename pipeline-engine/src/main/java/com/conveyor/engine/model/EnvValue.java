package com.conveyor.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Map;

/**
 * Value of a step environment variable: either a literal or a reference to
 * a named secret.
 *
 * Secret references carry only the secret's name. The value is looked up
 * by the scheduler right before the step runs and is never stored here.
 *
 * JSON form: a plain scalar for literals, {@code {"from_secret": "name"}}
 * for secrets.
 */
public record EnvValue(String value, String secret) {

    public EnvValue {
        if ((value == null) == (secret == null)) {
            throw new IllegalArgumentException("Exactly one of value or secret must be set");
        }
    }

    public static EnvValue literal(String value) {
        return new EnvValue(value, null);
    }

    public static EnvValue secret(String name) {
        return new EnvValue(null, name);
    }

    public boolean isSecret() {
        return secret != null;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EnvValue fromJson(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            Object name = map.get("from_secret");
            if (name == null || name.toString().isBlank()) {
                throw new IllegalArgumentException("Environment object must name a secret with 'from_secret'");
            }
            return secret(name.toString());
        }
        return literal(raw == null ? "" : raw.toString());
    }

    @Override
    public String toString() {
        return isSecret() ? "secret:" + secret : value;
    }
}
