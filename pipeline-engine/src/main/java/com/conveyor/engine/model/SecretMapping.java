package com.conveyor.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;
import java.util.Map;

/**
 * Step-level secret exposed as an environment variable.
 *
 * JSON form: a secret name ({@code "docker_password"}, exposed as
 * {@code DOCKER_PASSWORD}) or {@code {"source": "name", "target": "VAR"}}.
 */
public record SecretMapping(String source, String target) {

    public SecretMapping {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Secret mapping needs a source secret name");
        }
        if (target == null || target.isBlank()) target = source.toUpperCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SecretMapping fromJson(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            Object source = map.get("source");
            Object target = map.get("target");
            return new SecretMapping(source == null ? null : source.toString(),
                    target == null ? null : target.toString());
        }
        return new SecretMapping(raw == null ? null : raw.toString(), null);
    }
}
