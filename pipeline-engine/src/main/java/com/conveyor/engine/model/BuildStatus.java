package com.conveyor.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Aggregate status of a build, as seen by trigger conditions.
 *
 * SUCCESS while nothing has failed, FAILURE afterwards.
 */
public enum BuildStatus {
    SUCCESS,
    FAILURE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BuildStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Build status must not be blank");
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
