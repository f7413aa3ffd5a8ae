package com.conveyor.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of repository event that can start a run.
 *
 * Serialized in lower case ("pull_request"), which is how trigger
 * conditions name events.
 */
public enum EventType {
    PUSH,
    PULL_REQUEST,
    TAG,
    MANUAL,
    CRON,
    DEPLOYMENT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts "pull_request", "pull-request" and "PULL_REQUEST". */
    @JsonCreator
    public static EventType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        return valueOf(value.strip().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
