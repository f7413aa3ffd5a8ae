package com.conveyor.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Atomic unit of execution: a container image, the commands run in it,
 * its environment and an optional condition.
 *
 * Consecutive steps with the same group tag run concurrently; a step
 * without a group runs alone, after everything declared before it.
 */
public record Step(
        String                name,
        String                image,
        List<String>          commands,
        Map<String, EnvValue> environment,
        String                group,
        TriggerPredicate      when) {

    public Step {
        commands    = commands == null ? List.of() : List.copyOf(commands);
        environment = environment == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        if (group != null && group.isBlank()) group = null;
        if (when == null) when = TriggerPredicate.ALWAYS;
    }

    /**
     * JSON entry point. Entries under {@code secrets} become secret
     * references in the environment under their target name.
     */
    @JsonCreator
    public static Step fromJson(@JsonProperty("name")        String name,
                                @JsonProperty("image")       String image,
                                @JsonProperty("commands")    List<String> commands,
                                @JsonProperty("environment") Map<String, EnvValue> environment,
                                @JsonProperty("group")       String group,
                                @JsonProperty("when")        TriggerPredicate when,
                                @JsonProperty("secrets")     List<SecretMapping> secrets) {
        if (secrets == null || secrets.isEmpty()) {
            return new Step(name, image, commands, environment, group, when);
        }
        Map<String, EnvValue> merged = environment == null ? new LinkedHashMap<>() : new LinkedHashMap<>(environment);
        for (SecretMapping secret : secrets) {
            if (merged.putIfAbsent(secret.target(), EnvValue.secret(secret.source())) != null) {
                throw new IllegalArgumentException(
                        "Step '" + name + "' sets " + secret.target() + " in both environment and secrets");
            }
        }
        return new Step(name, image, commands, merged, group, when);
    }

    public static Step of(String name, String image, String... commands) {
        return new Step(name, image, List.of(commands), null, null, null);
    }

    public boolean isGrouped() {
        return group != null;
    }

    public Step inGroup(String newGroup) {
        return new Step(name, image, commands, environment, newGroup, when);
    }

    public Step withEnvironment(Map<String, EnvValue> newEnvironment) {
        return new Step(name, image, commands, newEnvironment, group, when);
    }

    public Step withWhen(TriggerPredicate newWhen) {
        return new Step(name, image, commands, environment, group, newWhen);
    }

    public Step withImageAndCommands(String newImage, List<String> newCommands) {
        return new Step(name, newImage, newCommands, environment, group, when);
    }
}
