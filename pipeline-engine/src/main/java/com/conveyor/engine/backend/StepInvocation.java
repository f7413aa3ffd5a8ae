package com.conveyor.engine.backend;

import com.conveyor.engine.model.Platform;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A step ready to run: placeholders substituted and secrets resolved.
 *
 * Holds secret values, so it lives only for the duration of one
 * {@link ExecutionBackend#runStep} call and {@link #toString()} prints
 * variable names only.
 */
public record StepInvocation(
        UUID                runId,
        String              pipeline,
        String              step,
        Platform            platform,
        String              image,
        List<String>        commands,
        Map<String, String> environment) {

    public StepInvocation {
        commands    = commands == null ? List.of() : List.copyOf(commands);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    @Override
    public String toString() {
        return "StepInvocation[run=" + runId + ", pipeline=" + pipeline + ", step=" + step
                + ", platform=" + platform + ", image=" + image
                + ", commands=" + commands.size() + ", env=" + environment.keySet() + "]";
    }
}
