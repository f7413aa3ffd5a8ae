package com.conveyor.engine.scheduler;

import com.conveyor.engine.model.StepState;

import java.time.Instant;

/**
 * Final state of one step in a run.
 *
 * @param exitCode null unless the backend reported one
 * @param detail   why the step failed, was skipped or was cancelled
 */
public record StepOutcome(
        String    name,
        StepState state,
        Integer   exitCode,
        String    detail,
        Instant   startedAt,
        Instant   finishedAt) {

    static StepOutcome skipped(String name, String detail) {
        return new StepOutcome(name, StepState.SKIPPED, null, detail, null, null);
    }

    static StepOutcome cancelled(String name, String detail) {
        return new StepOutcome(name, StepState.CANCELLED, null, detail, null, Instant.now());
    }
}
