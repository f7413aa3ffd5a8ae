package com.conveyor.engine.scheduler;

import com.conveyor.engine.model.PipelineState;

import java.time.Instant;
import java.util.List;

/**
 * Terminal state of one pipeline instance in a run.
 *
 * @param reason    failure message or skip reason; null on success
 * @param blockedBy for pipelines skipped because a dependency did not
 *                  succeed, the name of that dependency
 */
public record PipelineOutcome(
        String            name,
        String            templateName,
        PipelineState     state,
        String            reason,
        String            blockedBy,
        List<StepOutcome> steps,
        Instant           startedAt,
        Instant           finishedAt) {

    public PipelineOutcome {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
