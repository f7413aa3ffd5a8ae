package com.conveyor.engine.service;

import com.conveyor.engine.model.PipelineState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Point-in-time view of a run, live or from history.
 */
public record RunView(
        UUID               runId,
        RunStatus          status,
        Instant            startedAt,
        Instant            finishedAt,
        List<PipelineView> pipelines) {

    public RunView {
        pipelines = pipelines == null ? List.of() : List.copyOf(pipelines);
    }

    /**
     * @param blockedBy dependency that kept a skipped pipeline from running
     */
    public record PipelineView(String name, PipelineState state, String reason, String blockedBy) {}
}
