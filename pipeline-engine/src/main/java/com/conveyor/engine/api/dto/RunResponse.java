package com.conveyor.engine.api.dto;

import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.service.RunView;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 * Skipped pipelines carry the reason and, when a dependency held them
 * back, its name in blockedBy.
 */
public record RunResponse(
        UUID                   id,
        String                 status,
        Instant                startedAt,
        Instant                finishedAt,
        List<PipelineResponse> pipelines
) {
    public record PipelineResponse(String name, PipelineState state, String reason, String blockedBy) {}

    public static RunResponse from(RunView run) {
        return new RunResponse(
                run.runId(),
                run.status().name(),
                run.startedAt(),
                run.finishedAt(),
                run.pipelines().stream()
                        .map(p -> new PipelineResponse(p.name(), p.state(), p.reason(), p.blockedBy()))
                        .toList()
        );
    }
}
