package com.conveyor.engine.scheduler;

import com.conveyor.engine.model.BuildStatus;
import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.PipelineState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything a finished run produced: one outcome per pipeline, in
 * topological order.
 */
public record RunReport(
        UUID                  runId,
        Event                 event,
        List<PipelineOutcome> pipelines,
        Instant               startedAt,
        Instant               finishedAt) {

    public RunReport {
        pipelines = pipelines == null ? List.of() : List.copyOf(pipelines);
    }

    /** FAILURE if any pipeline failed; skipped pipelines do not fail a run. */
    public BuildStatus status() {
        return pipelines.stream().anyMatch(p -> p.state() == PipelineState.FAILED)
                ? BuildStatus.FAILURE
                : BuildStatus.SUCCESS;
    }

    public Optional<PipelineOutcome> pipeline(String name) {
        return pipelines.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public Map<String, PipelineState> states() {
        Map<String, PipelineState> states = new LinkedHashMap<>();
        pipelines.forEach(p -> states.put(p.name(), p.state()));
        return states;
    }
}
