package com.conveyor.engine.scheduler;

import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.model.StepState;

import java.util.UUID;

/**
 * Observer of state transitions during a run.
 *
 * Pipeline transitions are delivered from the run's coordinating thread in
 * the order they happen. Step transitions arrive from worker threads, so
 * implementations must be thread-safe.
 */
public interface RunListener {

    RunListener NOOP = new RunListener() {};

    default void pipelineTransition(UUID runId, String pipeline, PipelineState from, PipelineState to) {}

    default void stepTransition(UUID runId, String pipeline, String step, StepState state) {}
}
