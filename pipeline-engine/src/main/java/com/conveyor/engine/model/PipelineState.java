package com.conveyor.engine.model;

/**
 * Execution state of one pipeline instance within a run.
 *
 * Transitions:
 *   PENDING  → ELIGIBLE  (all dependencies SUCCEEDED and the trigger matched)
 *   PENDING  → SKIPPED   (trigger did not match, or the run is blocked)
 *   ELIGIBLE → RUNNING   (a concurrency slot was free)
 *   RUNNING  → SUCCEEDED (every non-skipped step exited 0)
 *   RUNNING  → FAILED    (a step exited non-zero or could not be run)
 *
 * SUCCEEDED, FAILED and SKIPPED are terminal.
 */
public enum PipelineState {
    PENDING,
    ELIGIBLE,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(PipelineState next) {
        return switch (this) {
            case PENDING  -> next == ELIGIBLE || next == SKIPPED;
            case ELIGIBLE -> next == RUNNING || next == SKIPPED;
            case RUNNING  -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }
}
