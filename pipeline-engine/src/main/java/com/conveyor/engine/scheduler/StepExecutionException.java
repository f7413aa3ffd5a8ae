package com.conveyor.engine.scheduler;

/**
 * A step that exited non-zero or could not be started.
 *
 * Recoverable at pipeline granularity: it fails the pipeline that owns the
 * step and nothing else. Dependents are held back by the dependency graph,
 * not by this exception.
 */
public class StepExecutionException extends RuntimeException {

    private final StepOutcome outcome;

    public StepExecutionException(StepOutcome outcome, String message) {
        super(message);
        this.outcome = outcome;
    }

    public StepExecutionException(StepOutcome outcome, String message, Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
    }

    public StepOutcome getOutcome() { return outcome; }
}
