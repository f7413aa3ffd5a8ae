package com.conveyor.engine.backend;

/**
 * Runs one step's container and reports its exit status.
 *
 * The only outward call the scheduler makes per step. Implementations
 * block until the step finishes; the scheduler calls them from its worker
 * pools.
 */
public interface ExecutionBackend {

    /**
     * @throws ExecutionBackendException if the step could not be run at all
     *         (runner unreachable, bad response); the scheduler fails the step
     */
    ExitStatus runStep(StepInvocation invocation);
}
