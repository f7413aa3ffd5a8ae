package com.conveyor.engine.backend;

/**
 * Thrown when the step runner returns an error or is unreachable.
 */
public class ExecutionBackendException extends RuntimeException {

    public ExecutionBackendException(String message) {
        super(message);
    }

    public ExecutionBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
