package com.conveyor.engine.compile;

/**
 * Thrown when pipeline definitions cannot be compiled into a graph.
 *
 * Always raised before anything runs: a graph that fails to compile is
 * never scheduled, not even partially.
 */
public class PipelineConfigException extends RuntimeException {

    public enum Kind {
        UNRESOLVED_PLACEHOLDER,
        EMPTY_AXIS,
        DUPLICATE_AXIS,
        MISSING_DEPENDENCY,
        DEPENDENCY_CYCLE,
        DUPLICATE_PIPELINE,
        DUPLICATE_STEP,
        INVALID_DEFINITION
    }

    private final Kind kind;

    public PipelineConfigException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
