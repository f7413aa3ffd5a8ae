package com.conveyor.engine.model;

/**
 * Execution state of a single step inside a running pipeline.
 *
 * Transitions:
 *   PENDING → RUNNING   (handed to the execution backend)
 *   PENDING → SKIPPED   (its when-condition did not match)
 *   PENDING → CANCELLED (an earlier or sibling step failed)
 *   RUNNING → SUCCEEDED / FAILED / CANCELLED
 */
public enum StepState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    CANCELLED
}
