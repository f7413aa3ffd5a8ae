package com.conveyor.engine.service;

/**
 * Lifecycle of a submitted run as seen through the API.
 *
 *   RUNNING   → SUCCEEDED (no pipeline failed)
 *   RUNNING   → FAILED    (at least one pipeline failed)
 *   RUNNING   → ABORTED   (the scheduler itself crashed)
 */
public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABORTED
}
