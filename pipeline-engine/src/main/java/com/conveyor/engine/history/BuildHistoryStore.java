package com.conveyor.engine.history;

import com.conveyor.engine.model.BuildStatus;
import com.conveyor.engine.scheduler.PipelineOutcome;
import com.conveyor.engine.scheduler.RunReport;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Where finished runs are remembered. The scheduler itself keeps nothing
 * across runs; later events consult this store for the previous build's
 * status.
 */
public interface BuildHistoryStore {

    void record(RunReport report);

    /** Pipeline outcomes of a finished run in topological order; empty if unknown. Step detail is not kept. */
    List<PipelineOutcome> findRun(UUID runId);

    /** Status of the most recently recorded run on {@code branch}. */
    Optional<BuildStatus> latestStatus(String branch);
}
