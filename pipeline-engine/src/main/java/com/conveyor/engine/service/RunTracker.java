package com.conveyor.engine.service;

import com.conveyor.engine.model.BuildStatus;
import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.scheduler.RunListener;
import com.conveyor.engine.scheduler.RunReport;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live state of one in-flight run, fed by scheduler transitions and read
 * by API threads.
 */
class RunTracker implements RunListener {

    private final UUID                       runId;
    private final List<String>               order;
    private final Map<String, PipelineState> states = new ConcurrentHashMap<>();
    private final Instant                    startedAt = Instant.now();
    private volatile RunReport               report;
    private volatile String                  abortReason;

    RunTracker(UUID runId, List<Pipeline> pipelines) {
        this.runId = runId;
        this.order = pipelines.stream().map(Pipeline::name).toList();
        order.forEach(name -> states.put(name, PipelineState.PENDING));
    }

    UUID runId() { return runId; }

    @Override
    public void pipelineTransition(UUID id, String pipeline, PipelineState from, PipelineState to) {
        states.put(pipeline, to);
    }

    void complete(RunReport finished) {
        this.report = finished;
    }

    void abort(String reason) {
        this.abortReason = reason;
    }

    RunView view() {
        RunReport done = report;
        if (done != null) {
            return RunService.toView(runId, done.status() == BuildStatus.FAILURE ? RunStatus.FAILED : RunStatus.SUCCEEDED,
                    done.startedAt(), done.finishedAt(), done.pipelines());
        }
        RunStatus status = abortReason == null ? RunStatus.RUNNING : RunStatus.ABORTED;
        List<RunView.PipelineView> pipelines = order.stream()
                .map(name -> new RunView.PipelineView(name, states.get(name),
                        status == RunStatus.ABORTED ? abortReason : null, null))
                .toList();
        return new RunView(runId, status, startedAt, null, pipelines);
    }
}
