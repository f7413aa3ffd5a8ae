package com.conveyor.engine.service;

import com.conveyor.engine.compile.DependencyGraph;
import com.conveyor.engine.compile.GraphCompiler;
import com.conveyor.engine.history.BuildHistoryStore;
import com.conveyor.engine.model.BuildStatus;
import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.model.PipelineTemplate;
import com.conveyor.engine.scheduler.PipelineOutcome;
import com.conveyor.engine.scheduler.RunReport;
import com.conveyor.engine.scheduler.RunScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

/**
 * Compiles, evaluates and runs pipeline graphs on behalf of the API.
 *
 * Compilation happens on the caller's thread, so configuration errors are
 * reported synchronously and nothing is scheduled. The run itself goes to
 * a bounded pool; the caller gets the run id right away and polls.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final GraphCompiler          compiler;
    private final RunScheduler           scheduler;
    private final BuildHistoryStore      history;
    private final Executor               runWorkers;
    private final int                    retainedRuns;
    private final Map<UUID, RunTracker>  active = new ConcurrentHashMap<>();

    // Finished runs that history cannot answer for (aborted, or the write
    // failed). Oldest first; trimmed to retainedRuns.
    private final Map<UUID, RunTracker>  unrecorded      = new ConcurrentHashMap<>();
    private final Queue<UUID>            unrecordedOrder = new ConcurrentLinkedQueue<>();

    @Autowired
    public RunService(GraphCompiler compiler,
                      RunScheduler scheduler,
                      BuildHistoryStore history,
                      @Value("${conveyor.scheduler.run-workers:2}") int runWorkers,
                      @Value("${conveyor.scheduler.retained-runs:100}") int retainedRuns) {
        this(compiler, scheduler, history, Executors.newFixedThreadPool(runWorkers), retainedRuns);
    }

    RunService(GraphCompiler compiler, RunScheduler scheduler, BuildHistoryStore history,
               Executor runWorkers, int retainedRuns) {
        this.compiler     = compiler;
        this.scheduler    = scheduler;
        this.history      = history;
        this.runWorkers   = runWorkers;
        this.retainedRuns = retainedRuns;
    }

    // ------------------------------------------------------------------
    // Evaluation
    // ------------------------------------------------------------------

    /**
     * Which pipelines an event would run, without running anything.
     *
     * @throws com.conveyor.engine.compile.PipelineConfigException if the templates do not compile
     */
    public List<Pipeline> evaluate(List<PipelineTemplate> templates, Map<String, String> variables, Event event) {
        DependencyGraph graph = compiler.compile(templates, variables);
        return compiler.evaluate(graph, withPriorStatus(event));
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Compile the templates and start a run for {@code event}.
     *
     * @throws com.conveyor.engine.compile.PipelineConfigException before anything is scheduled
     */
    public RunView submit(List<PipelineTemplate> templates, Map<String, String> variables, Event event) {
        DependencyGraph graph = compiler.compile(templates, variables);
        Event effective = withPriorStatus(event);

        UUID runId = UUID.randomUUID();
        RunTracker tracker = new RunTracker(runId, graph.pipelines());
        active.put(runId, tracker);
        log.info("Run {} accepted: {} pipeline(s) for {} {}", runId, graph.size(), effective.type(), effective.ref());

        runWorkers.execute(() -> execute(tracker, graph, effective));
        return tracker.view();
    }

    private void execute(RunTracker tracker, DependencyGraph graph, Event event) {
        RunReport report;
        try {
            report = scheduler.execute(tracker.runId(), graph, event, tracker);
        } catch (RuntimeException e) {
            log.error("Run {} aborted: {}", tracker.runId(), e.getMessage(), e);
            tracker.abort("Run aborted: " + e.getMessage());
            retain(tracker);
            return;
        }
        tracker.complete(report);
        try {
            history.record(report);
            // History now answers for this run.
            active.remove(tracker.runId());
        } catch (RuntimeException e) {
            log.warn("Could not record run {} in build history, keeping it in memory: {}",
                    tracker.runId(), e.getMessage());
            retain(tracker);
        }
    }

    private void retain(RunTracker tracker) {
        unrecorded.put(tracker.runId(), tracker);
        unrecordedOrder.add(tracker.runId());
        active.remove(tracker.runId());
        while (unrecordedOrder.size() > retainedRuns) {
            UUID oldest = unrecordedOrder.poll();
            if (oldest == null) break;
            unrecorded.remove(oldest);
            log.debug("Dropped unrecorded run {} from memory", oldest);
        }
    }

    int liveRuns() {
        return active.size();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<RunView> find(UUID runId) {
        RunTracker tracker = active.get(runId);
        if (tracker == null) {
            tracker = unrecorded.get(runId);
        }
        if (tracker != null) {
            return Optional.of(tracker.view());
        }
        List<PipelineOutcome> recorded = history.findRun(runId);
        if (recorded.isEmpty()) {
            return Optional.empty();
        }
        RunStatus status = recorded.stream().anyMatch(p -> p.state() == PipelineState.FAILED)
                ? RunStatus.FAILED
                : RunStatus.SUCCEEDED;
        Instant started = recorded.stream().map(PipelineOutcome::startedAt)
                .filter(t -> t != null).min(Instant::compareTo).orElse(null);
        Instant finished = recorded.stream().map(PipelineOutcome::finishedAt)
                .filter(t -> t != null).max(Instant::compareTo).orElse(null);
        return Optional.of(toView(runId, status, started, finished, recorded));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Fill in the prior status from the branch's last recorded run when the caller left it out. */
    private Event withPriorStatus(Event event) {
        if (event.priorStatus() != null) return event;
        Optional<BuildStatus> latest;
        try {
            latest = history.latestStatus(event.branch());
        } catch (RuntimeException e) {
            log.warn("Build history unavailable, assuming prior status success: {}", e.getMessage());
            return event;
        }
        return latest.map(event::withPriorStatus).orElse(event);
    }

    static RunView toView(UUID runId, RunStatus status, Instant startedAt, Instant finishedAt,
                          List<PipelineOutcome> outcomes) {
        return new RunView(runId, status, startedAt, finishedAt, outcomes.stream()
                .map(p -> new RunView.PipelineView(p.name(), p.state(), p.reason(), p.blockedBy()))
                .toList());
    }
}
