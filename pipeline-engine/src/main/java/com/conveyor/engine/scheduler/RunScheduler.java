package com.conveyor.engine.scheduler;

import com.conveyor.engine.backend.ExecutionBackend;
import com.conveyor.engine.backend.SecretStore;
import com.conveyor.engine.compile.DependencyGraph;
import com.conveyor.engine.model.BuildStatus;
import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.trigger.TriggerDecision;
import com.conveyor.engine.trigger.TriggerEvaluator;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;

/**
 * Executes a compiled graph for one event.
 *
 * Each run is driven by a single coordinating thread (the caller of
 * {@link #execute}) that owns every pipeline state. Pipelines run on the
 * pipeline pool and report back through a completion queue, so state
 * changes never race:
 *
 * <pre>
 *   loop:
 *     promote  PENDING  → ELIGIBLE | SKIPPED   (dependencies done, trigger checked)
 *     start    ELIGIBLE → RUNNING              (if the concurrency group has a slot)
 *     nothing running?  → remaining PENDING → SKIPPED (blocked), done
 *     wait for one completion, RUNNING → SUCCEEDED | FAILED
 * </pre>
 *
 * A failed or skipped pipeline never lets its dependents become ELIGIBLE;
 * they stay PENDING until nothing else can make progress, then are skipped
 * with the blocking dependency recorded. Unrelated pipelines keep running.
 *
 * Pipeline triggers are checked against the submitted event. Step
 * conditions see the run's status as it is when their stage starts.
 */
@Component
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final TriggerEvaluator triggers;
    private final MeterRegistry    meters;
    private final ExecutorService  pipelineWorkers;
    private final ExecutorService  stepWorkers;
    private final PipelineExecutor executor;

    public RunScheduler(ExecutionBackend backend,
                        SecretStore secrets,
                        TriggerEvaluator triggers,
                        MeterRegistry meters,
                        @Value("${conveyor.scheduler.pipeline-workers:4}") int pipelineWorkers,
                        @Value("${conveyor.scheduler.step-workers:8}") int stepWorkers) {
        this.triggers        = triggers;
        this.meters          = meters;
        this.pipelineWorkers = Executors.newFixedThreadPool(pipelineWorkers);
        this.stepWorkers     = Executors.newFixedThreadPool(stepWorkers);
        this.executor        = new PipelineExecutor(backend, secrets, triggers, this.stepWorkers, meters);
    }

    public RunReport execute(DependencyGraph graph, Event event) {
        return execute(UUID.randomUUID(), graph, event, RunListener.NOOP);
    }

    /**
     * Run every pipeline of {@code graph} that the event and the outcomes
     * of its dependencies allow. Blocks until each pipeline is terminal.
     */
    public RunReport execute(UUID runId, DependencyGraph graph, Event event, RunListener listener) {
        MDC.put("runId", runId.toString());
        try {
            log.info("Starting run {} for {} {} over {} pipeline(s)",
                    runId, event.type(), event.ref(), graph.size());
            RunReport report = new Run(runId, graph, event, listener).drive();
            log.info("Run {} finished with status {}: {}", runId, report.status(), report.states());
            return report;
        } finally {
            MDC.remove("runId");
        }
    }

    @PreDestroy
    public void shutdown() {
        pipelineWorkers.shutdownNow();
        stepWorkers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // One run
    // ------------------------------------------------------------------

    private record Completion(int node, PipelineExecutor.Result result) {}

    private final class Run {
        private final UUID               runId;
        private final DependencyGraph    graph;
        private final Event              event;
        private final RunListener        listener;
        private final int[]              order;
        private final PipelineState[]    states;
        private final String[]           reasons;
        private final String[]           blockedBy;
        private final List<List<StepOutcome>> steps;
        private final Instant[]          startedAt;
        private final Instant[]          finishedAt;
        private final ConcurrencyLimiter limiter     = new ConcurrencyLimiter();
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final Instant            runStartedAt = Instant.now();
        private volatile boolean         failed;
        private int                      running;

        Run(UUID runId, DependencyGraph graph, Event event, RunListener listener) {
            this.runId      = runId;
            this.graph      = graph;
            this.event      = event;
            this.listener   = listener;
            this.order      = graph.topologicalOrder();
            this.states     = new PipelineState[graph.size()];
            this.reasons    = new String[graph.size()];
            this.blockedBy  = new String[graph.size()];
            this.steps      = new ArrayList<>();
            this.startedAt  = new Instant[graph.size()];
            this.finishedAt = new Instant[graph.size()];
            for (int i = 0; i < graph.size(); i++) {
                states[i] = PipelineState.PENDING;
                steps.add(List.of());
            }
        }

        RunReport drive() {
            while (true) {
                promote();
                startEligible();
                if (running == 0) {
                    skipBlocked();
                    break;
                }
                Completion completion;
                try {
                    completion = completions.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Run " + runId + " interrupted", e);
                }
                finish(completion);
            }
            return report();
        }

        /** The event as step conditions see it now: FAILURE once anything in this run failed. */
        Event currentEvent() {
            return failed ? event.withPriorStatus(BuildStatus.FAILURE) : event;
        }

        private void promote() {
            for (int node : order) {
                if (states[node] != PipelineState.PENDING || !dependenciesSucceeded(node)) continue;

                Pipeline pipeline = graph.pipeline(node);
                // Pipeline triggers see the event as submitted, so the eligible set never
                // depends on how fast unrelated pipelines fail.
                TriggerDecision decision = triggers.evaluate(pipeline.when(), event);
                if (decision.eligible()) {
                    transition(node, PipelineState.ELIGIBLE);
                } else {
                    reasons[node] = "Trigger not matched: " + decision.diagnostic();
                    finishedAt[node] = Instant.now();
                    transition(node, PipelineState.SKIPPED);
                }
            }
        }

        private void startEligible() {
            for (int node : order) {
                if (states[node] != PipelineState.ELIGIBLE) continue;
                Pipeline pipeline = graph.pipeline(node);
                if (!limiter.tryAcquire(pipeline.concurrency())) {
                    log.debug("Pipeline '{}' waits for a slot in group '{}'",
                            pipeline.name(), pipeline.concurrency().group());
                    continue;
                }
                startedAt[node] = Instant.now();
                transition(node, PipelineState.RUNNING);
                running++;
                try {
                    pipelineWorkers.submit(() -> runPipeline(node, pipeline));
                } catch (RejectedExecutionException e) {
                    log.error("Could not start pipeline '{}': worker pool rejected it", pipeline.name(), e);
                    completions.add(new Completion(node, new PipelineExecutor.Result(
                            PipelineState.FAILED, "Could not be started: scheduler is shutting down", List.of())));
                }
            }
        }

        /** Runs on a pipeline worker; always posts exactly one completion. */
        private void runPipeline(int node, Pipeline pipeline) {
            MDC.put("runId", runId.toString());
            MDC.put("pipeline", pipeline.name());
            PipelineExecutor.Result result;
            try {
                result = executor.run(runId, pipeline, this::currentEvent, listener);
            } catch (RuntimeException e) {
                log.error("Unhandled error in pipeline '{}': {}", pipeline.name(), e.getMessage(), e);
                result = new PipelineExecutor.Result(PipelineState.FAILED, "Unhandled error: " + e.getMessage(), List.of());
            } finally {
                MDC.clear();
            }
            completions.add(new Completion(node, result));
        }

        private void finish(Completion completion) {
            int node = completion.node();
            Pipeline pipeline = graph.pipeline(node);
            running--;
            limiter.release(pipeline.concurrency());

            PipelineExecutor.Result result = completion.result();
            steps.set(node, result.steps());
            reasons[node] = result.reason();
            finishedAt[node] = Instant.now();
            if (result.state() == PipelineState.FAILED) {
                failed = true;
            }
            transition(node, result.state());
        }

        /** Nothing is running and nothing can start: whatever is still waiting never will. */
        private void skipBlocked() {
            for (int node : order) {
                if (states[node] == PipelineState.PENDING || states[node] == PipelineState.ELIGIBLE) {
                    int blocker = firstUnsuccessfulDependency(node);
                    if (blocker >= 0) {
                        blockedBy[node] = graph.pipeline(blocker).name();
                        reasons[node] = "Blocked by dependency '" + blockedBy[node] + "' ("
                                + states[blocker] + ")";
                    } else {
                        reasons[node] = "No concurrency slot became available";
                    }
                    finishedAt[node] = Instant.now();
                    transition(node, PipelineState.SKIPPED);
                }
            }
        }

        private boolean dependenciesSucceeded(int node) {
            for (int dependency : graph.dependenciesOf(node)) {
                if (states[dependency] != PipelineState.SUCCEEDED) return false;
            }
            return true;
        }

        private int firstUnsuccessfulDependency(int node) {
            for (int dependency : graph.dependenciesOf(node)) {
                if (states[dependency] != PipelineState.SUCCEEDED) return dependency;
            }
            return -1;
        }

        private void transition(int node, PipelineState to) {
            PipelineState from = states[node];
            if (!from.canTransitionTo(to)) {
                throw new IllegalStateException("Illegal transition " + from + " -> " + to
                        + " for pipeline '" + graph.pipeline(node).name() + "'");
            }
            states[node] = to;
            String name = graph.pipeline(node).name();
            if (to.isTerminal()) {
                meters.counter("conveyor.pipeline.outcomes", "state", to.name().toLowerCase()).increment();
                if (to == PipelineState.SUCCEEDED) {
                    log.info("Pipeline '{}' {}", name, to);
                } else {
                    log.warn("Pipeline '{}' {}: {}", name, to, reasons[node]);
                }
            } else {
                log.debug("Pipeline '{}' {} -> {}", name, from, to);
            }
            try {
                listener.pipelineTransition(runId, name, from, to);
            } catch (RuntimeException e) {
                log.warn("Run listener failed on pipeline {} -> {}: {}", name, to, e.getMessage(), e);
            }
        }

        private RunReport report() {
            List<PipelineOutcome> outcomes = new ArrayList<>(graph.size());
            for (int node : order) {
                Pipeline pipeline = graph.pipeline(node);
                outcomes.add(new PipelineOutcome(pipeline.name(), pipeline.templateName(), states[node],
                        reasons[node], blockedBy[node], steps.get(node), startedAt[node], finishedAt[node]));
            }
            return new RunReport(runId, event, outcomes, runStartedAt, Instant.now());
        }
    }
}
