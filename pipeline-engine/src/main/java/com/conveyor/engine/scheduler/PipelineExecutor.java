package com.conveyor.engine.scheduler;

import com.conveyor.engine.backend.ExecutionBackend;
import com.conveyor.engine.backend.ExitStatus;
import com.conveyor.engine.backend.SecretStore;
import com.conveyor.engine.backend.StepInvocation;
import com.conveyor.engine.model.EnvValue;
import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.model.Step;
import com.conveyor.engine.model.StepState;
import com.conveyor.engine.trigger.TriggerDecision;
import com.conveyor.engine.trigger.TriggerEvaluator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Runs the steps of one pipeline.
 *
 * Steps are cut into stages: consecutive steps sharing a group tag form one
 * stage and run concurrently on the step pool; every other step is a stage
 * of its own and runs on the calling thread. Stages run strictly in order,
 * each starting only after the previous one has fully finished.
 *
 * Fail-fast: the first failing step cancels its running siblings, and no
 * later stage starts. Steps whose condition does not match are SKIPPED and
 * do not count against the pipeline.
 */
final class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    /** What running a pipeline's steps produced. */
    record Result(PipelineState state, String reason, List<StepOutcome> steps) {}

    private final ExecutionBackend backend;
    private final SecretStore      secrets;
    private final TriggerEvaluator triggers;
    private final ExecutorService  stepPool;
    private final MeterRegistry    meters;

    PipelineExecutor(ExecutionBackend backend,
                     SecretStore secrets,
                     TriggerEvaluator triggers,
                     ExecutorService stepPool,
                     MeterRegistry meters) {
        this.backend  = backend;
        this.secrets  = secrets;
        this.triggers = triggers;
        this.stepPool = stepPool;
        this.meters   = meters;
    }

    /**
     * Blocks until every stage has finished or one has failed.
     *
     * @param currentEvent the run's event with its status as of now; read
     *                     again before each stage so step conditions see
     *                     failures elsewhere in the run
     */
    Result run(UUID runId, Pipeline pipeline, Supplier<Event> currentEvent, RunListener listener) {
        Map<String, StepOutcome> outcomes = new ConcurrentHashMap<>();
        StepExecutionException failure = null;

        for (List<Step> stage : stages(pipeline.steps())) {
            if (failure != null) {
                for (Step step : stage) {
                    outcomes.put(step.name(), StepOutcome.cancelled(step.name(), "Not started: an earlier step failed"));
                    notify(listener, runId, pipeline, step, StepState.CANCELLED);
                }
                continue;
            }

            Event event = currentEvent.get();
            List<Step> runnable = new ArrayList<>(stage.size());
            for (Step step : stage) {
                TriggerDecision decision = triggers.evaluate(step.when(), event);
                if (decision.eligible()) {
                    runnable.add(step);
                } else {
                    log.info("Skipping step '{}' of pipeline '{}': {}", step.name(), pipeline.name(), decision.diagnostic());
                    outcomes.put(step.name(), StepOutcome.skipped(step.name(), decision.diagnostic()));
                    notify(listener, runId, pipeline, step, StepState.SKIPPED);
                }
            }

            try {
                if (runnable.size() == 1) {
                    Step only = runnable.get(0);
                    outcomes.put(only.name(), runStep(runId, pipeline, only, listener));
                } else if (runnable.size() > 1) {
                    runConcurrently(runId, pipeline, runnable, listener, outcomes);
                }
            } catch (StepExecutionException e) {
                outcomes.put(e.getOutcome().name(), e.getOutcome());
                failure = e;
            }
        }

        List<StepOutcome> ordered = new ArrayList<>(pipeline.steps().size());
        for (Step step : pipeline.steps()) {
            ordered.add(outcomes.get(step.name()));
        }
        return failure == null
                ? new Result(PipelineState.SUCCEEDED, null, ordered)
                : new Result(PipelineState.FAILED, failure.getMessage(), ordered);
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    static List<List<Step>> stages(List<Step> steps) {
        List<List<Step>> stages = new ArrayList<>();
        List<Step> current = null;
        String currentGroup = null;
        for (Step step : steps) {
            if (step.isGrouped() && current != null && step.group().equals(currentGroup)) {
                current.add(step);
                continue;
            }
            current = new ArrayList<>();
            current.add(step);
            stages.add(current);
            currentGroup = step.group();
        }
        return stages;
    }

    private void runConcurrently(UUID runId, Pipeline pipeline, List<Step> steps,
                                 RunListener listener, Map<String, StepOutcome> outcomes) {
        CompletionService<StepOutcome> completion = new ExecutorCompletionService<>(stepPool);
        Map<Future<StepOutcome>, Step> pending = new HashMap<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        for (Step step : steps) {
            pending.put(completion.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return runStep(runId, pipeline, step, listener);
                } finally {
                    MDC.clear();
                }
            }), step);
        }

        StepExecutionException failure = null;
        try {
            while (!pending.isEmpty() && failure == null) {
                Future<StepOutcome> done = completion.take();
                Step step = pending.remove(done);
                try {
                    outcomes.put(step.name(), done.get());
                } catch (ExecutionException e) {
                    failure = asStepFailure(pipeline, step, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new StepExecutionException(
                    StepOutcome.cancelled(steps.get(0).name(), "Interrupted"),
                    "Interrupted while waiting for steps of pipeline '" + pipeline.name() + "'", e);
        }

        if (failure != null) {
            for (Map.Entry<Future<StepOutcome>, Step> entry : pending.entrySet()) {
                entry.getKey().cancel(true);
                Step sibling = entry.getValue();
                outcomes.putIfAbsent(sibling.name(), StepOutcome.cancelled(sibling.name(),
                        "Cancelled: step '" + failure.getOutcome().name() + "' failed"));
                notify(listener, runId, pipeline, sibling, StepState.CANCELLED);
            }
            throw failure;
        }
    }

    private static StepExecutionException asStepFailure(Pipeline pipeline, Step step, Throwable cause) {
        if (cause instanceof StepExecutionException stepFailure) {
            return stepFailure;
        }
        StepOutcome outcome = new StepOutcome(step.name(), StepState.FAILED, null,
                String.valueOf(cause), null, Instant.now());
        return new StepExecutionException(outcome,
                "Step '" + step.name() + "' of pipeline '" + pipeline.name() + "' crashed: " + cause, cause);
    }

    // ------------------------------------------------------------------
    // Single step
    // ------------------------------------------------------------------

    private StepOutcome runStep(UUID runId, Pipeline pipeline, Step step, RunListener listener) {
        MDC.put("step", step.name());
        Instant started = Instant.now();
        notify(listener, runId, pipeline, step, StepState.RUNNING);

        Timer.Sample sample = Timer.start(meters);
        String status = "success";
        try {
            StepInvocation invocation = new StepInvocation(runId, pipeline.name(), step.name(),
                    pipeline.platform(), step.image(), step.commands(),
                    resolveEnvironment(pipeline, step, started, listener, runId));

            ExitStatus exit;
            try {
                exit = backend.runStep(invocation);
            } catch (RuntimeException e) {
                throw failed(runId, pipeline, step, started, null,
                        "could not be run: " + e.getMessage(), listener, e);
            }
            if (!exit.success()) {
                throw failed(runId, pipeline, step, started, exit.exitCode(),
                        "exited with code " + exit.exitCode(), listener, null);
            }

            StepOutcome outcome = new StepOutcome(step.name(), StepState.SUCCEEDED, exit.exitCode(),
                    null, started, Instant.now());
            notify(listener, runId, pipeline, step, StepState.SUCCEEDED);
            log.info("Step '{}' of pipeline '{}' succeeded", step.name(), pipeline.name());
            return outcome;
        } catch (StepExecutionException e) {
            status = "failure";
            throw e;
        } finally {
            sample.stop(meters.timer("conveyor.step.duration", "status", status));
            MDC.remove("step");
        }
    }

    /** Secret values are looked up here, immediately before the step runs, and nowhere else. */
    private Map<String, String> resolveEnvironment(Pipeline pipeline, Step step, Instant started,
                                                   RunListener listener, UUID runId) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, EnvValue> entry : step.environment().entrySet()) {
            EnvValue value = entry.getValue();
            if (!value.isSecret()) {
                resolved.put(entry.getKey(), value.value());
                continue;
            }
            String secret = secrets.resolve(value.secret()).orElse(null);
            if (secret == null) {
                throw failed(runId, pipeline, step, started, null,
                        "needs secret '" + value.secret() + "', which is not available", listener, null);
            }
            resolved.put(entry.getKey(), secret);
        }
        return resolved;
    }

    private StepExecutionException failed(UUID runId, Pipeline pipeline, Step step, Instant started,
                                          Integer exitCode, String detail, RunListener listener, Throwable cause) {
        String message = "Step '" + step.name() + "' of pipeline '" + pipeline.name() + "' " + detail;
        log.warn(message);
        StepOutcome outcome = new StepOutcome(step.name(), StepState.FAILED, exitCode, detail, started, Instant.now());
        if (!Thread.currentThread().isInterrupted()) {
            notify(listener, runId, pipeline, step, StepState.FAILED);
        }
        return new StepExecutionException(outcome, message, cause);
    }

    private static void notify(RunListener listener, UUID runId, Pipeline pipeline, Step step, StepState state) {
        try {
            listener.stepTransition(runId, pipeline.name(), step.name(), state);
        } catch (RuntimeException e) {
            log.warn("Run listener failed on step {} -> {}: {}", step.name(), state, e.getMessage(), e);
        }
    }
}
