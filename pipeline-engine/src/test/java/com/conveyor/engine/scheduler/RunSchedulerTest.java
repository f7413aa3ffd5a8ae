package com.conveyor.engine.scheduler;

import com.conveyor.engine.backend.ExecutionBackend;
import com.conveyor.engine.backend.ExitStatus;
import com.conveyor.engine.backend.StepInvocation;
import com.conveyor.engine.compile.DependencyGraph;
import com.conveyor.engine.compile.GraphCompiler;
import com.conveyor.engine.model.BuildStatus;
import com.conveyor.engine.model.ConcurrencyLimit;
import com.conveyor.engine.model.EnvValue;
import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.EventType;
import com.conveyor.engine.model.MatrixAxis;
import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.model.PipelineTemplate;
import com.conveyor.engine.model.Step;
import com.conveyor.engine.model.StepState;
import com.conveyor.engine.model.TriggerCondition;
import com.conveyor.engine.model.TriggerPredicate;
import com.conveyor.engine.trigger.TriggerEvaluator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Runs real compiled graphs through RunScheduler against an in-memory
 * execution backend. Real thread pools; no Spring context.
 */
class RunSchedulerTest {

    private final FakeBackend         backend  = new FakeBackend();
    private final Map<String, String> secrets  = new ConcurrentHashMap<>();
    private final SimpleMeterRegistry meters   = new SimpleMeterRegistry();
    private final GraphCompiler       compiler = new GraphCompiler(new TriggerEvaluator());
    private final RunScheduler        scheduler = new RunScheduler(
            backend, name -> Optional.ofNullable(secrets.get(name)), new TriggerEvaluator(), meters, 4, 4);

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private DependencyGraph compile(PipelineTemplate... templates) {
        return compiler.compile(List.of(templates), Map.of());
    }

    private static PipelineTemplate pipeline(String name, String... dependsOn) {
        return PipelineTemplate.of(name, Step.of("run", "alpine", "true")).dependsOn(dependsOn);
    }

    /** Backend that records every call and applies a configurable behaviour. */
    private static final class FakeBackend implements ExecutionBackend {
        final List<StepInvocation> invocations = new CopyOnWriteArrayList<>();
        final List<String>         timeline    = new CopyOnWriteArrayList<>();
        final Set<String>          failing     = ConcurrentHashMap.newKeySet();
        volatile Function<StepInvocation, ExitStatus> behaviour = inv -> ExitStatus.ok();

        @Override
        public ExitStatus runStep(StepInvocation invocation) {
            invocations.add(invocation);
            timeline.add("start:" + invocation.step());
            try {
                if (failing.contains(invocation.pipeline() + "/" + invocation.step())) {
                    return ExitStatus.of(1);
                }
                return behaviour.apply(invocation);
            } finally {
                timeline.add("end:" + invocation.step());
            }
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ------------------------------------------------------------------
    // Failure propagation
    // ------------------------------------------------------------------

    @Test
    void execute_failedDependency_skipsDependentWithBlocker() {
        backend.failing.add("p1/run");
        DependencyGraph graph = compile(pipeline("p1"), pipeline("p2", "p1"), pipeline("p3"));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        PipelineOutcome p2 = report.pipeline("p2").orElseThrow();
        assertThat(report.pipeline("p1").orElseThrow().state()).isEqualTo(PipelineState.FAILED);
        assertThat(p2.state()).isEqualTo(PipelineState.SKIPPED);
        assertThat(p2.blockedBy()).isEqualTo("p1");
        assertThat(p2.reason()).isEqualTo("Blocked by dependency 'p1' (FAILED)");
        assertThat(report.pipeline("p3").orElseThrow().state()).isEqualTo(PipelineState.SUCCEEDED);
        assertThat(report.status()).isEqualTo(BuildStatus.FAILURE);
        assertThat(backend.invocations).extracting(StepInvocation::pipeline).doesNotContain("p2");
    }

    @Test
    void execute_securityFails_buildsDocsAndNotificationsSkipped() {
        backend.failing.add("security/bandit");
        DependencyGraph graph = compile(
                PipelineTemplate.of("lint", Step.of("check", "python:3.12", "ruff")),
                PipelineTemplate.of("test", Step.of("pytest", "python:${PY}", "pytest"))
                        .dependsOn("lint").withMatrix(MatrixAxis.of("PY", "3.11", "3.12")),
                PipelineTemplate.of("security", Step.of("bandit", "python:3.12", "bandit")).dependsOn("test"),
                PipelineTemplate.of("build-package", Step.of("build", "python:3.12", "poetry build")).dependsOn("security"),
                PipelineTemplate.of("build-container-amd64", Step.of("build", "buildx")).dependsOn("security"),
                PipelineTemplate.of("build-container-arm64", Step.of("build", "buildx")).dependsOn("security"),
                PipelineTemplate.of("docs", Step.of("build", "hugo"))
                        .dependsOn("build-package", "build-container-amd64", "build-container-arm64"),
                PipelineTemplate.of("notifications", Step.of("matrix", "notify")).dependsOn("docs"));

        RunReport report = scheduler.execute(graph, Event.tag("v1.0.0"));

        assertThat(report.states()).containsExactly(
                Map.entry("lint", PipelineState.SUCCEEDED),
                Map.entry("test[PY=3.11]", PipelineState.SUCCEEDED),
                Map.entry("test[PY=3.12]", PipelineState.SUCCEEDED),
                Map.entry("security", PipelineState.FAILED),
                Map.entry("build-package", PipelineState.SKIPPED),
                Map.entry("build-container-amd64", PipelineState.SKIPPED),
                Map.entry("build-container-arm64", PipelineState.SKIPPED),
                Map.entry("docs", PipelineState.SKIPPED),
                Map.entry("notifications", PipelineState.SKIPPED));
        assertThat(report.pipeline("build-package").orElseThrow().blockedBy()).isEqualTo("security");
        assertThat(report.pipeline("docs").orElseThrow().blockedBy()).isEqualTo("build-package");
        assertThat(report.pipeline("notifications").orElseThrow().blockedBy()).isEqualTo("docs");
        assertThat(report.pipeline("security").orElseThrow().reason())
                .isEqualTo("Step 'bandit' of pipeline 'security' exited with code 1");
        assertThat(meters.counter("conveyor.pipeline.outcomes", "state", "skipped").count()).isEqualTo(5.0);
    }

    @Test
    void execute_triggerNotMatched_skipsPipelineAndDependents() {
        DependencyGraph graph = compile(
                pipeline("release")
                        .when(TriggerPredicate.anyOf(TriggerCondition.onEvents(EventType.TAG))),
                pipeline("publish", "release"),
                pipeline("lint"));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        PipelineOutcome release = report.pipeline("release").orElseThrow();
        assertThat(release.state()).isEqualTo(PipelineState.SKIPPED);
        assertThat(release.reason()).startsWith("Trigger not matched: ");
        assertThat(release.blockedBy()).isNull();
        assertThat(report.pipeline("publish").orElseThrow().blockedBy()).isEqualTo("release");
        assertThat(report.pipeline("lint").orElseThrow().state()).isEqualTo(PipelineState.SUCCEEDED);
        assertThat(report.status()).isEqualTo(BuildStatus.SUCCESS);
    }

    @Test
    void execute_allSucceed_everyPipelineTerminalInTopologicalOrder() {
        DependencyGraph graph = compile(pipeline("c", "b"), pipeline("a"), pipeline("b", "a"));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        assertThat(report.states()).containsExactly(
                Map.entry("a", PipelineState.SUCCEEDED),
                Map.entry("b", PipelineState.SUCCEEDED),
                Map.entry("c", PipelineState.SUCCEEDED));
        assertThat(backend.invocations).extracting(StepInvocation::pipeline).containsExactly("a", "b", "c");
        assertThat(report.pipelines()).allSatisfy(p -> {
            assertThat(p.startedAt()).isNotNull();
            assertThat(p.finishedAt()).isAfterOrEqualTo(p.startedAt());
        });
    }

    @Test
    void execute_unrelatedFailure_doesNotChangeTriggerOfOtherPipelines() {
        backend.failing.add("x/run");
        backend.behaviour = inv -> {
            if (inv.pipeline().equals("a")) sleep(300);
            return ExitStatus.ok();
        };
        DependencyGraph graph = compile(
                pipeline("a"),
                pipeline("x"),
                pipeline("deploy", "a").when(TriggerPredicate.anyOf(
                        TriggerCondition.onEvents(EventType.PUSH).withStatus(BuildStatus.SUCCESS))));
        Event event = Event.push("main");

        RunReport report = scheduler.execute(graph, event);

        assertThat(report.pipeline("x").orElseThrow().state()).isEqualTo(PipelineState.FAILED);
        assertThat(report.pipeline("deploy").orElseThrow().state()).isEqualTo(PipelineState.SUCCEEDED);
        assertThat(compiler.evaluate(graph, event))
                .extracting(Pipeline::name).contains("deploy");
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void execute_concurrencyLimitOne_neverTwoInstancesRunning() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        backend.behaviour = inv -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            sleep(40);
            running.decrementAndGet();
            return ExitStatus.ok();
        };
        DependencyGraph graph = compile(
                PipelineTemplate.of("deploy", Step.of("push", "deployer:${REGION}"))
                        .withMatrix(MatrixAxis.of("REGION", "eu", "us", "ap", "sa"))
                        .limitedTo(ConcurrencyLimit.of(1)));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        assertThat(report.pipelines()).hasSize(4)
                .allSatisfy(p -> assertThat(p.state()).isEqualTo(PipelineState.SUCCEEDED));
        assertThat(peak.get()).isEqualTo(1);
    }

    @Test
    void execute_groupedSteps_runConcurrentlyThenNextStageStarts() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        backend.behaviour = inv -> {
            if (!inv.step().startsWith("lint-")) return ExitStatus.ok();
            bothStarted.countDown();
            try {
                // Only reachable if both steps of the group are in flight together.
                return bothStarted.await(5, TimeUnit.SECONDS) ? ExitStatus.ok() : ExitStatus.of(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ExitStatus.of(130);
            }
        };
        DependencyGraph graph = compile(PipelineTemplate.of("checks",
                Step.of("lint-python", "python:3.12").inGroup("lint"),
                Step.of("lint-yaml", "yamllint").inGroup("lint"),
                Step.of("package", "python:3.12")));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        PipelineOutcome checks = report.pipeline("checks").orElseThrow();
        assertThat(checks.state()).isEqualTo(PipelineState.SUCCEEDED);
        assertThat(checks.steps()).extracting(StepOutcome::state)
                .containsOnly(StepState.SUCCEEDED);
        int packageStart = backend.timeline.indexOf("start:package");
        assertThat(backend.timeline.indexOf("end:lint-python")).isLessThan(packageStart);
        assertThat(backend.timeline.indexOf("end:lint-yaml")).isLessThan(packageStart);
    }

    @Test
    void execute_consecutiveUngroupedSteps_runOneAfterAnother() {
        backend.behaviour = inv -> {
            if (inv.step().equals("first")) sleep(50);
            return ExitStatus.ok();
        };
        DependencyGraph graph = compile(PipelineTemplate.of("docs",
                Step.of("first", "hugo"),
                Step.of("second", "hugo"),
                Step.of("third", "hugo")));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        assertThat(report.pipeline("docs").orElseThrow().state()).isEqualTo(PipelineState.SUCCEEDED);
        assertThat(backend.timeline).containsExactly(
                "start:first", "end:first",
                "start:second", "end:second",
                "start:third", "end:third");
    }

    @Test
    void execute_failingStepInGroup_cancelsSiblingAndLaterStages() {
        CountDownLatch never = new CountDownLatch(1);
        backend.behaviour = inv -> {
            if (inv.step().equals("slow")) {
                try {
                    never.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ExitStatus.of(130);
                }
            }
            return ExitStatus.ok();
        };
        backend.failing.add("build/fast-fail");
        DependencyGraph graph = compile(PipelineTemplate.of("build",
                Step.of("slow", "alpine").inGroup("compile"),
                Step.of("fast-fail", "alpine").inGroup("compile"),
                Step.of("publish", "alpine")));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        PipelineOutcome build = report.pipeline("build").orElseThrow();
        assertThat(build.state()).isEqualTo(PipelineState.FAILED);
        assertThat(build.reason()).isEqualTo("Step 'fast-fail' of pipeline 'build' exited with code 1");
        assertThat(build.steps()).extracting(StepOutcome::name, StepOutcome::state).containsExactly(
                tuple("slow", StepState.CANCELLED),
                tuple("fast-fail", StepState.FAILED),
                tuple("publish", StepState.CANCELLED));
        assertThat(build.steps().get(1).exitCode()).isEqualTo(1);
        assertThat(build.steps().get(2).detail()).isEqualTo("Not started: an earlier step failed");
        assertThat(backend.invocations).extracting(StepInvocation::step).doesNotContain("publish");
    }

    // ------------------------------------------------------------------
    // Step conditions
    // ------------------------------------------------------------------

    @Test
    void execute_stepConditionNotMatched_stepSkippedPipelineSucceeds() {
        DependencyGraph graph = compile(PipelineTemplate.of("docs",
                Step.of("build", "hugo"),
                Step.of("publish", "s3").withWhen(TriggerPredicate.anyOf(
                        TriggerCondition.onEvents(EventType.PUSH).withBranches("main")))));

        RunReport report = scheduler.execute(graph, Event.push("feature-x"));

        PipelineOutcome docs = report.pipeline("docs").orElseThrow();
        assertThat(docs.state()).isEqualTo(PipelineState.SUCCEEDED);
        assertThat(docs.steps().get(1).state()).isEqualTo(StepState.SKIPPED);
        assertThat(backend.invocations).extracting(StepInvocation::step).containsExactly("build");
    }

    @Test
    void execute_failureStatusCondition_seesFailureEarlierInRun() {
        backend.failing.add("test/run");
        // Shared slot of 1 makes notify start only after test has finished.
        ConcurrencyLimit serial = new ConcurrencyLimit("serial", 1);
        DependencyGraph graph = compile(
                pipeline("test").limitedTo(serial),
                PipelineTemplate.of("notify",
                        Step.of("on-success", "notify").withWhen(TriggerPredicate.anyOf(
                                TriggerCondition.onEvents(EventType.PUSH).withStatus(BuildStatus.SUCCESS))),
                        Step.of("on-failure", "notify").withWhen(TriggerPredicate.anyOf(
                                TriggerCondition.onEvents(EventType.PUSH).withStatus(BuildStatus.FAILURE))))
                        .limitedTo(serial));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        PipelineOutcome notify = report.pipeline("notify").orElseThrow();
        assertThat(notify.state()).isEqualTo(PipelineState.SUCCEEDED);
        assertThat(notify.steps()).extracting(StepOutcome::state)
                .containsExactly(StepState.SKIPPED, StepState.SUCCEEDED);
        assertThat(report.status()).isEqualTo(BuildStatus.FAILURE);
    }

    // ------------------------------------------------------------------
    // Secrets
    // ------------------------------------------------------------------

    @Test
    void execute_secretReference_resolvedWhenStepRuns() {
        DependencyGraph graph = compile(PipelineTemplate.of("publish",
                Step.of("s3", "wp-s3-action").withEnvironment(Map.of(
                        "S3_BUCKET", EnvValue.literal("docs"),
                        "S3_SECRET", EnvValue.secret("s3_secret_key")))));
        secrets.put("s3_secret_key", "hunter2");

        RunReport report = scheduler.execute(graph, Event.push("main"));

        assertThat(report.status()).isEqualTo(BuildStatus.SUCCESS);
        StepInvocation invocation = backend.invocations.get(0);
        assertThat(invocation.environment())
                .containsEntry("S3_BUCKET", "docs")
                .containsEntry("S3_SECRET", "hunter2");
        assertThat(invocation.toString()).doesNotContain("hunter2");
        assertThat(graph.pipeline(0).steps().get(0).environment().get("S3_SECRET").value()).isNull();
    }

    @Test
    void execute_missingSecret_failsThatStep() {
        DependencyGraph graph = compile(PipelineTemplate.of("publish",
                Step.of("s3", "wp-s3-action").withEnvironment(Map.of("S3_SECRET", EnvValue.secret("s3_secret_key")))));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        PipelineOutcome publish = report.pipeline("publish").orElseThrow();
        assertThat(publish.state()).isEqualTo(PipelineState.FAILED);
        assertThat(publish.steps().get(0).state()).isEqualTo(StepState.FAILED);
        assertThat(publish.steps().get(0).detail()).contains("needs secret 's3_secret_key'");
        assertThat(backend.invocations).isEmpty();
    }

    @Test
    void execute_backendThrows_stepFails() {
        backend.behaviour = inv -> {
            throw new IllegalStateException("runner unreachable");
        };
        DependencyGraph graph = compile(pipeline("lint"));

        RunReport report = scheduler.execute(graph, Event.push("main"));

        assertThat(report.pipeline("lint").orElseThrow().reason())
                .isEqualTo("Step 'run' of pipeline 'lint' could not be run: runner unreachable");
    }

    // ------------------------------------------------------------------
    // Listener
    // ------------------------------------------------------------------

    @Test
    void execute_listenerSeesTransitionsInOrder() {
        List<String> pipelineEvents = new CopyOnWriteArrayList<>();
        List<String> stepEvents = new CopyOnWriteArrayList<>();
        RunListener listener = new RunListener() {
            @Override
            public void pipelineTransition(UUID runId, String pipeline, PipelineState from, PipelineState to) {
                pipelineEvents.add(pipeline + ":" + from + "->" + to);
            }

            @Override
            public void stepTransition(UUID runId, String pipeline, String step, StepState state) {
                stepEvents.add(pipeline + "/" + step + ":" + state);
            }
        };
        UUID runId = UUID.randomUUID();

        RunReport report = scheduler.execute(runId, compile(pipeline("lint")), Event.push("main"), listener);

        assertThat(report.runId()).isEqualTo(runId);
        assertThat(pipelineEvents).containsExactly(
                "lint:PENDING->ELIGIBLE", "lint:ELIGIBLE->RUNNING", "lint:RUNNING->SUCCEEDED");
        assertThat(stepEvents).containsExactly("lint/run:RUNNING", "lint/run:SUCCEEDED");
    }

    @Test
    void execute_throwingListener_doesNotBreakRun() {
        RunListener broken = new RunListener() {
            @Override
            public void pipelineTransition(UUID runId, String pipeline, PipelineState from, PipelineState to) {
                throw new IllegalStateException("listener bug");
            }
        };

        RunReport report = scheduler.execute(UUID.randomUUID(), compile(pipeline("lint")), Event.push("main"), broken);

        assertThat(report.status()).isEqualTo(BuildStatus.SUCCESS);
    }
}
