package com.conveyor.engine.compile;

import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.model.PipelineTemplate;
import com.conveyor.engine.model.Step;
import com.conveyor.engine.trigger.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.conveyor.engine.compile.PipelineConfigException.Kind.DUPLICATE_STEP;
import static com.conveyor.engine.compile.PipelineConfigException.Kind.INVALID_DEFINITION;

/**
 * Entry point of compilation: templates in, checked dependency graph out.
 *
 * <ol>
 *   <li>Expand every template across its matrix.</li>
 *   <li>Validate each concrete pipeline (steps, images, concurrency).</li>
 *   <li>Resolve dependencies and reject cycles.</li>
 * </ol>
 * Any {@link PipelineConfigException} aborts the whole compilation.
 */
@Component
public class GraphCompiler {

    private static final Logger log = LoggerFactory.getLogger(GraphCompiler.class);

    private final MatrixExpander   expander = new MatrixExpander();
    private final TriggerEvaluator triggers;

    public GraphCompiler(TriggerEvaluator triggers) {
        this.triggers = triggers;
    }

    /**
     * @param variables compile variables available to ${...} placeholders,
     *                  e.g. CI_REPO_NAME; may be null
     */
    public DependencyGraph compile(List<PipelineTemplate> templates, Map<String, String> variables) {
        if (templates == null || templates.isEmpty()) {
            throw new PipelineConfigException(INVALID_DEFINITION, "No pipeline templates given");
        }
        Map<String, String> vars = variables == null ? Map.of() : variables;

        List<Pipeline> pipelines = new ArrayList<>();
        for (PipelineTemplate template : templates) {
            if (template == null) {
                throw new PipelineConfigException(INVALID_DEFINITION, "Null pipeline template");
            }
            pipelines.addAll(expander.expand(template, vars));
        }
        pipelines.forEach(GraphCompiler::validate);
        validateConcurrencyGroups(pipelines);

        DependencyGraph graph = DependencyGraph.build(pipelines);
        log.info("Compiled {} template(s) into {} pipeline(s) across {} layer(s)",
                templates.size(), graph.size(), graph.layers().size());
        return graph;
    }

    /**
     * Pipelines that would run for {@code event} if everything they depend
     * on succeeds: their own trigger matches and so does every dependency's,
     * transitively. Returned in topological order.
     */
    public List<Pipeline> evaluate(DependencyGraph graph, Event event) {
        boolean[] eligible = new boolean[graph.size()];
        List<Pipeline> result = new ArrayList<>();
        for (int node : graph.topologicalOrder()) {
            boolean ok = triggers.isEligible(graph.pipeline(node).when(), event);
            for (int dependency : graph.dependenciesOf(node)) {
                ok &= eligible[dependency];
            }
            eligible[node] = ok;
            if (ok) result.add(graph.pipeline(node));
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    private static void validate(Pipeline pipeline) {
        if (pipeline.steps().isEmpty()) {
            throw new PipelineConfigException(INVALID_DEFINITION,
                    "Pipeline '" + pipeline.name() + "' has no steps");
        }
        Set<String> names = new HashSet<>();
        for (Step step : pipeline.steps()) {
            if (step == null || step.name() == null || step.name().isBlank()) {
                throw new PipelineConfigException(INVALID_DEFINITION,
                        "Pipeline '" + pipeline.name() + "' has a step without a name");
            }
            if (!names.add(step.name())) {
                throw new PipelineConfigException(DUPLICATE_STEP,
                        "Step '" + step.name() + "' is defined more than once in pipeline '" + pipeline.name() + "'");
            }
            if (step.image() == null || step.image().isBlank()) {
                throw new PipelineConfigException(INVALID_DEFINITION,
                        "Step '" + step.name() + "' of pipeline '" + pipeline.name() + "' has no image");
            }
        }
        if (pipeline.isLimited() && pipeline.concurrency().maxRunning() < 1) {
            throw new PipelineConfigException(INVALID_DEFINITION,
                    "Pipeline '" + pipeline.name() + "' has a concurrency limit below 1");
        }
    }

    private static void validateConcurrencyGroups(List<Pipeline> pipelines) {
        Map<String, Integer> limits = new HashMap<>();
        for (Pipeline p : pipelines) {
            if (!p.isLimited()) continue;
            Integer previous = limits.putIfAbsent(p.concurrency().group(), p.concurrency().maxRunning());
            if (previous != null && previous != p.concurrency().maxRunning()) {
                throw new PipelineConfigException(INVALID_DEFINITION,
                        "Concurrency group '" + p.concurrency().group() + "' is declared with limits "
                        + previous + " and " + p.concurrency().maxRunning());
            }
        }
    }
}
