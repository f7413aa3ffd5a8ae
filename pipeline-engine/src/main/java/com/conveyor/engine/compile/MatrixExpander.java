package com.conveyor.engine.compile;

import com.conveyor.engine.model.ConcurrencyLimit;
import com.conveyor.engine.model.EnvValue;
import com.conveyor.engine.model.MatrixAxis;
import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.model.PipelineTemplate;
import com.conveyor.engine.model.Step;
import com.conveyor.engine.model.TriggerCondition;
import com.conveyor.engine.model.TriggerPredicate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.conveyor.engine.compile.PipelineConfigException.Kind.DUPLICATE_AXIS;
import static com.conveyor.engine.compile.PipelineConfigException.Kind.EMPTY_AXIS;
import static com.conveyor.engine.compile.PipelineConfigException.Kind.INVALID_DEFINITION;

/**
 * Expands a template across the Cartesian product of its matrix axes.
 *
 * Each combination yields one {@link Pipeline} named
 * {@code template[AXIS=value,...]}, with axis values and compile variables
 * substituted into images, commands, literal environment values and trigger
 * patterns. Combinations are produced in declaration order, first axis
 * varying slowest. A template without axes yields exactly one pipeline
 * that keeps the template's name.
 *
 * Pure: no state, no I/O.
 */
public class MatrixExpander {

    public List<Pipeline> expand(PipelineTemplate template, Map<String, String> variables) {
        if (template.name() == null || template.name().isBlank()) {
            throw new PipelineConfigException(INVALID_DEFINITION, "Pipeline template without a name");
        }
        validateAxes(template);

        List<Pipeline> instances = new ArrayList<>();
        for (Map<String, String> combination : combinations(template.matrix())) {
            instances.add(instantiate(template, combination, variables));
        }
        return instances;
    }

    // ------------------------------------------------------------------
    // Combinations
    // ------------------------------------------------------------------

    static List<Map<String, String>> combinations(List<MatrixAxis> axes) {
        List<Map<String, String>> result = new ArrayList<>();
        result.add(new LinkedHashMap<>());
        for (MatrixAxis axis : axes) {
            List<Map<String, String>> next = new ArrayList<>(result.size() * axis.values().size());
            for (Map<String, String> partial : result) {
                for (String value : axis.values()) {
                    Map<String, String> combination = new LinkedHashMap<>(partial);
                    combination.put(axis.name(), value);
                    next.add(combination);
                }
            }
            result = next;
        }
        return result;
    }

    private static void validateAxes(PipelineTemplate template) {
        Set<String> seen = new HashSet<>();
        for (MatrixAxis axis : template.matrix()) {
            if (axis.name() == null || axis.name().isBlank()) {
                throw new PipelineConfigException(INVALID_DEFINITION,
                        "Matrix axis without a name in template '" + template.name() + "'");
            }
            if (!seen.add(axis.name())) {
                throw new PipelineConfigException(DUPLICATE_AXIS,
                        "Matrix axis '" + axis.name() + "' declared twice in template '" + template.name() + "'");
            }
            if (axis.values().isEmpty()) {
                throw new PipelineConfigException(EMPTY_AXIS,
                        "Matrix axis '" + axis.name() + "' of template '" + template.name() + "' has no values");
            }
            if (axis.values().contains(null)) {
                throw new PipelineConfigException(INVALID_DEFINITION,
                        "Matrix axis '" + axis.name() + "' of template '" + template.name() + "' has a null value");
            }
            if (new HashSet<>(axis.values()).size() != axis.values().size()) {
                throw new PipelineConfigException(INVALID_DEFINITION,
                        "Matrix axis '" + axis.name() + "' of template '" + template.name() + "' repeats a value");
            }
        }
    }

    // ------------------------------------------------------------------
    // Substitution
    // ------------------------------------------------------------------

    private static Pipeline instantiate(PipelineTemplate template,
                                        Map<String, String> combination,
                                        Map<String, String> variables) {
        Map<String, String> values = new HashMap<>(variables);
        values.putAll(combination);   // axis values win over compile variables
        PlaceholderResolver resolver = new PlaceholderResolver(values);

        String name = instanceName(template.name(), combination);

        List<Step> steps = new ArrayList<>(template.steps().size());
        for (Step step : template.steps()) {
            steps.add(substitute(step, name, resolver));
        }

        TriggerPredicate when = substitute(template.when(), "trigger of pipeline '" + name + "'", resolver);

        ConcurrencyLimit limit = template.concurrency();
        if (limit != null && limit.group() == null) {
            limit = limit.inGroup(template.name());
        }

        return new Pipeline(name, template.name(), template.platform(), steps,
                template.dependsOn(), when, limit, combination);
    }

    private static Step substitute(Step step, String pipeline, PlaceholderResolver resolver) {
        String where = "step '" + step.name() + "' of pipeline '" + pipeline + "'";

        String image = resolver.resolve(step.image(), "image of " + where);
        List<String> commands = step.commands().stream()
                .map(command -> resolver.resolve(command, "command of " + where))
                .toList();

        Map<String, EnvValue> environment = new LinkedHashMap<>();
        step.environment().forEach((key, value) -> environment.put(key, value.isSecret()
                ? value
                : EnvValue.literal(resolver.resolve(value.value(), "environment '" + key + "' of " + where))));

        return step.withImageAndCommands(image, commands)
                .withEnvironment(environment)
                .withWhen(substitute(step.when(), "condition of " + where, resolver));
    }

    private static TriggerPredicate substitute(TriggerPredicate predicate, String where, PlaceholderResolver resolver) {
        if (predicate.isEmpty()) return predicate;
        List<TriggerCondition> conditions = new ArrayList<>();
        for (TriggerCondition condition : predicate.conditions()) {
            conditions.add(condition.withPatterns(
                    condition.refs().stream().map(p -> resolver.resolve(p, where)).toList(),
                    condition.branches().stream().map(p -> resolver.resolve(p, where)).toList()));
        }
        return new TriggerPredicate(conditions);
    }

    static String instanceName(String templateName, Map<String, String> combination) {
        if (combination.isEmpty()) return templateName;
        return combination.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", templateName + "[", "]"));
    }
}
