package com.conveyor.engine.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * A pipeline definition as authored: may contain ${...} placeholders and
 * matrix axes. The compiler turns each template into one or more concrete
 * {@link Pipeline}s.
 */
public record PipelineTemplate(
        String           name,
        Platform         platform,
        List<Step>       steps,
        @JsonAlias("depends_on")
        List<String>     dependsOn,
        TriggerPredicate when,
        ConcurrencyLimit concurrency,
        List<MatrixAxis> matrix) {

    public PipelineTemplate {
        if (platform == null) platform = Platform.DEFAULT;
        steps     = steps     == null ? List.of() : List.copyOf(steps);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (when == null) when = TriggerPredicate.ALWAYS;
        matrix    = matrix    == null ? List.of() : List.copyOf(matrix);
    }

    public static PipelineTemplate of(String name, Step... steps) {
        return new PipelineTemplate(name, null, List.of(steps), null, null, null, null);
    }

    public PipelineTemplate dependsOn(String... names) {
        return new PipelineTemplate(name, platform, steps, List.of(names), when, concurrency, matrix);
    }

    public PipelineTemplate when(TriggerPredicate predicate) {
        return new PipelineTemplate(name, platform, steps, dependsOn, predicate, concurrency, matrix);
    }

    public PipelineTemplate on(Platform target) {
        return new PipelineTemplate(name, target, steps, dependsOn, when, concurrency, matrix);
    }

    public PipelineTemplate limitedTo(ConcurrencyLimit limit) {
        return new PipelineTemplate(name, platform, steps, dependsOn, when, limit, matrix);
    }

    public PipelineTemplate withMatrix(MatrixAxis... axes) {
        return new PipelineTemplate(name, platform, steps, dependsOn, when, concurrency, List.of(axes));
    }
}
