package com.conveyor.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A concrete pipeline: every placeholder substituted, one matrix
 * combination fixed. Produced by the matrix expander, scheduled as a unit.
 *
 * @param name         unique within a compiled graph
 * @param templateName name of the template it was expanded from
 * @param matrix       axis values of this instance (empty without a matrix)
 * @param concurrency  resolved limit (group never null), or null if unlimited
 */
public record Pipeline(
        String              name,
        String              templateName,
        Platform            platform,
        List<Step>          steps,
        List<String>        dependsOn,
        TriggerPredicate    when,
        ConcurrencyLimit    concurrency,
        Map<String, String> matrix) {

    public Pipeline {
        if (templateName == null) templateName = name;
        if (platform == null) platform = Platform.DEFAULT;
        steps     = steps     == null ? List.of() : List.copyOf(steps);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (when == null) when = TriggerPredicate.ALWAYS;
        matrix    = matrix    == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(matrix));
    }

    public boolean isLimited() {
        return concurrency != null;
    }
}
