package com.conveyor.engine.api.dto;

import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.PipelineTemplate;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /runs and POST /runs/evaluate.
 *
 * Required: templates, event
 * Optional: variables, the compile variables available to ${...}
 *   placeholders (CI_REPO_NAME, CI_REPO_DEFAULT_BRANCH, ...).
 */
public record SubmitRunRequest(List<PipelineTemplate> templates,
                               Map<String, String> variables,
                               Event event) {

    public SubmitRunRequest {
        if (variables == null) variables = Map.of();
    }
}
