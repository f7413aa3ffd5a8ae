package com.conveyor.engine.backend.dto;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /steps/run on the step runner.
 */
public record RunStepRequest(
        String              run_id,
        String              pipeline,
        String              step,
        String              platform,
        String              image,
        List<String>        commands,
        Map<String, String> environment,
        int                 timeout_sec
) {}
