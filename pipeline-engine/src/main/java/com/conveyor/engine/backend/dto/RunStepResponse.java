package com.conveyor.engine.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /steps/run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunStepResponse(
        int    exit_code,
        String output,
        double elapsed_sec,
        String error_type    // "TIMEOUT" | "IMAGE_PULL" | null
) {}
