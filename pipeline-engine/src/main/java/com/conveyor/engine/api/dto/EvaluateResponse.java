package com.conveyor.engine.api.dto;

import java.util.List;

/**
 * Response body for POST /runs/evaluate: the pipelines the event would
 * run, in dependency order.
 */
public record EvaluateResponse(List<String> pipelines) {}
