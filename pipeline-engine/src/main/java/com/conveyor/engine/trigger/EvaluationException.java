package com.conveyor.engine.trigger;

/**
 * A trigger predicate or event that cannot be evaluated: a malformed glob,
 * an event without a type. Never escapes {@link TriggerEvaluator}; the
 * evaluator reports it as a diagnostic on an ineligible decision.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }
}
