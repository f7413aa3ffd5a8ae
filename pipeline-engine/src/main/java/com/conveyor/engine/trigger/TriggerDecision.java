package com.conveyor.engine.trigger;

/**
 * Outcome of evaluating a trigger predicate against an event.
 *
 * @param eligible   whether the pipeline or step may run
 * @param malformed  true if the predicate or event could not be evaluated
 * @param diagnostic why the decision is negative; null when eligible
 */
public record TriggerDecision(boolean eligible, boolean malformed, String diagnostic) {

    private static final TriggerDecision ALLOW = new TriggerDecision(true, false, null);

    public static TriggerDecision allow() {
        return ALLOW;
    }

    public static TriggerDecision noMatch(String diagnostic) {
        return new TriggerDecision(false, false, diagnostic);
    }

    public static TriggerDecision malformed(String diagnostic) {
        return new TriggerDecision(false, true, diagnostic);
    }
}
