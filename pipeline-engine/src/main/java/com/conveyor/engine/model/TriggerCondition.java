package com.conveyor.engine.model;

import java.util.List;
import java.util.Set;

/**
 * One alternative of a trigger predicate.
 *
 * Every non-empty field must match the event; an empty field matches
 * anything. Ref and branch entries are glob patterns.
 *
 * @param events   event types this condition accepts
 * @param refs     patterns matched against the full ref (refs/tags/v1.0.0)
 * @param branches patterns matched against the branch name (main)
 * @param status   build statuses this condition accepts
 */
public record TriggerCondition(
        Set<EventType>   events,
        List<String>     refs,
        List<String>     branches,
        Set<BuildStatus> status) {

    public TriggerCondition {
        events   = events   == null ? Set.of()  : Set.copyOf(events);
        refs     = refs     == null ? List.of() : List.copyOf(refs);
        branches = branches == null ? List.of() : List.copyOf(branches);
        status   = status   == null ? Set.of()  : Set.copyOf(status);
    }

    public static TriggerCondition onEvents(EventType... types) {
        return new TriggerCondition(Set.of(types), null, null, null);
    }

    public TriggerCondition withRefs(String... patterns) {
        return new TriggerCondition(events, List.of(patterns), branches, status);
    }

    public TriggerCondition withBranches(String... patterns) {
        return new TriggerCondition(events, refs, List.of(patterns), status);
    }

    public TriggerCondition withStatus(BuildStatus... statuses) {
        return new TriggerCondition(events, refs, branches, Set.of(statuses));
    }

    /** Same condition with its ref and branch patterns replaced. */
    public TriggerCondition withPatterns(List<String> newRefs, List<String> newBranches) {
        return new TriggerCondition(events, newRefs, newBranches, status);
    }
}
