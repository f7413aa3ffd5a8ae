package com.conveyor.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Set of alternative conditions deciding whether a pipeline or step runs
 * for an event. Matches when any alternative matches; an empty predicate
 * always matches.
 *
 * JSON form is the bare list of conditions.
 */
public record TriggerPredicate(List<TriggerCondition> conditions) {

    public static final TriggerPredicate ALWAYS = new TriggerPredicate(List.of());

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public TriggerPredicate {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static TriggerPredicate anyOf(TriggerCondition... alternatives) {
        return new TriggerPredicate(List.of(alternatives));
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    @JsonValue
    public List<TriggerCondition> conditions() {
        return conditions;
    }
}
