package com.conveyor.engine.model;

/**
 * Cap on how many pipelines of the same group may be RUNNING at once
 * within a run. A null group means "the pipeline's template name", so all
 * matrix instances of one template share the cap.
 */
public record ConcurrencyLimit(String group, int maxRunning) {

    public static ConcurrencyLimit of(int maxRunning) {
        return new ConcurrencyLimit(null, maxRunning);
    }

    public ConcurrencyLimit inGroup(String group) {
        return new ConcurrencyLimit(group, maxRunning);
    }
}
