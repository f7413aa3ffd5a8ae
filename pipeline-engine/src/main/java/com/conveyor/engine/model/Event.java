package com.conveyor.engine.model;

/**
 * An incoming repository event that may start a run.
 *
 * When no branch is given it is derived from a {@code refs/heads/...} ref.
 * A null priorStatus means "unknown"; trigger evaluation then treats the
 * build as successful.
 */
public record Event(
        EventType   type,
        String      ref,
        String      branch,
        String      actor,
        BuildStatus priorStatus) {

    private static final String HEADS = "refs/heads/";

    public Event {
        if ((branch == null || branch.isBlank()) && ref != null && ref.startsWith(HEADS)) {
            branch = ref.substring(HEADS.length());
        }
    }

    public static Event push(String branch) {
        return new Event(EventType.PUSH, HEADS + branch, branch, null, null);
    }

    public static Event tag(String tag) {
        return new Event(EventType.TAG, "refs/tags/" + tag, null, null, null);
    }

    public BuildStatus effectiveStatus() {
        return priorStatus == null ? BuildStatus.SUCCESS : priorStatus;
    }

    public Event withPriorStatus(BuildStatus status) {
        return new Event(type, ref, branch, actor, status);
    }
}
