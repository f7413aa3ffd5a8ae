package com.conveyor.engine.scheduler;

import com.conveyor.engine.model.ConcurrencyLimit;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Per-group running slots for pipelines with a concurrency limit.
 *
 * The only mutable state shared between pipeline instances. Slots are
 * semaphores, so acquiring and releasing stay atomic even when several
 * pipelines finish at the same moment.
 */
final class ConcurrencyLimiter {

    private final Map<String, Semaphore> slots = new ConcurrentHashMap<>();

    /** True if a slot was taken; unlimited pipelines always get one. */
    boolean tryAcquire(ConcurrencyLimit limit) {
        if (limit == null) return true;
        return slotsFor(limit).tryAcquire();
    }

    void release(ConcurrencyLimit limit) {
        if (limit == null) return;
        slotsFor(limit).release();
    }

    int available(String group) {
        Semaphore semaphore = slots.get(group);
        return semaphore == null ? -1 : semaphore.availablePermits();
    }

    private Semaphore slotsFor(ConcurrencyLimit limit) {
        return slots.computeIfAbsent(limit.group(), g -> new Semaphore(limit.maxRunning()));
    }
}
