package com.taskengine.engine.kernel;

import java.time.Duration;

/**
 * Queue and lease limits enforced by {@link TaskManager}.
 *
 * @param maxAttempts default attempts per task, overridable per request
 * @param leaseTimeout how long a claim or heartbeat keeps a task
 * @param maxQueuedPerOwner cap on an owner's QUEUED tasks
 * @param maxActivePerOwner cap on an owner's QUEUED plus RUNNING tasks
 * @param maxPerHour cap on tasks an owner creates in a rolling hour
 */
public record TaskLimits(
    int maxAttempts,
    Duration leaseTimeout,
    int maxQueuedPerOwner,
    int maxActivePerOwner,
    int maxPerHour
) {
    public TaskLimits {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (leaseTimeout == null || leaseTimeout.isZero() || leaseTimeout.isNegative()) {
            throw new IllegalArgumentException("leaseTimeout must be positive");
        }
    }

    public static TaskLimits defaults() {
        return new TaskLimits(3, Duration.ofSeconds(300), 10, 3, 100);
    }

    public TaskLimits withLeaseTimeout(Duration timeout) {
        return new TaskLimits(maxAttempts, timeout, maxQueuedPerOwner, maxActivePerOwner, maxPerHour);
    }

    public TaskLimits withOwnerCaps(int queued, int active, int perHour) {
        return new TaskLimits(maxAttempts, leaseTimeout, queued, active, perHour);
    }
}
