package com.taskengine.engine.kernel;

/**
 * Current quota usage of one owner.
 */
public record OwnerLimitsStatus(
    String ownerId,
    int queued,
    int maxQueued,
    int active,
    int maxActive,
    int createdLastHour,
    int maxPerHour
) {
    public boolean canEnqueue() {
        return queued < maxQueued && active < maxActive && createdLastHour < maxPerHour;
    }
}
