package com.taskengine.core.model;

import java.util.Arrays;
import java.util.Set;

/**
 * Lifecycle states for a task.
 *
 * <pre>
 * QUEUED -> RUNNING -> {PAUSED, SUCCEEDED, FAILED, CANCELLED}
 * PAUSED -> QUEUED            (resume)
 * RUNNING -> QUEUED           (retry while attempts remain)
 * </pre>
 */
public enum TaskState {
    /**
     * Waiting in the queue for a worker.
     * Transitions: -> RUNNING, CANCELLED
     */
    QUEUED("queued"),

    /**
     * Held by a worker under a lease.
     * Transitions: -> PAUSED, SUCCEEDED, FAILED, CANCELLED, QUEUED
     */
    RUNNING("running"),

    /**
     * Suspended until resumed. Never claimable.
     * Transitions: -> QUEUED, CANCELLED
     */
    PAUSED("paused"),

    /**
     * Plan completed. Terminal state.
     */
    SUCCEEDED("succeeded"),

    /**
     * Attempts exhausted or fatal error. Terminal state.
     */
    FAILED("failed"),

    /**
     * Cancelled by an external actor. Terminal state.
     */
    CANCELLED("cancelled");

    /** States counted against the per-owner active cap. */
    public static final Set<TaskState> ACTIVE = Set.of(QUEUED, RUNNING);

    private final String wireName;

    TaskState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if tasks in this state count as queued or in flight.
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * Check if a transition to the target state is allowed.
     */
    public boolean canTransitionTo(TaskState target) {
        return switch (this) {
            case QUEUED -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == PAUSED || target == SUCCEEDED || target == FAILED
                || target == CANCELLED || target == QUEUED;
            case PAUSED -> target == QUEUED || target == CANCELLED;
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }

    public static TaskState fromWireName(String name) {
        return Arrays.stream(values())
            .filter(s -> s.wireName.equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown task state: " + name));
    }
}
