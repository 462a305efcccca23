package com.taskengine.core.model;

import java.util.Arrays;

/**
 * Types of audit events recorded for a task.
 * Stored by wire name in the event log.
 */
public enum TaskEventType {
    // Task lifecycle
    ENQUEUED("enqueued"),
    CLAIMED("claimed"),
    PAUSED("paused"),
    RESUMED("resumed"),
    SUCCEEDED("succeeded"),
    RETRY_SCHEDULED("retry_scheduled"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    LEASE_EXPIRED("lease_expired"),

    // Step execution
    STEP_STARTED("step_started"),
    STEP_COMPLETED("step_completed"),
    STEP_FAILED("step_failed"),
    STEP_SKIPPED("step_skipped"),
    APPROVAL_REQUIRED("approval_required"),
    APPROVAL_GRANTED("approval_granted");

    private final String wireName;

    TaskEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static TaskEventType fromWireName(String name) {
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + name));
    }
}
