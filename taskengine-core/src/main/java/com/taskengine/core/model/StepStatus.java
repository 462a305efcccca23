package com.taskengine.core.model;

import java.util.Arrays;

/**
 * Lifecycle states for a plan step.
 */
public enum StepStatus {
    /**
     * Not started, or reset after an approval suspension.
     */
    PENDING("pending"),

    /**
     * Handler invocation in progress.
     */
    RUNNING("running"),

    /**
     * Handler returned a result.
     */
    COMPLETED("completed"),

    /**
     * Handler raised an error.
     */
    FAILED("failed"),

    /**
     * Bypassed by a branching decision.
     */
    SKIPPED("skipped");

    private final String wireName;

    StepStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Check if dependents of a step in this state may run.
     */
    public boolean satisfiesDependency() {
        return this == COMPLETED || this == SKIPPED;
    }

    public static StepStatus fromWireName(String name) {
        return Arrays.stream(values())
            .filter(s -> s.wireName.equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown step status: " + name));
    }
}
