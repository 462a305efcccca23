package com.taskengine.core.model;

import java.util.Arrays;

/**
 * Why a task was moved to {@link TaskState#PAUSED}.
 */
public enum PauseReason {
    APPROVAL("approval"),
    DEPENDENCY("dependency"),
    RATE_LIMIT("rate_limit");

    private final String wireName;

    PauseReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PauseReason fromWireName(String name) {
        if (name == null) return null;
        return Arrays.stream(values())
            .filter(r -> r.wireName.equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown pause reason: " + name));
    }
}
