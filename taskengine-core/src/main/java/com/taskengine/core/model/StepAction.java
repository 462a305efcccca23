package com.taskengine.core.model;

import java.util.Arrays;

/**
 * Kinds of work a plan step can perform. Each kind maps to one registered action handler.
 */
public enum StepAction {
    LLM_CALL("llm_call"),
    TOOL_CALL("tool_call"),
    APPROVAL("approval"),
    CONDITION("condition"),
    AGGREGATE("aggregate");

    private final String wireName;

    StepAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static StepAction fromWireName(String name) {
        return Arrays.stream(values())
            .filter(a -> a.wireName.equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown step action: " + name));
    }
}
