package com.taskengine.engine.step;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of executing one step: either it completed, or it suspended the task for approval.
 * Failures are exceptions, not outcomes.
 */
public interface StepOutcome {

    boolean isSuspended();

    static StepOutcome completed(JsonNode result) {
        return new Completed(result);
    }

    static StepOutcome suspended(String stepId, String message, JsonNode draftContent) {
        return new Suspended(stepId, message, draftContent);
    }

    record Completed(JsonNode result) implements StepOutcome {
        @Override
        public boolean isSuspended() {
            return false;
        }
    }

    record Suspended(String stepId, String message, JsonNode draftContent) implements StepOutcome {
        @Override
        public boolean isSuspended() {
            return true;
        }
    }
}
