package com.taskengine.actions;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Signals that a step needs human approval before the plan may continue.
 * Not a failure: the task is paused and the step is re-entered after approval.
 */
public class ApprovalRequiredException extends RuntimeException {

    private final String stepId;
    private final JsonNode draftContent;

    public ApprovalRequiredException(String message, String stepId, JsonNode draftContent) {
        super(message, null, false, false);
        this.stepId = stepId;
        this.draftContent = draftContent;
    }

    public String getStepId() {
        return stepId;
    }

    /**
     * Optional content shown to the approver, may be null.
     */
    public JsonNode getDraftContent() {
        return draftContent;
    }
}
