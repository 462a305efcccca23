package com.taskengine.engine.step.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.actions.ActionContext;
import com.taskengine.actions.ActionHandler;
import com.taskengine.actions.ApprovalRequiredException;

/**
 * Suspends the task until a human approves. The draft shown to the approver is the
 * {@code response} field of the {@code draft_step_id} result, or that whole result.
 */
public class ApprovalActionHandler implements ActionHandler {

    static final String DEFAULT_MESSAGE = "Approval required";

    @Override
    public JsonNode execute(ActionContext context) {
        String message = context.param("message");
        if (message == null || message.isBlank()) {
            message = DEFAULT_MESSAGE;
        }

        JsonNode draft = context.getReferencedResult("draft_step_id");
        JsonNode draftContent = draft != null && draft.has("response") ? draft.get("response") : draft;

        throw new ApprovalRequiredException(message, context.getStep().getStepId(), draftContent);
    }
}
