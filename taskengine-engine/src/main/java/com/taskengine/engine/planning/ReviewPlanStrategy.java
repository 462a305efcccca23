package com.taskengine.engine.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.model.Step;
import com.taskengine.core.model.StepAction;

import java.util.List;

/**
 * Draft, wait for a human to approve or edit the draft, then finalize.
 */
public class ReviewPlanStrategy implements PlanStrategy {

    static final String DEFAULT_MESSAGE = "Review the draft";

    @Override
    public List<Step> steps(String inputText, JsonNode inputData) {
        ObjectNode draftData = JsonNodeFactory.instance.objectNode()
            .put("purpose", "draft")
            .put("input_text", inputText);
        Step draft = Step.create(StepAction.LLM_CALL, draftData, List.of());

        ObjectNode approvalData = JsonNodeFactory.instance.objectNode()
            .put("message", inputData.path("approval_message").asText(DEFAULT_MESSAGE))
            .put("draft_step_id", draft.getStepId());
        Step approval = Step.create(StepAction.APPROVAL, approvalData, List.of(draft.getStepId()));

        ObjectNode finalizeData = JsonNodeFactory.instance.objectNode()
            .put("purpose", "finalize")
            .put("draft_step_id", draft.getStepId())
            .put("approval_step_id", approval.getStepId());
        Step finalizeStep = Step.create(StepAction.LLM_CALL, finalizeData, List.of(approval.getStepId()));

        return List.of(draft, approval, finalizeStep);
    }
}
