package com.taskengine.engine.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.model.Step;
import com.taskengine.core.model.StepAction;

import java.util.List;

/**
 * Two model calls: analyze the request, then act on the analysis.
 */
public class GeneralPlanStrategy implements PlanStrategy {

    @Override
    public List<Step> steps(String inputText, JsonNode inputData) {
        ObjectNode analyzeData = JsonNodeFactory.instance.objectNode()
            .put("purpose", "analyze")
            .put("input_text", inputText);
        Step analyze = Step.create(StepAction.LLM_CALL, analyzeData, List.of());

        ObjectNode executeData = JsonNodeFactory.instance.objectNode()
            .put("purpose", "execute")
            .put("input_text", inputText)
            .put("analysis_step_id", analyze.getStepId());
        Step execute = Step.create(StepAction.LLM_CALL, executeData, List.of(analyze.getStepId()));

        return List.of(analyze, execute);
    }
}
