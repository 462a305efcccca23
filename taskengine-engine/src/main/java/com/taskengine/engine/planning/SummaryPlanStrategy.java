package com.taskengine.engine.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.model.Step;
import com.taskengine.core.model.StepAction;

import java.util.List;

/**
 * Summarizes the input text, or the page at {@code url} when the input carries one.
 */
public class SummaryPlanStrategy implements PlanStrategy {

    @Override
    public List<Step> steps(String inputText, JsonNode inputData) {
        String url = inputData.path("url").asText("");
        if (url.isBlank()) {
            ObjectNode summarizeData = JsonNodeFactory.instance.objectNode()
                .put("purpose", "summarize")
                .put("input_text", inputText);
            return List.of(Step.create(StepAction.LLM_CALL, summarizeData, List.of()));
        }

        ObjectNode fetchData = JsonNodeFactory.instance.objectNode()
            .put("tool", "web_fetch")
            .put("url", url);
        Step fetch = Step.create(StepAction.TOOL_CALL, fetchData, List.of());

        ObjectNode summarizeData = JsonNodeFactory.instance.objectNode()
            .put("purpose", "summarize")
            .put("source_step_id", fetch.getStepId());
        Step summarize = Step.create(StepAction.LLM_CALL, summarizeData, List.of(fetch.getStepId()));

        return List.of(fetch, summarize);
    }
}
