package com.taskengine.engine.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.model.Step;
import com.taskengine.core.model.StepAction;

import java.util.List;

/**
 * Search, analyze the sources, synthesize.
 */
public class ResearchPlanStrategy implements PlanStrategy {

    @Override
    public List<Step> steps(String inputText, JsonNode inputData) {
        ObjectNode searchData = JsonNodeFactory.instance.objectNode()
            .put("tool", "web_search")
            .put("query", inputText);
        Step search = Step.create(StepAction.TOOL_CALL, searchData, List.of());

        ObjectNode analyzeData = JsonNodeFactory.instance.objectNode()
            .put("purpose", "analyze_sources")
            .put("search_step_id", search.getStepId());
        Step analyze = Step.create(StepAction.LLM_CALL, analyzeData, List.of(search.getStepId()));

        ObjectNode synthesizeData = JsonNodeFactory.instance.objectNode()
            .put("purpose", "synthesize")
            .put("analysis_step_id", analyze.getStepId());
        Step synthesize = Step.create(StepAction.LLM_CALL, synthesizeData, List.of(analyze.getStepId()));

        return List.of(search, analyze, synthesize);
    }
}
