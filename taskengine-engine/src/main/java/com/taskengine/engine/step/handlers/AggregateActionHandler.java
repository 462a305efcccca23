package com.taskengine.engine.step.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.actions.ActionContext;
import com.taskengine.actions.ActionHandler;

import java.util.Map;

/**
 * Collects earlier results into {@code {aggregated: {stepId: result}, count}}.
 * Without {@code step_ids} every result produced so far is collected.
 */
public class AggregateActionHandler implements ActionHandler {

    @Override
    public JsonNode execute(ActionContext context) {
        ObjectNode aggregated = context.newObject();

        JsonNode stepIds = context.getParams().get("step_ids");
        if (stepIds != null && stepIds.isArray()) {
            for (JsonNode id : stepIds) {
                JsonNode result = context.getStepResult(id.asText());
                if (result != null && !result.isNull()) {
                    aggregated.set(id.asText(), result);
                }
            }
        } else {
            for (Map.Entry<String, JsonNode> entry : context.getExecution().getStepResults().entrySet()) {
                if (entry.getValue() != null && !entry.getValue().isNull()) {
                    aggregated.set(entry.getKey(), entry.getValue());
                }
            }
        }

        ObjectNode output = context.newObject();
        output.set("aggregated", aggregated);
        output.put("count", aggregated.size());
        return output;
    }
}
