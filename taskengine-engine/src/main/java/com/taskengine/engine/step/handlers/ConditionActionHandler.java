package com.taskengine.engine.step.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.actions.ActionContext;
import com.taskengine.actions.ActionHandler;
import com.taskengine.core.condition.ConditionEvaluator;

/**
 * Evaluates {@code condition} against the {@code source_step_id} result, or the latest result.
 * A false outcome passes {@code skip_steps} through so the executor can skip those steps.
 */
public class ConditionActionHandler implements ActionHandler {

    private final ConditionEvaluator evaluator;

    public ConditionActionHandler(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public JsonNode execute(ActionContext context) {
        String condition = context.param("condition");
        if (condition == null) {
            condition = "true";
        }

        boolean result = evaluator.evaluate(
            condition, context.getExecution().getStepResults(), context.param("source_step_id"));

        ObjectNode output = context.newObject();
        output.put("condition", condition);
        output.put("result", result);
        output.put("branch", result ? "true" : "false");
        JsonNode skip = context.getParams().get("skip_steps");
        if (!result && skip != null && skip.isArray()) {
            output.set("skip_steps", skip.deepCopy());
        }
        return output;
    }
}
