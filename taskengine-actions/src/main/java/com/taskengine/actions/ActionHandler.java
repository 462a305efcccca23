package com.taskengine.actions;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Implementation of one step action kind.
 *
 * Handlers may be invoked more than once for the same step: a worker can lose its lease
 * mid-call and another worker then re-runs the step. Side effects must be idempotent;
 * {@link ActionContext#getIdempotencyKey()} is stable across such re-runs.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Execute the step.
     *
     * @param context Step parameters, prior results and utilities
     * @return The step result
     * @throws ActionException if the action fails
     * @throws ApprovalRequiredException to suspend the task for human approval
     */
    JsonNode execute(ActionContext context) throws ActionException;
}
