package com.taskengine.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.model.ExecutionContext;
import com.taskengine.core.model.Step;

import java.time.Instant;
import java.util.UUID;

/**
 * Context provided to action handlers during step execution.
 */
public class ActionContext {

    private final Step step;
    private final ExecutionContext execution;
    private final Instant deadline;
    private final ObjectMapper objectMapper;
    private final HeartbeatCallback heartbeatCallback;

    public ActionContext(
            Step step,
            ExecutionContext execution,
            Instant deadline,
            ObjectMapper objectMapper,
            HeartbeatCallback heartbeatCallback) {
        this.step = step;
        this.execution = execution;
        this.deadline = deadline;
        this.objectMapper = objectMapper;
        this.heartbeatCallback = heartbeatCallback;
    }

    /**
     * Get the step being executed.
     */
    public Step getStep() {
        return step;
    }

    /**
     * Get the step parameters.
     */
    public ObjectNode getParams() {
        return step.getActionData();
    }

    /**
     * Get a text parameter, or null if absent.
     */
    public String param(String name) {
        return step.param(name);
    }

    /**
     * Get the step parameters as a specific type.
     */
    public <T> T getParams(Class<T> type) {
        return objectMapper.convertValue(step.getActionData(), type);
    }

    /**
     * Get the result of an earlier step of this run, or null.
     */
    public JsonNode getStepResult(String stepId) {
        return stepId != null ? execution.getStepResult(stepId) : null;
    }

    /**
     * Get the result referenced by a parameter holding a step id, or null.
     */
    public JsonNode getReferencedResult(String paramName) {
        return getStepResult(param(paramName));
    }

    public ExecutionContext getExecution() {
        return execution;
    }

    public UUID getTaskId() {
        return execution.getTaskId();
    }

    public String getOwnerId() {
        return execution.getOwnerId();
    }

    public String getInputText() {
        return execution.getInputText();
    }

    public JsonNode getInputData() {
        return execution.getInputData();
    }

    /**
     * Get the task attempt number this step runs under.
     */
    public int getAttemptNumber() {
        return execution.getAttempt();
    }

    /**
     * Instant after which the executor abandons this call.
     * Long-running handlers should stop work once it has passed.
     */
    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Key stable across retries of the same step.
     * Use this when making external calls to avoid duplicate side effects.
     */
    public String getIdempotencyKey() {
        return execution.getTaskId() + ":" + execution.getPlan().getPlanId() + ":" + step.getStepId();
    }

    /**
     * Send a heartbeat to renew the task lease.
     * Call this periodically for long-running actions.
     *
     * @return true if heartbeat succeeded, false if lease was lost
     */
    public boolean heartbeat() {
        return heartbeatCallback.sendHeartbeat();
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }

    public ObjectNode newObject() {
        return objectMapper.createObjectNode();
    }

    /**
     * Callback for heartbeat/lease renewal.
     */
    @FunctionalInterface
    public interface HeartbeatCallback {
        boolean sendHeartbeat();
    }
}
