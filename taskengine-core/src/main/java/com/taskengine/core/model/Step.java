package com.taskengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One node of a plan. Shape (id, action, parameters, dependencies) is fixed at creation;
 * status and outcome fields change only through the step executor.
 */
public class Step {

    private final String stepId;
    private final StepAction action;
    private final ObjectNode actionData;
    private final List<String> dependsOn;

    private StepStatus status;
    private JsonNode result;
    private String error;
    private String snapshotRef;
    private Instant startedAt;
    private Instant completedAt;

    public Step(String stepId, StepAction action, ObjectNode actionData, List<String> dependsOn) {
        this.stepId = Objects.requireNonNull(stepId, "stepId");
        this.action = Objects.requireNonNull(action, "action");
        this.actionData = actionData != null ? actionData : JsonNodeFactory.instance.objectNode();
        this.dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        this.status = StepStatus.PENDING;
    }

    /**
     * Create a pending step with a generated id.
     */
    public static Step create(StepAction action, ObjectNode actionData, List<String> dependsOn) {
        return new Step(newStepId(), action, actionData, dependsOn);
    }

    public static String newStepId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    // ========== Status changes ==========

    public void markRunning(Instant now) {
        this.status = StepStatus.RUNNING;
        this.startedAt = now;
        this.error = null;
    }

    public void markCompleted(JsonNode stepResult, Instant now) {
        this.status = StepStatus.COMPLETED;
        this.result = stepResult;
        this.error = null;
        this.completedAt = now;
    }

    public void markFailed(String errorMessage, Instant now) {
        this.status = StepStatus.FAILED;
        this.error = errorMessage;
        this.completedAt = now;
    }

    public void markSkipped(Instant now) {
        this.status = StepStatus.SKIPPED;
        this.completedAt = now;
    }

    /**
     * Return to PENDING so the step can be re-run without redoing prior steps.
     */
    public void resetToPending() {
        this.status = StepStatus.PENDING;
        this.startedAt = null;
        this.completedAt = null;
    }

    /**
     * Restore persisted state verbatim (plan restore only).
     */
    public void restore(StepStatus status, JsonNode result, String error, String snapshotRef,
                        Instant startedAt, Instant completedAt) {
        this.status = status;
        this.result = result;
        this.error = error;
        this.snapshotRef = snapshotRef;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    public String param(String name) {
        JsonNode value = actionData.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }

    // ========== Accessors ==========

    public String getStepId() {
        return stepId;
    }

    public StepAction getAction() {
        return action;
    }

    public ObjectNode getActionData() {
        return actionData;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public StepStatus getStatus() {
        return status;
    }

    public JsonNode getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public String getSnapshotRef() {
        return snapshotRef;
    }

    public void setSnapshotRef(String snapshotRef) {
        this.snapshotRef = snapshotRef;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Step other = (Step) o;
        return stepId.equals(other.stepId)
            && action == other.action
            && actionData.equals(other.actionData)
            && dependsOn.equals(other.dependsOn)
            && status == other.status
            && Objects.equals(result, other.result)
            && Objects.equals(error, other.error)
            && Objects.equals(snapshotRef, other.snapshotRef)
            && Objects.equals(startedAt, other.startedAt)
            && Objects.equals(completedAt, other.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, action);
    }

    @Override
    public String toString() {
        return "Step[" + stepId + " " + action.wireName() + " " + status.wireName() + "]";
    }
}
