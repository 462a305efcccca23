package com.taskengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Transient per-run state for one agent-loop invocation.
 * Owned by a single run and discarded when it ends; never shared across tasks.
 */
public class ExecutionContext {

    private final UUID taskId;
    private final String ownerId;
    private final String workerId;
    private final int attempt;
    private final String inputText;
    private final JsonNode inputData;
    private final Plan plan;
    private final Map<String, JsonNode> stepResults = new LinkedHashMap<>();
    private final int maxSteps;
    private final Duration maxWallTime;
    private final Clock clock;
    private final Instant startedAt;
    private int stepsExecuted;

    public ExecutionContext(Task task, Plan plan, String workerId, int maxSteps, Duration maxWallTime, Clock clock) {
        this.taskId = task.id();
        this.ownerId = task.ownerId();
        this.workerId = workerId;
        this.attempt = task.attempts();
        this.inputText = task.inputText();
        this.inputData = task.inputData();
        this.plan = plan;
        this.maxSteps = maxSteps;
        this.maxWallTime = maxWallTime;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public boolean isOverStepLimit() {
        return stepsExecuted >= maxSteps;
    }

    public boolean isOverTimeLimit() {
        return elapsed().compareTo(maxWallTime) >= 0;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public void putStepResult(String stepId, JsonNode result) {
        stepResults.put(stepId, result);
    }

    public JsonNode getStepResult(String stepId) {
        return stepResults.get(stepId);
    }

    public boolean hasStepResult(String stepId) {
        return stepResults.containsKey(stepId);
    }

    /**
     * Most recently produced result, or {@code null} when nothing has run yet.
     */
    public JsonNode lastResult() {
        JsonNode last = null;
        for (JsonNode value : stepResults.values()) {
            last = value;
        }
        return last;
    }

    public Map<String, JsonNode> getStepResults() {
        return Collections.unmodifiableMap(stepResults);
    }

    public void incrementStepsExecuted() {
        stepsExecuted++;
    }

    public Instant now() {
        return clock.instant();
    }

    public UUID getTaskId() {
        return taskId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    /**
     * Worker holding the task lease for this run, null outside a worker.
     */
    public String getWorkerId() {
        return workerId;
    }

    public int getAttempt() {
        return attempt;
    }

    public String getInputText() {
        return inputText;
    }

    public JsonNode getInputData() {
        return inputData;
    }

    public Plan getPlan() {
        return plan;
    }

    public int getStepsExecuted() {
        return stepsExecuted;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public Duration getMaxWallTime() {
        return maxWallTime;
    }

    public Instant getStartedAt() {
        return startedAt;
    }
}
