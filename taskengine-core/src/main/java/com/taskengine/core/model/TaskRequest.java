package com.taskengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parameters for enqueuing a task.
 *
 * @param maxAttempts per-task override; {@code null} uses the configured default
 * @param skipLimits bypass per-owner quotas (trusted internal producers only)
 */
public record TaskRequest(
    String ownerId,
    String taskType,
    String inputText,
    JsonNode inputData,
    Integer maxAttempts,
    boolean skipLimits
) {
    public TaskRequest {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static TaskRequest of(String ownerId, String taskType, String inputText) {
        return new TaskRequest(ownerId, taskType, inputText, null, null, false);
    }

    public TaskRequest withMaxAttempts(int attempts) {
        return new TaskRequest(ownerId, taskType, inputText, inputData, attempts, skipLimits);
    }

    public TaskRequest withInputData(JsonNode data) {
        return new TaskRequest(ownerId, taskType, inputText, data, maxAttempts, skipLimits);
    }

    public TaskRequest withoutLimits() {
        return new TaskRequest(ownerId, taskType, inputText, inputData, maxAttempts, true);
    }
}
