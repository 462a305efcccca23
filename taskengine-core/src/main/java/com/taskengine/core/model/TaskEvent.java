package com.taskengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit record in the append-only task event log.
 *
 * Invariants:
 * - events are never updated once written
 * - stepId and toolName are optional
 */
public record TaskEvent(
    UUID eventId,
    UUID taskId,
    TaskEventType eventType,
    JsonNode eventData,
    String stepId,
    String toolName,
    Instant createdAt
) {
    public static TaskEvent create(UUID taskId, TaskEventType eventType, JsonNode eventData, Instant now) {
        return new TaskEvent(UUID.randomUUID(), taskId, eventType, eventData, null, null, now);
    }

    public static TaskEvent forStep(
            UUID taskId,
            TaskEventType eventType,
            JsonNode eventData,
            String stepId,
            String toolName,
            Instant now) {
        return new TaskEvent(UUID.randomUUID(), taskId, eventType, eventData, stepId, toolName, now);
    }
}
