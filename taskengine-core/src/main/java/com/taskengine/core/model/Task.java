package com.taskengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * A unit of queued work tracked through the task state machine.
 * Primary source of truth for task state.
 *
 * Primary Key: id
 *
 * Invariants:
 * - lockedBy and leaseExpiresAt are set together, and only while RUNNING
 * - attempts never exceeds maxAttempts
 * - completedAt set iff state is terminal
 * - version increases on every write (optimistic locking)
 */
public record Task(
    // Identity
    UUID id,
    String ownerId,

    // Input
    String taskType,
    String inputText,
    JsonNode inputData,

    // State
    TaskState state,
    PauseReason pauseReason,
    int attempts,
    int maxAttempts,

    // Lease
    String lockedBy,
    Instant lockedAt,
    Instant leaseExpiresAt,

    // Progress pointers
    String currentPlanId,
    String currentStepId,

    // Outcome
    JsonNode result,
    String error,

    // Timing
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt,

    // Versioning (optimistic locking)
    long version
) {
    /**
     * Create a new task in QUEUED state.
     */
    public static Task create(
            String ownerId,
            String taskType,
            String inputText,
            JsonNode inputData,
            int maxAttempts,
            Instant now) {
        return new Task(
            UUID.randomUUID(),
            ownerId,
            taskType,
            inputText,
            inputData,
            TaskState.QUEUED,
            null,
            0,
            maxAttempts,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            now,
            now,
            null,
            null,
            0L
        );
    }

    /**
     * Check if the task is held by a worker whose lease has not expired.
     */
    public boolean hasValidLease(Instant now) {
        return state == TaskState.RUNNING &&
               lockedBy != null &&
               leaseExpiresAt != null &&
               leaseExpiresAt.isAfter(now);
    }

    /**
     * Check if the lease has expired.
     */
    public boolean isLeaseExpired(Instant now) {
        return leaseExpiresAt != null && !leaseExpiresAt.isAfter(now);
    }

    public boolean isHeldBy(String workerId) {
        return state == TaskState.RUNNING && workerId != null && workerId.equals(lockedBy);
    }

    /**
     * Check if another attempt is allowed after a failure.
     */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    /**
     * Check if the task can be picked up by {@code claim} at the given instant.
     */
    public boolean isClaimable(Instant now) {
        if (state == TaskState.QUEUED) {
            return lockedBy == null;
        }
        return state == TaskState.RUNNING && isLeaseExpired(now) && attempts < maxAttempts;
    }

    // ========== Transitions ==========

    public Task withClaimed(String workerId, Instant now, Instant leaseExpiry) {
        return toBuilder()
            .state(TaskState.RUNNING)
            .lockedBy(workerId)
            .lockedAt(now)
            .leaseExpiresAt(leaseExpiry)
            .attempts(Math.min(attempts + 1, maxAttempts))
            .startedAt(startedAt != null ? startedAt : now)
            .updatedAt(now)
            .build();
    }

    public Task withLeaseExtended(Instant leaseExpiry, Instant now) {
        return toBuilder()
            .leaseExpiresAt(leaseExpiry)
            .updatedAt(now)
            .build();
    }

    public Task withPaused(PauseReason reason, Instant now) {
        return toBuilder()
            .state(TaskState.PAUSED)
            .pauseReason(reason)
            .releaseLease()
            .updatedAt(now)
            .build();
    }

    public Task withResumed(Instant now) {
        return toBuilder()
            .state(TaskState.QUEUED)
            .pauseReason(null)
            .updatedAt(now)
            .build();
    }

    public Task withSucceeded(JsonNode taskResult, Instant now) {
        return toBuilder()
            .state(TaskState.SUCCEEDED)
            .result(taskResult)
            .releaseLease()
            .updatedAt(now)
            .completedAt(now)
            .build();
    }

    public Task withRetryScheduled(String errorMessage, Instant now) {
        return toBuilder()
            .state(TaskState.QUEUED)
            .error(errorMessage)
            .releaseLease()
            .updatedAt(now)
            .build();
    }

    public Task withFailed(String errorMessage, Instant now) {
        return toBuilder()
            .state(TaskState.FAILED)
            .error(errorMessage)
            .releaseLease()
            .updatedAt(now)
            .completedAt(now)
            .build();
    }

    public Task withCancelled(String reason, Instant now) {
        return toBuilder()
            .state(TaskState.CANCELLED)
            .error(reason)
            .pauseReason(null)
            .releaseLease()
            .updatedAt(now)
            .completedAt(now)
            .build();
    }

    public Task withPointers(String planId, String stepId, Instant now) {
        return toBuilder()
            .currentPlanId(planId)
            .currentStepId(stepId)
            .updatedAt(now)
            .build();
    }

    /**
     * Builder for creating modified copies. Building bumps the version.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final UUID id;
        private final String ownerId;
        private final String taskType;
        private final String inputText;
        private final JsonNode inputData;
        private TaskState state;
        private PauseReason pauseReason;
        private int attempts;
        private int maxAttempts;
        private String lockedBy;
        private Instant lockedAt;
        private Instant leaseExpiresAt;
        private String currentPlanId;
        private String currentStepId;
        private JsonNode result;
        private String error;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant completedAt;
        private final long version;

        public Builder(Task task) {
            this.id = task.id();
            this.ownerId = task.ownerId();
            this.taskType = task.taskType();
            this.inputText = task.inputText();
            this.inputData = task.inputData();
            this.state = task.state();
            this.pauseReason = task.pauseReason();
            this.attempts = task.attempts();
            this.maxAttempts = task.maxAttempts();
            this.lockedBy = task.lockedBy();
            this.lockedAt = task.lockedAt();
            this.leaseExpiresAt = task.leaseExpiresAt();
            this.currentPlanId = task.currentPlanId();
            this.currentStepId = task.currentStepId();
            this.result = task.result();
            this.error = task.error();
            this.createdAt = task.createdAt();
            this.updatedAt = task.updatedAt();
            this.startedAt = task.startedAt();
            this.completedAt = task.completedAt();
            this.version = task.version();
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder pauseReason(PauseReason pauseReason) {
            this.pauseReason = pauseReason;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder lockedBy(String lockedBy) {
            this.lockedBy = lockedBy;
            return this;
        }

        public Builder lockedAt(Instant lockedAt) {
            this.lockedAt = lockedAt;
            return this;
        }

        public Builder leaseExpiresAt(Instant leaseExpiresAt) {
            this.leaseExpiresAt = leaseExpiresAt;
            return this;
        }

        public Builder releaseLease() {
            this.lockedBy = null;
            this.lockedAt = null;
            this.leaseExpiresAt = null;
            return this;
        }

        public Builder currentPlanId(String currentPlanId) {
            this.currentPlanId = currentPlanId;
            return this;
        }

        public Builder currentStepId(String currentStepId) {
            this.currentStepId = currentStepId;
            return this;
        }

        public Builder result(JsonNode result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Task build() {
            return new Task(
                id, ownerId, taskType, inputText, inputData,
                state, pauseReason, attempts, maxAttempts,
                lockedBy, lockedAt, leaseExpiresAt,
                currentPlanId, currentStepId, result, error,
                createdAt, updatedAt, startedAt, completedAt,
                version + 1
            );
        }
    }
}
