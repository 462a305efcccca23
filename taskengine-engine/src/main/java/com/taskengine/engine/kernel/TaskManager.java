package com.taskengine.engine.kernel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.exception.*;
import com.taskengine.core.model.*;
import com.taskengine.core.repository.TaskEventRepository;
import com.taskengine.core.repository.TaskRepository;
import com.taskengine.engine.metrics.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;

/**
 * Owns the task state machine and every transition against the store.
 *
 * <pre>
 * queued -> running -> {paused, succeeded, failed, cancelled}
 * paused -> queued             (resume)
 * running -> queued            (fail with attempts remaining)
 * </pre>
 *
 * Claims and heartbeats are single atomic statements. All other transitions read the task,
 * validate the source state and write with a version check, retrying on conflicts. The task
 * row and its audit event are written in one transaction.
 */
public class TaskManager {

    private static final Logger log = LoggerFactory.getLogger(TaskManager.class);

    private static final int MAX_CONFLICT_RETRIES = 5;
    private static final int REAP_BATCH_SIZE = 100;

    private final TaskRepository taskRepository;
    private final TaskEventRepository eventRepository;
    private final TaskLimits limits;
    private final TransactionOperations transactions;
    private final ObjectMapper objectMapper;
    private final TaskMetrics metrics;
    private final Clock clock;

    public TaskManager(
            TaskRepository taskRepository,
            TaskEventRepository eventRepository,
            TaskLimits limits,
            TransactionOperations transactions,
            ObjectMapper objectMapper,
            TaskMetrics metrics,
            Clock clock) {
        this.taskRepository = taskRepository;
        this.eventRepository = eventRepository;
        this.limits = limits;
        this.transactions = transactions;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========== Creation ==========

    public Task enqueue(String ownerId, String taskType, String inputText) {
        return enqueue(TaskRequest.of(ownerId, taskType, inputText));
    }

    /**
     * Create a QUEUED task.
     *
     * @throws TaskLimitException if the owner is over a queued, active or hourly quota
     */
    public Task enqueue(TaskRequest request) {
        Instant now = clock.instant();
        int maxAttempts = request.maxAttempts() != null ? request.maxAttempts() : limits.maxAttempts();
        Task task = Task.create(
            request.ownerId(), request.taskType(), request.inputText(), request.inputData(), maxAttempts, now);

        transactions.executeWithoutResult(status -> taskRepository.withOwnerLock(request.ownerId(), () -> {
            if (!request.skipLimits()) {
                checkOwnerLimits(request.ownerId());
            }
            taskRepository.save(task);
            recordEvent(task.id(), TaskEventType.ENQUEUED,
                mapOf("task_type", task.taskType(), "input_text", task.inputText()), null, null);
            return task;
        }));
        metrics.taskEnqueued(task.taskType());

        log.info("Enqueued task {} type={} owner={}", task.id(), task.taskType(), task.ownerId());
        return task;
    }

    // ========== Leases ==========

    /**
     * Claim the oldest eligible task for a worker.
     *
     * @return The task, now RUNNING and held by the worker, or empty if nothing is eligible
     */
    public Optional<Task> claim(String workerId) {
        Instant now = clock.instant();
        Optional<Task> claimed = transactions.execute(status -> {
            Optional<Task> task = taskRepository.claimNext(workerId, now, now.plus(limits.leaseTimeout()));
            task.ifPresent(t -> recordEvent(t.id(), TaskEventType.CLAIMED,
                mapOf("worker_id", workerId, "attempt", t.attempts()), null, null));
            return task;
        });
        if (claimed == null || claimed.isEmpty()) {
            return Optional.empty();
        }

        Task task = claimed.get();
        metrics.taskClaimed(task.taskType(), task.attempts());
        log.info("Task {} claimed by {} (attempt {}/{})", task.id(), workerId, task.attempts(), task.maxAttempts());
        return claimed;
    }

    /**
     * Extend the lease if the worker still holds it.
     *
     * @return false if the task is no longer RUNNING under this worker
     */
    public boolean heartbeat(UUID taskId, String workerId) {
        Instant now = clock.instant();
        boolean extended = taskRepository.extendLease(taskId, workerId, now.plus(limits.leaseTimeout()), now);
        if (!extended) {
            log.warn("Heartbeat rejected for task {} from worker {}", taskId, workerId);
        }
        return extended;
    }

    // ========== Transitions ==========

    /**
     * Suspend a RUNNING task and release its lease.
     *
     * @param data Event payload, e.g. step_id, message, draft_content
     */
    public Task pause(UUID taskId, PauseReason reason, JsonNode data) {
        return pause(taskId, null, reason, data);
    }

    public Task pause(UUID taskId, String workerId, PauseReason reason, JsonNode data) {
        ObjectNode eventData = objectMapper.createObjectNode();
        eventData.put("reason", reason.wireName());
        if (data != null && data.isObject()) {
            eventData.setAll((ObjectNode) data.deepCopy());
        }
        String stepId = eventData.hasNonNull("step_id") ? eventData.get("step_id").asText() : null;

        Task paused = transition(taskId, "pause",
            current -> requireRunning(current, workerId, "pause"),
            current -> current.withPaused(reason, clock.instant()),
            updated -> recordEvent(taskId, TaskEventType.PAUSED, eventData, stepId, null));
        metrics.taskPaused(reason.wireName());

        log.info("Task {} paused: {}", taskId, reason.wireName());
        return paused;
    }

    /**
     * Return a PAUSED task to the queue.
     */
    public Task resume(UUID taskId) {
        Task resumed = transition(taskId, "resume",
            current -> {
                if (current.state() != TaskState.PAUSED) {
                    throw new InvalidStateTransitionException(taskId, current.state(), "resume");
                }
            },
            current -> current.withResumed(clock.instant()),
            updated -> recordEvent(taskId, TaskEventType.RESUMED, objectMapper.createObjectNode(), null, null));

        log.info("Task {} resumed", taskId);
        return resumed;
    }

    public Task succeed(UUID taskId, JsonNode result) {
        return succeed(taskId, null, result);
    }

    /**
     * Mark a RUNNING task succeeded.
     *
     * @param workerId Expected holder, or null to skip the holder check
     */
    public Task succeed(UUID taskId, String workerId, JsonNode result) {
        Task succeeded = transition(taskId, "succeed",
            current -> requireRunning(current, workerId, "succeed"),
            current -> current.withSucceeded(result, clock.instant()),
            updated -> recordEvent(taskId, TaskEventType.SUCCEEDED, objectMapper.createObjectNode(), null, null));

        Duration runTime = succeeded.startedAt() != null
            ? Duration.between(succeeded.startedAt(), succeeded.completedAt()) : null;
        metrics.taskSucceeded(succeeded.taskType(), runTime);
        log.info("Task {} succeeded", taskId);
        return succeeded;
    }

    public Task fail(UUID taskId, String error) {
        return fail(taskId, null, error);
    }

    /**
     * Record a failed attempt. Requeues while attempts remain, otherwise FAILED.
     *
     * @param workerId Expected holder, or null to skip the holder check
     * @return The task after the transition (QUEUED or FAILED)
     */
    public Task fail(UUID taskId, String workerId, String error) {
        Task result = transition(taskId, "fail",
            current -> requireRunning(current, workerId, "fail"),
            current -> current.canRetry()
                ? current.withRetryScheduled(error, clock.instant())
                : current.withFailed(error, clock.instant()),
            updated -> {
                if (updated.state() == TaskState.QUEUED) {
                    recordEvent(taskId, TaskEventType.RETRY_SCHEDULED, mapOf(
                        "error", error, "attempt", updated.attempts(), "max_attempts", updated.maxAttempts()),
                        null, null);
                } else {
                    recordEvent(taskId, TaskEventType.FAILED, mapOf(
                        "error", error, "attempts", updated.attempts()), null, null);
                }
            });

        if (result.state() == TaskState.QUEUED) {
            metrics.taskRetried(result.taskType());
            log.warn("Task {} attempt {}/{} failed, requeued: {}",
                taskId, result.attempts(), result.maxAttempts(), error);
        } else {
            metrics.taskFailed(result.taskType(), "attempts_exhausted");
            log.error("Task {} failed after {} attempts: {}", taskId, result.attempts(), error);
        }
        return result;
    }

    /**
     * Fail a RUNNING task regardless of remaining attempts (limit errors).
     */
    public Task failPermanently(UUID taskId, String workerId, String error) {
        Task failed = transition(taskId, "fail",
            current -> requireRunning(current, workerId, "fail"),
            current -> current.withFailed(error, clock.instant()),
            updated -> recordEvent(taskId, TaskEventType.FAILED, mapOf(
                "error", error, "attempts", updated.attempts(), "retryable", false), null, null));

        metrics.taskFailed(failed.taskType(), "fatal");
        log.error("Task {} failed permanently: {}", taskId, error);
        return failed;
    }

    /**
     * Cancel a task that is not yet terminal. Does not interrupt an in-flight step;
     * the holder notices on its next heartbeat or transition.
     *
     * @return false if the task was already terminal (no-op)
     */
    public boolean cancel(UUID taskId, String reason) {
        for (int i = 0; i < MAX_CONFLICT_RETRIES; i++) {
            Task current = getTask(taskId);
            if (current.state().isTerminal()) {
                log.debug("Cancel ignored, task {} already {}", taskId, current.state().wireName());
                return false;
            }
            Task cancelled = current.withCancelled(reason, clock.instant());
            Boolean applied = transactions.execute(status -> {
                if (!taskRepository.compareAndSet(cancelled, current.version())) {
                    return false;
                }
                recordEvent(taskId, TaskEventType.CANCELLED, mapOf("reason", reason), null, null);
                return true;
            });
            if (Boolean.TRUE.equals(applied)) {
                metrics.taskCancelled(cancelled.taskType());
                log.info("Task {} cancelled: {}", taskId, reason);
                return true;
            }
        }
        throw new OptimisticLockException(taskId, "cancel", MAX_CONFLICT_RETRIES);
    }

    /**
     * Record the plan and step a task is currently working on.
     */
    public Task updatePointers(UUID taskId, String planId, String stepId) {
        return transition(taskId, "update pointers",
            current -> { },
            current -> current.withPointers(planId, stepId, clock.instant()),
            updated -> { });
    }

    /**
     * Finalize RUNNING tasks whose lease expired with no attempts left. Such tasks are
     * never reclaimed, so without this they would stay RUNNING forever.
     *
     * @return Number of tasks marked FAILED
     */
    public int reapExhaustedLeases() {
        Instant now = clock.instant();
        int reaped = 0;
        for (Task task : taskRepository.findExpiredExhausted(now, REAP_BATCH_SIZE)) {
            String error = "Lease expired after " + task.attempts() + " attempts";
            Task failed = task.withFailed(error, now);
            Boolean applied = transactions.execute(status -> {
                if (!taskRepository.compareAndSet(failed, task.version())) {
                    return false;
                }
                recordEvent(task.id(), TaskEventType.LEASE_EXPIRED,
                    mapOf("worker_id", task.lockedBy(), "attempts", task.attempts()), null, null);
                return true;
            });
            if (Boolean.TRUE.equals(applied)) {
                reaped++;
                metrics.taskFailed(task.taskType(), "lease_expired");
                log.warn("Task {} failed: {} (last holder {})", task.id(), error, task.lockedBy());
            }
        }
        if (reaped > 0) {
            metrics.leasesReaped(reaped);
        }
        return reaped;
    }

    // ========== Events ==========

    /**
     * Append an audit event for a task.
     */
    public void logEvent(UUID taskId, TaskEventType type, JsonNode data, String stepId, String toolName) {
        recordEvent(taskId, type, data != null ? data : objectMapper.createObjectNode(), stepId, toolName);
    }

    /**
     * Events of a task, newest first.
     */
    public List<TaskEvent> getTaskEvents(UUID taskId, int limit) {
        return eventRepository.findByTask(taskId, limit);
    }

    // ========== Queries ==========

    public Task getTask(UUID taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId.toString()));
    }

    public Optional<Task> findTask(UUID taskId) {
        return taskRepository.findById(taskId);
    }

    /**
     * Tasks of an owner, newest first.
     *
     * @param state Optional filter, null for all states
     */
    public List<Task> getOwnerTasks(String ownerId, TaskState state, int limit) {
        return taskRepository.findByOwner(ownerId, state, limit);
    }

    /**
     * Number of QUEUED tasks across all owners.
     */
    public int getQueueSize() {
        return taskRepository.countByState(TaskState.QUEUED);
    }

    public OwnerLimitsStatus getOwnerLimitsStatus(String ownerId) {
        Instant now = clock.instant();
        return new OwnerLimitsStatus(
            ownerId,
            taskRepository.countByOwnerAndStates(ownerId, Set.of(TaskState.QUEUED)),
            limits.maxQueuedPerOwner(),
            taskRepository.countByOwnerAndStates(ownerId, TaskState.ACTIVE),
            limits.maxActivePerOwner(),
            taskRepository.countCreatedSince(ownerId, now.minus(Duration.ofHours(1))),
            limits.maxPerHour()
        );
    }

    public TaskLimits getLimits() {
        return limits;
    }

    // ========== Helper Methods ==========

    private void checkOwnerLimits(String ownerId) {
        OwnerLimitsStatus status = getOwnerLimitsStatus(ownerId);
        if (status.queued() >= status.maxQueued()) {
            reject(ownerId, "queued", status.queued(), status.maxQueued());
        }
        if (status.active() >= status.maxActive()) {
            reject(ownerId, "active", status.active(), status.maxActive());
        }
        if (status.createdLastHour() >= status.maxPerHour()) {
            reject(ownerId, "hourly", status.createdLastHour(), status.maxPerHour());
        }
    }

    private void reject(String ownerId, String limitName, int current, int max) {
        metrics.taskRejected(limitName);
        log.warn("Rejected task for owner {}: {} limit {}/{}", ownerId, limitName, current, max);
        throw new TaskLimitException(ownerId, limitName, current, max);
    }

    private static void requireRunning(Task current, String workerId, String operation) {
        if (current.state() != TaskState.RUNNING) {
            throw new InvalidStateTransitionException(current.id(), current.state(), operation);
        }
        if (workerId != null && !workerId.equals(current.lockedBy())) {
            throw new LeaseLostException(current.id(), workerId);
        }
    }

    /**
     * Read, validate, write with a version check and record the event in one transaction.
     * Re-reads and re-validates on version conflicts.
     */
    private Task transition(
            UUID taskId,
            String operation,
            Guard guard,
            Function<Task, Task> change,
            EventWriter events) {
        for (int i = 0; i < MAX_CONFLICT_RETRIES; i++) {
            Task current = getTask(taskId);
            guard.check(current);
            Task updated = change.apply(current);
            Boolean applied = transactions.execute(status -> {
                if (!taskRepository.compareAndSet(updated, current.version())) {
                    return false;
                }
                events.write(updated);
                return true;
            });
            if (Boolean.TRUE.equals(applied)) {
                return updated;
            }
            log.debug("Version conflict on task {} during {}, retrying", taskId, operation);
        }
        throw new OptimisticLockException(taskId, operation, MAX_CONFLICT_RETRIES);
    }

    private void recordEvent(UUID taskId, TaskEventType type, JsonNode data, String stepId, String toolName) {
        eventRepository.append(TaskEvent.forStep(taskId, type, data, stepId, toolName, clock.instant()));
    }

    private ObjectNode mapOf(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return objectMapper.valueToTree(map);
    }

    @FunctionalInterface
    private interface Guard {
        void check(Task current);
    }

    @FunctionalInterface
    private interface EventWriter {
        void write(Task updated);
    }
}
