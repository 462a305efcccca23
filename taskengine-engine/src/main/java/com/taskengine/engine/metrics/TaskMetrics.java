package com.taskengine.engine.metrics;

import com.taskengine.core.model.TaskState;
import com.taskengine.core.repository.TaskRepository;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;

/**
 * Micrometer metrics for the task engine.
 *
 * Metrics exposed:
 * - Task counts by state (gauges read from the store)
 * - Lifecycle counters (enqueued, claimed, retried, succeeded, failed, cancelled, paused)
 * - Step duration timers by action and outcome
 * - Lease losses and reaped leases
 */
public class TaskMetrics implements MeterBinder {

    // Metric names
    public static final String TASK_COUNT = "taskengine.tasks";
    public static final String TASKS_ENQUEUED = "taskengine.tasks.enqueued";
    public static final String TASKS_REJECTED = "taskengine.tasks.rejected";
    public static final String TASKS_CLAIMED = "taskengine.tasks.claimed";
    public static final String TASKS_RETRIED = "taskengine.tasks.retried";
    public static final String TASKS_SUCCEEDED = "taskengine.tasks.succeeded";
    public static final String TASKS_FAILED = "taskengine.tasks.failed";
    public static final String TASKS_CANCELLED = "taskengine.tasks.cancelled";
    public static final String TASKS_PAUSED = "taskengine.tasks.paused";

    public static final String STEP_DURATION = "taskengine.step.duration";
    public static final String TASK_DURATION = "taskengine.task.duration";

    public static final String LEASE_LOST = "taskengine.lease.lost";
    public static final String LEASE_REAPED = "taskengine.lease.reaped";

    private final TaskRepository taskRepository;
    private volatile MeterRegistry registry = Metrics.globalRegistry;

    public TaskMetrics(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        if (taskRepository != null) {
            for (TaskState state : TaskState.values()) {
                Gauge.builder(TASK_COUNT, taskRepository, repo -> repo.countByState(state))
                    .tag("state", state.wireName())
                    .description("Number of tasks in " + state.wireName() + " state")
                    .register(registry);
            }
        }
    }

    // ========== Task Metrics ==========

    public void taskEnqueued(String taskType) {
        counter(TASKS_ENQUEUED, "Total tasks enqueued", "type", taskType).increment();
    }

    public void taskRejected(String limitName) {
        counter(TASKS_REJECTED, "Enqueue requests rejected by owner limits", "limit", limitName).increment();
    }

    public void taskClaimed(String taskType, int attempt) {
        counter(TASKS_CLAIMED, "Total task claims", "type", taskType,
            "reclaim", String.valueOf(attempt > 1)).increment();
    }

    public void taskRetried(String taskType) {
        counter(TASKS_RETRIED, "Failed attempts requeued for retry", "type", taskType).increment();
    }

    public void taskSucceeded(String taskType, Duration runTime) {
        counter(TASKS_SUCCEEDED, "Total tasks succeeded", "type", taskType).increment();
        if (runTime != null) {
            Timer.builder(TASK_DURATION)
                .tag("type", taskType)
                .description("Time from first claim to success")
                .register(registry)
                .record(runTime);
        }
    }

    public void taskFailed(String taskType, String reason) {
        counter(TASKS_FAILED, "Total tasks failed terminally", "type", taskType, "reason", reason).increment();
    }

    public void taskCancelled(String taskType) {
        counter(TASKS_CANCELLED, "Total tasks cancelled", "type", taskType).increment();
    }

    public void taskPaused(String reason) {
        counter(TASKS_PAUSED, "Total task suspensions", "reason", reason).increment();
    }

    // ========== Step Metrics ==========

    public void stepFinished(String action, String outcome, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("action", action)
            .tag("outcome", outcome)
            .description("Step handler execution time")
            .register(registry)
            .record(duration);
    }

    // ========== Lease Metrics ==========

    public void leaseLost() {
        counter(LEASE_LOST, "Runs abandoned after losing the task lease").increment();
    }

    public void leasesReaped(int count) {
        counter(LEASE_REAPED, "Expired leases finalized with no attempts left").increment(count);
    }

    private Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
            .tags(tags)
            .description(description)
            .register(registry);
    }
}
