package com.taskengine.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.actions.ActionException;
import com.taskengine.core.exception.*;
import com.taskengine.core.model.*;
import com.taskengine.engine.kernel.TaskManager;
import com.taskengine.engine.logging.LoggingContext;
import com.taskengine.engine.metrics.TaskMetrics;
import com.taskengine.engine.persistence.PlanStore;
import com.taskengine.engine.planning.PlanManager;
import com.taskengine.engine.step.StepExecutor;
import com.taskengine.engine.step.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Claims tasks and drives their plans step by step.
 *
 * <p>Worker loop: claim, run, repeat; sleep when the queue is empty. Each worker thread is a
 * sequential loop and the store's atomic claim is the only coordination between them.
 *
 * <p>Agent loop, per step: check the run's budgets, renew the lease, pick the next ready step,
 * execute it. A step that needs approval pauses the task and ends the run. Any failure ends
 * the run and is handed to {@link #handleFailure}, the single place that decides between
 * retry and terminal failure.
 */
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    private static final long STOP_TIMEOUT_SECONDS = 30;
    static final String REJECTION_REASON = "user_rejected";

    private final TaskManager taskManager;
    private final PlanManager planManager;
    private final StepExecutor stepExecutor;
    private final PlanStore planStore;
    private final ObjectMapper objectMapper;
    private final TaskMetrics metrics;
    private final ExecutionLimits limits;
    private final Clock clock;
    private final String workerIdPrefix;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ExecutorService workers;

    public AgentExecutor(
            TaskManager taskManager,
            PlanManager planManager,
            StepExecutor stepExecutor,
            PlanStore planStore,
            ObjectMapper objectMapper,
            TaskMetrics metrics,
            ExecutionLimits limits,
            Clock clock) {
        Duration leaseTimeout = taskManager.getLimits().leaseTimeout();
        if (limits.handlerTimeout().compareTo(leaseTimeout) >= 0) {
            // the agent loop heartbeats between steps only
            throw new IllegalArgumentException(String.format(
                "Handler timeout %ds must be shorter than the lease timeout %ds",
                limits.handlerTimeout().toSeconds(), leaseTimeout.toSeconds()));
        }
        this.taskManager = taskManager;
        this.planManager = planManager;
        this.stepExecutor = stepExecutor;
        this.planStore = planStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.limits = limits;
        this.clock = clock;
        this.workerIdPrefix = "worker-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ========== Worker loop ==========

    /**
     * Start the worker threads. No-op if already running.
     */
    public void startWorker() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger counter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(limits.workerThreads(), r -> {
            Thread thread = new Thread(r, "taskengine-" + workerIdPrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 1; i <= limits.workerThreads(); i++) {
            String workerId = workerIdPrefix + "-" + i;
            workers.submit(() -> workerLoop(workerId));
        }
        log.info("Started {} worker thread(s) with prefix {}", limits.workerThreads(), workerIdPrefix);
    }

    /**
     * Stop the worker threads, letting in-flight runs finish for a bounded time.
     */
    public void stopWorker() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping workers {}", workerIdPrefix);
        ExecutorService pool = workers;
        pool.shutdown();
        try {
            if (!pool.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Workers did not stop within {}s, interrupting", STOP_TIMEOUT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void workerLoop(String workerId) {
        try (LoggingContext ignored = LoggingContext.forWorker(workerId)) {
            log.info("Worker {} polling", workerId);
            while (running.get()) {
                try {
                    if (processOne(workerId).isEmpty() && taskManager.reapExhaustedLeases() == 0) {
                        Thread.sleep(limits.pollInterval().toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Throwable e) {
                    // only stopWorker or an interrupt ends the loop
                    log.error("Error in worker loop", e);
                    try {
                        Thread.sleep(limits.pollInterval().toMillis() * 2);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
            log.info("Worker {} stopped", workerId);
        }
    }

    /**
     * Claim and run one task.
     *
     * @return The task as stored after the run, or empty if nothing was claimable
     */
    public Optional<Task> processOne(String workerId) {
        Optional<Task> claimed = taskManager.claim(workerId);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }

        Task task = claimed.get();
        try {
            runTask(task, workerId);
        } catch (RuntimeException e) {
            handleFailure(task, workerId, e);
        } catch (Throwable e) {
            handleFailure(task, workerId, new PlanExecutionException("Run of task " + task.id() + " failed: " + e, e));
        }
        return taskManager.findTask(task.id());
    }

    // ========== Agent loop ==========

    /**
     * Run a claimed task until its plan completes or a step suspends it.
     *
     * @param task A RUNNING task held by {@code workerId}
     * @throws LeaseLostException if another worker took the task over
     * @throws LimitExceededException if the run went over its step or time budget
     * @throws RuntimeException any step failure, after the plan has been saved
     */
    public RunOutcome runTask(Task task, String workerId) {
        try (LoggingContext ignored = LoggingContext.forTask(task.id(), task.attempts())) {
            Plan plan = loadPlan(task);
            ExecutionContext context = new ExecutionContext(
                task, plan, workerId, limits.maxSteps(), limits.maxWallTime(), clock);
            plan.completedResults().forEach(context::putStepResult);

            RunOutcome outcome;
            try {
                outcome = agentLoop(context, plan);
            } catch (LeaseLostException e) {
                throw e;
            } catch (RuntimeException e) {
                planStore.save(plan);
                throw e;
            }

            if (outcome == RunOutcome.SUSPENDED) {
                return outcome;
            }
            taskManager.succeed(task.id(), workerId, buildResult(context, plan));
            return RunOutcome.SUCCEEDED;
        }
    }

    private Plan loadPlan(Task task) {
        if (task.currentPlanId() == null) {
            Plan plan = planManager.build(task.id(), task.taskType(), task.inputText(), task.inputData());
            planStore.save(plan);
            taskManager.updatePointers(task.id(), plan.getPlanId(), null);
            return plan;
        }

        Plan plan = planStore.restore(task);
        for (Step step : plan.getSteps()) {
            if (step.getStatus() == StepStatus.FAILED) {
                log.info("Retrying failed step {} on attempt {}", step.getStepId(), task.attempts());
                step.resetToPending();
            }
        }
        log.info("Resuming plan {} of task {}", plan.getPlanId(), task.id());
        return plan;
    }

    private RunOutcome agentLoop(ExecutionContext context, Plan plan) {
        UUID taskId = context.getTaskId();
        while (!plan.isComplete()) {
            checkLimits(context);

            if (!taskManager.heartbeat(taskId, context.getWorkerId())) {
                throw new LeaseLostException(taskId, context.getWorkerId());
            }

            Optional<Step> next = plan.getNextStep();
            if (next.isEmpty()) {
                if (plan.hasFailed()) {
                    throw new PlanExecutionException("Plan has failed steps");
                }
                break;
            }

            Step step = next.get();
            plan.markCurrent(step);
            taskManager.updatePointers(taskId, plan.getPlanId(), step.getStepId());
            logStepEvent(taskId, TaskEventType.STEP_STARTED, step, null);

            StepOutcome outcome;
            try {
                outcome = stepExecutor.execute(step, context);
            } catch (LeaseLostException e) {
                throw e;
            } catch (RuntimeException e) {
                logStepEvent(taskId, TaskEventType.STEP_FAILED, step, e.getMessage());
                throw e;
            }

            if (outcome.isSuspended()) {
                logStepEvent(taskId, TaskEventType.APPROVAL_REQUIRED, step, null);
                planStore.save(plan);
                return RunOutcome.SUSPENDED;
            }
            logStepEvent(taskId, TaskEventType.STEP_COMPLETED, step, null);
            planStore.save(plan);
        }
        return RunOutcome.SUCCEEDED;
    }

    private void checkLimits(ExecutionContext context) {
        if (context.isOverStepLimit()) {
            throw new LimitExceededException(String.format(
                "Step limit exceeded: %d/%d", context.getStepsExecuted(), context.getMaxSteps()));
        }
        if (context.isOverTimeLimit()) {
            throw new LimitExceededException(String.format(
                "Time limit exceeded: %ds/%ds", context.elapsed().toSeconds(), context.getMaxWallTime().toSeconds()));
        }
    }

    private JsonNode buildResult(ExecutionContext context, Plan plan) {
        ObjectNode stepResults = objectMapper.createObjectNode();
        for (Step step : plan.getSteps()) {
            if (step.getStatus() == StepStatus.COMPLETED && step.getResult() != null) {
                stepResults.set(step.getStepId(), step.getResult());
            }
        }
        List<Step> steps = plan.getSteps();
        JsonNode primaryOutput = steps.isEmpty() ? null : steps.get(steps.size() - 1).getResult();

        ObjectNode result = objectMapper.createObjectNode();
        result.put("success", true);
        result.put("steps_executed", context.getStepsExecuted());
        result.set("primary_output", primaryOutput);
        result.set("step_results", stepResults);
        return result;
    }

    private void logStepEvent(UUID taskId, TaskEventType type, Step step, String error) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("step_id", step.getStepId());
        data.put("action", step.getAction().wireName());
        data.put("error", error);
        taskManager.logEvent(taskId, type, data, step.getStepId(), step.param("tool"));
    }

    // ========== Failure handling ==========

    /**
     * Decide what a failed run means for the task. A lost lease leaves the task to its new
     * holder. Budget overruns, unknown actions and non-retryable action errors fail the task
     * outright. Everything else consumes an attempt.
     */
    void handleFailure(Task task, String workerId, RuntimeException e) {
        if (e instanceof LeaseLostException) {
            metrics.leaseLost();
            log.warn("Abandoning task {}: {}", task.id(), e.getMessage());
            return;
        }

        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        try {
            if (isPermanent(e)) {
                log.warn("Task {} failed permanently: {}", task.id(), error);
                taskManager.failPermanently(task.id(), workerId, error);
            } else {
                log.warn("Task {} run failed: {}", task.id(), error, e);
                taskManager.fail(task.id(), workerId, error);
            }
        } catch (LeaseLostException | InvalidStateTransitionException ex) {
            log.warn("Could not record failure of task {}: {}", task.id(), ex.getMessage());
        }
    }

    private static boolean isPermanent(RuntimeException e) {
        if (e instanceof LimitExceededException || e instanceof UnknownActionException) {
            return true;
        }
        return e.getCause() instanceof ActionException && !((ActionException) e.getCause()).isRetryable();
    }

    // ========== Approval ==========

    /**
     * Complete the pending approval step of a paused task and put the task back in the queue.
     *
     * @param editedContent Replacement for the draft, may be null
     * @throws InvalidStateTransitionException if the task is not paused for approval
     */
    public Task approve(UUID taskId, JsonNode editedContent) {
        Task task = requirePausedForApproval(taskId, "approve");
        Plan plan = planStore.restore(task);

        String stepId = task.currentStepId();
        if (stepId == null) {
            stepId = plan.getNextStep()
                .map(Step::getStepId)
                .orElseThrow(() -> new PlanExecutionException("Task " + taskId + " has no pending approval step"));
        }
        stepExecutor.completeApproval(plan, stepId, true, editedContent);
        planStore.save(plan);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("step_id", stepId);
        data.put("edited", editedContent != null && !editedContent.isNull());
        taskManager.logEvent(taskId, TaskEventType.APPROVAL_GRANTED, data, stepId, null);

        log.info("Task {} approved at step {}", taskId, stepId);
        return taskManager.resume(taskId);
    }

    /**
     * Cancel a task that is paused for approval.
     *
     * @throws InvalidStateTransitionException if the task is not paused for approval
     */
    public Task reject(UUID taskId) {
        requirePausedForApproval(taskId, "reject");
        taskManager.cancel(taskId, REJECTION_REASON);
        log.info("Task {} rejected", taskId);
        return taskManager.getTask(taskId);
    }

    private Task requirePausedForApproval(UUID taskId, String operation) {
        Task task = taskManager.getTask(taskId);
        if (task.state() != TaskState.PAUSED || task.pauseReason() != PauseReason.APPROVAL) {
            throw new InvalidStateTransitionException(taskId, task.state(), operation);
        }
        return task;
    }

    public String getWorkerIdPrefix() {
        return workerIdPrefix;
    }
}
