package com.taskengine.engine.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.actions.ActionContext;
import com.taskengine.actions.ActionException;
import com.taskengine.actions.ActionHandler;
import com.taskengine.actions.ApprovalRequiredException;
import com.taskengine.core.exception.PlanExecutionException;
import com.taskengine.core.exception.StepTimeoutException;
import com.taskengine.core.model.*;
import com.taskengine.engine.kernel.TaskManager;
import com.taskengine.engine.logging.LoggingContext;
import com.taskengine.engine.metrics.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a single step through its handler and records the outcome on the step.
 *
 * <pre>
 * pending -> running -> completed | failed
 * running -> pending   (approval required, re-entered after approval)
 * </pre>
 *
 * Handlers run on a separate thread so a stuck call can be abandoned after the handler
 * timeout. The abandoned thread is interrupted but not awaited.
 */
public class StepExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private static final String DEFAULT_APPROVAL_MESSAGE = "Approval required";

    private final ActionHandlerRegistry registry;
    private final TaskManager taskManager;
    private final ObjectMapper objectMapper;
    private final TaskMetrics metrics;
    private final Duration handlerTimeout;
    private final Clock clock;
    private final ExecutorService handlerPool;

    public StepExecutor(
            ActionHandlerRegistry registry,
            TaskManager taskManager,
            ObjectMapper objectMapper,
            TaskMetrics metrics,
            Duration handlerTimeout,
            Clock clock) {
        this.registry = registry;
        this.taskManager = taskManager;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.handlerTimeout = handlerTimeout;
        this.clock = clock;
        this.handlerPool = Executors.newCachedThreadPool(new HandlerThreadFactory());
    }

    /**
     * Execute one step.
     *
     * @return Completed with the handler result, or Suspended when the handler asked for approval
     *         (the task is PAUSED by then)
     * @throws com.taskengine.core.exception.UnknownActionException if no handler is registered
     * @throws StepTimeoutException if the handler outlived the handler timeout
     * @throws PlanExecutionException if the handler failed, including with an {@link Error}
     */
    public StepOutcome execute(Step step, ExecutionContext context) {
        try (LoggingContext ignored = LoggingContext.forStep(step.getStepId(), step.getAction().wireName())) {
            Instant started = clock.instant();
            ActionHandler handler;
            try {
                handler = registry.get(step.getAction());
            } catch (RuntimeException e) {
                step.markFailed(e.getMessage(), started);
                throw e;
            }

            step.markRunning(started);
            log.debug("Executing step {} ({})", step.getStepId(), step.getAction().wireName());

            Instant deadline = started.plus(handlerTimeout);
            ActionContext actionContext = new ActionContext(step, context, deadline, objectMapper,
                () -> taskManager.heartbeat(context.getTaskId(), context.getWorkerId()));

            try {
                JsonNode result = invoke(handler, actionContext, step);
                step.markCompleted(result, clock.instant());
                context.putStepResult(step.getStepId(), result);
                context.incrementStepsExecuted();
                metrics.stepFinished(step.getAction().wireName(), "completed", Duration.between(started, clock.instant()));

                if (step.getAction() == StepAction.CONDITION) {
                    applySkips(result, context);
                }
                return StepOutcome.completed(result);

            } catch (ApprovalRequiredException e) {
                return suspend(step, context, e);

            } catch (ActionException e) {
                fail(step, started, e.getMessage());
                throw new PlanExecutionException(
                    "Step " + step.getStepId() + " failed [" + e.getErrorCode() + "]: " + e.getMessage(), e);

            } catch (RuntimeException e) {
                fail(step, started, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                throw e;

            } catch (Throwable e) {
                fail(step, started, e.toString());
                throw new PlanExecutionException("Step " + step.getStepId() + " failed: " + e, e);
            }
        }
    }

    /**
     * Complete a pending approval step with the approver's decision, so the next run moves past it.
     *
     * @throws PlanExecutionException if the step does not exist, is not an approval step or is not pending
     */
    public Step completeApproval(Plan plan, String stepId, boolean approved, JsonNode editedContent) {
        Step step = plan.getStep(stepId)
            .orElseThrow(() -> new PlanExecutionException("Step " + stepId + " not found in plan " + plan.getPlanId()));
        if (step.getAction() != StepAction.APPROVAL) {
            throw new PlanExecutionException("Step " + stepId + " is not an approval step");
        }
        if (step.getStatus() != StepStatus.PENDING) {
            throw new PlanExecutionException("Approval step " + stepId + " is " + step.getStatus().wireName());
        }

        ObjectNode result = objectMapper.createObjectNode();
        result.put("approved", approved);
        result.set("edited_content", editedContent);
        step.markCompleted(result, clock.instant());
        return step;
    }

    @Override
    public void close() {
        handlerPool.shutdownNow();
    }

    // ========== Internals ==========

    private JsonNode invoke(ActionHandler handler, ActionContext actionContext, Step step) throws ActionException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<JsonNode> future = handlerPool.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return handler.execute(actionContext);
            } finally {
                MDC.clear();
            }
        });

        try {
            return future.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepTimeoutException(step.getStepId(), handlerTimeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PlanExecutionException("Interrupted while executing step " + step.getStepId(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ActionException) {
                throw (ActionException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new PlanExecutionException("Step " + step.getStepId() + " failed: " + cause, cause);
        }
    }

    private StepOutcome suspend(Step step, ExecutionContext context, ApprovalRequiredException e) {
        step.resetToPending();
        String message = e.getMessage() != null ? e.getMessage() : DEFAULT_APPROVAL_MESSAGE;

        ObjectNode data = objectMapper.createObjectNode();
        data.put("step_id", step.getStepId());
        data.put("message", message);
        data.set("draft_content", e.getDraftContent());
        taskManager.pause(context.getTaskId(), context.getWorkerId(), PauseReason.APPROVAL, data);

        log.info("Step {} awaiting approval", step.getStepId());
        metrics.stepFinished(step.getAction().wireName(), "suspended", Duration.ZERO);
        return StepOutcome.suspended(step.getStepId(), message, e.getDraftContent());
    }

    private void fail(Step step, Instant started, String error) {
        step.markFailed(error, clock.instant());
        metrics.stepFinished(step.getAction().wireName(), "failed", Duration.between(started, clock.instant()));
        log.warn("Step {} failed: {}", step.getStepId(), error);
    }

    /**
     * A false condition may name pending steps to skip via {@code skip_steps}.
     */
    private void applySkips(JsonNode conditionResult, ExecutionContext context) {
        if (conditionResult == null || conditionResult.path("result").asBoolean(true)) {
            return;
        }
        Plan plan = context.getPlan();
        for (JsonNode id : conditionResult.path("skip_steps")) {
            plan.getStep(id.asText())
                .filter(s -> s.getStatus() == StepStatus.PENDING)
                .ifPresent(s -> {
                    s.markSkipped(clock.instant());
                    ObjectNode data = objectMapper.createObjectNode();
                    data.put("step_id", s.getStepId());
                    data.put("action", s.getAction().wireName());
                    taskManager.logEvent(context.getTaskId(), TaskEventType.STEP_SKIPPED, data, s.getStepId(), null);
                    log.info("Skipped step {}", s.getStepId());
                });
        }
    }

    private static class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "step-handler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
