package com.taskengine.engine.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId, attempt)) {
 *     log.info("Running plan"); // Automatically includes taskId, attempt
 * }
 * </pre>
 *
 * Contexts nest: closing one removes only the keys it added, so a step context inside a
 * task context inside a worker context unwinds cleanly.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String STEP_ID = "stepId";
    public static final String ACTION = "action";
    public static final String ATTEMPT = "attempt";
    public static final String WORKER_ID = "workerId";
    public static final String TRACE_ID = "traceId";

    private final List<String> addedKeys = new ArrayList<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for task-level operations.
     */
    public static LoggingContext forTask(UUID taskId, int attempt) {
        LoggingContext ctx = new LoggingContext();
        if (taskId != null) {
            ctx.put(TASK_ID, taskId.toString());
        }
        ctx.put(ATTEMPT, String.valueOf(attempt));
        ctx.ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a single step.
     */
    public static LoggingContext forStep(String stepId, String action) {
        LoggingContext ctx = new LoggingContext();
        if (stepId != null) {
            ctx.put(STEP_ID, stepId);
        }
        if (action != null) {
            ctx.put(ACTION, action);
        }
        return ctx;
    }

    /**
     * Create a logging context for worker operations.
     */
    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        if (workerId != null) {
            ctx.put(WORKER_ID, workerId);
        }
        return ctx;
    }

    /**
     * Get current task ID from context.
     */
    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        if (MDC.get(key) == null) {
            addedKeys.add(key);
        }
        MDC.put(key, value);
    }

    /**
     * Ensure a trace ID exists in the context.
     */
    private void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        addedKeys.forEach(MDC::remove);
    }
}
