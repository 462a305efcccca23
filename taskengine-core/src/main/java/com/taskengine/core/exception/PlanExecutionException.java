package com.taskengine.core.exception;

/**
 * Thrown when a step fails or a plan cannot make progress.
 * Retryable: the worker loop decides between requeue and terminal failure.
 */
public class PlanExecutionException extends TaskEngineException {

    public static final String ERROR_CODE = "PLAN_EXECUTION_FAILED";

    public PlanExecutionException(String message) {
        super(ERROR_CODE, message);
    }

    public PlanExecutionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
