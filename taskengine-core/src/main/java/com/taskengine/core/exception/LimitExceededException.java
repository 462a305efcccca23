package com.taskengine.core.exception;

/**
 * Thrown when a run exceeds its step-count or wall-time budget.
 * Fatal: the task is failed without retry.
 */
public class LimitExceededException extends TaskEngineException {

    public static final String ERROR_CODE = "EXECUTION_LIMIT_EXCEEDED";

    public LimitExceededException(String message) {
        super(ERROR_CODE, message);
    }
}
