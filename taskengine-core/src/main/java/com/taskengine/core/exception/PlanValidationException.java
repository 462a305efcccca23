package com.taskengine.core.exception;

/**
 * Thrown when a plan is not a valid DAG or cannot be decoded.
 */
public class PlanValidationException extends TaskEngineException {

    public static final String ERROR_CODE = "INVALID_PLAN";

    public PlanValidationException(String planId, String message) {
        super(ERROR_CODE, "Invalid plan " + planId + ": " + message);
    }

    public PlanValidationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
