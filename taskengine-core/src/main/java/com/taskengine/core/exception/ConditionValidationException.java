package com.taskengine.core.exception;

/**
 * Thrown for malformed condition expressions or values that cannot be evaluated.
 */
public class ConditionValidationException extends TaskEngineException {

    public static final String ERROR_CODE = "INVALID_CONDITION";

    public ConditionValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
