package com.taskengine.core.exception;

/**
 * Thrown when a task or plan is not found.
 */
public class NotFoundException extends TaskEngineException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
