package com.taskengine.core.exception;

/**
 * Base exception for all task engine errors.
 */
public class TaskEngineException extends RuntimeException {

    private final String errorCode;

    public TaskEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
