package com.taskengine.actions;

/**
 * Exception thrown by action handlers on failure.
 */
public class ActionException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public ActionException(String errorCode, String message) {
        this(errorCode, message, null, true);
    }

    public ActionException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true);
    }

    public ActionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether a fresh task attempt may succeed. Non-retryable failures end the task.
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static ActionException permanent(String errorCode, String message) {
        return new ActionException(errorCode, message, null, false);
    }
}
