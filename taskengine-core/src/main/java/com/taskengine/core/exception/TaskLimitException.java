package com.taskengine.core.exception;

/**
 * Thrown by enqueue when an owner exceeds a queued, active or hourly quota.
 * No state is created when this is raised.
 */
public class TaskLimitException extends TaskEngineException {

    public static final String ERROR_CODE = "TASK_LIMIT_EXCEEDED";

    private final String limitName;
    private final int limit;

    public TaskLimitException(String ownerId, String limitName, int current, int limit) {
        super(ERROR_CODE, String.format(
            "Owner %s reached %s limit (%d/%d)",
            ownerId, limitName, current, limit
        ));
        this.limitName = limitName;
        this.limit = limit;
    }

    public String getLimitName() {
        return limitName;
    }

    public int getLimit() {
        return limit;
    }
}
