package com.taskengine.core.exception;

import java.util.UUID;

/**
 * Thrown when a worker no longer holds the lease of the task it is running.
 * The run stops without touching task state; the current holder owns it now.
 */
public class LeaseLostException extends TaskEngineException {

    public static final String ERROR_CODE = "LEASE_LOST";

    public LeaseLostException(UUID taskId, String workerId) {
        super(ERROR_CODE, String.format(
            "Worker %s lost the lease on task %s",
            workerId, taskId
        ));
    }
}
