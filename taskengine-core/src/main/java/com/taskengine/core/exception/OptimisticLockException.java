package com.taskengine.core.exception;

import java.util.UUID;

/**
 * Thrown when a task row keeps changing underneath a compare-and-set update.
 */
public class OptimisticLockException extends TaskEngineException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(UUID taskId, String operation, int attempts) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on task %s during %s after %d attempts",
            taskId, operation, attempts
        ));
    }
}
