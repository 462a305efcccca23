package com.taskengine.core.exception;

import com.taskengine.core.model.TaskState;

import java.util.UUID;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends TaskEngineException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    private final TaskState currentState;

    public InvalidStateTransitionException(UUID taskId, TaskState currentState, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot %s task %s in state %s",
            operation, taskId, currentState.wireName()
        ));
        this.currentState = currentState;
    }

    public TaskState getCurrentState() {
        return currentState;
    }
}
