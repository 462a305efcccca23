package com.taskengine.core.exception;

import com.taskengine.core.model.StepAction;

/**
 * Thrown when no handler is registered for a step's action kind.
 */
public class UnknownActionException extends TaskEngineException {

    public static final String ERROR_CODE = "UNKNOWN_ACTION";

    public UnknownActionException(StepAction action) {
        super(ERROR_CODE, "No handler registered for action: " + action.wireName());
    }
}
