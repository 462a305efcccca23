package com.taskengine.core.exception;

import java.time.Duration;

/**
 * Thrown when an action handler exceeds the per-call hard timeout.
 */
public class StepTimeoutException extends TaskEngineException {

    public static final String ERROR_CODE = "STEP_TIMEOUT";

    public StepTimeoutException(String stepId, Duration timeout) {
        super(ERROR_CODE, String.format(
            "Step %s timed out after %d ms",
            stepId, timeout.toMillis()
        ));
    }
}
