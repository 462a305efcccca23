package com.taskengine.engine.executor;

/**
 * How a run of the agent loop ended when it did not throw.
 */
public enum RunOutcome {
    /** Every step completed or was skipped; the task is SUCCEEDED. */
    SUCCEEDED,
    /** A step asked for approval; the task is PAUSED. */
    SUSPENDED
}
