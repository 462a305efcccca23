package com.taskengine.engine.executor;

import java.time.Duration;

/**
 * Per-run budgets and worker loop settings.
 *
 * @param maxSteps Steps one run may execute before failing
 * @param maxWallTime Wall time one run may take before failing
 * @param handlerTimeout Hard limit for a single handler call
 * @param pollInterval Sleep between claims when the queue is empty
 * @param workerThreads Number of sequential worker loops
 */
public record ExecutionLimits(
    int maxSteps,
    Duration maxWallTime,
    Duration handlerTimeout,
    Duration pollInterval,
    int workerThreads
) {
    public ExecutionLimits {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
    }

    public static ExecutionLimits defaults() {
        return new ExecutionLimits(20, Duration.ofSeconds(300), Duration.ofSeconds(120), Duration.ofSeconds(1), 1);
    }

    public ExecutionLimits withMaxSteps(int steps) {
        return new ExecutionLimits(steps, maxWallTime, handlerTimeout, pollInterval, workerThreads);
    }

    public ExecutionLimits withMaxWallTime(Duration wallTime) {
        return new ExecutionLimits(maxSteps, wallTime, handlerTimeout, pollInterval, workerThreads);
    }

    public ExecutionLimits withPollInterval(Duration interval) {
        return new ExecutionLimits(maxSteps, maxWallTime, handlerTimeout, interval, workerThreads);
    }
}
