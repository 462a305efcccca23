package com.taskengine.app.config;

import com.taskengine.engine.executor.ExecutionLimits;
import com.taskengine.engine.kernel.TaskLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings bound from {@code taskengine.*}.
 */
@ConfigurationProperties(prefix = "taskengine")
public class TaskEngineProperties {

    public enum Store { MEMORY, JDBC }

    private Store store = Store.MEMORY;
    private Path snapshotDir;
    private boolean workerEnabled = true;
    private int workerThreads = 1;

    private int maxSteps = 20;
    private Duration maxWallTime = Duration.ofSeconds(300);
    private Duration handlerTimeout = Duration.ofSeconds(120);
    private Duration pollInterval = Duration.ofSeconds(1);

    private int maxAttempts = 3;
    private Duration leaseTimeout = Duration.ofSeconds(300);
    private int maxQueuedPerOwner = 10;
    private int maxActivePerOwner = 3;
    private int maxPerHour = 100;

    public TaskLimits toTaskLimits() {
        return new TaskLimits(maxAttempts, leaseTimeout, maxQueuedPerOwner, maxActivePerOwner, maxPerHour);
    }

    public ExecutionLimits toExecutionLimits() {
        return new ExecutionLimits(maxSteps, maxWallTime, handlerTimeout, pollInterval, workerThreads);
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    /**
     * Directory for plan snapshot files; snapshots stay in memory when unset.
     */
    public Path getSnapshotDir() {
        return snapshotDir;
    }

    public void setSnapshotDir(Path snapshotDir) {
        this.snapshotDir = snapshotDir;
    }

    public boolean isWorkerEnabled() {
        return workerEnabled;
    }

    public void setWorkerEnabled(boolean workerEnabled) {
        this.workerEnabled = workerEnabled;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public Duration getMaxWallTime() {
        return maxWallTime;
    }

    public void setMaxWallTime(Duration maxWallTime) {
        this.maxWallTime = maxWallTime;
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public void setHandlerTimeout(Duration handlerTimeout) {
        this.handlerTimeout = handlerTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getLeaseTimeout() {
        return leaseTimeout;
    }

    public void setLeaseTimeout(Duration leaseTimeout) {
        this.leaseTimeout = leaseTimeout;
    }

    public int getMaxQueuedPerOwner() {
        return maxQueuedPerOwner;
    }

    public void setMaxQueuedPerOwner(int maxQueuedPerOwner) {
        this.maxQueuedPerOwner = maxQueuedPerOwner;
    }

    public int getMaxActivePerOwner() {
        return maxActivePerOwner;
    }

    public void setMaxActivePerOwner(int maxActivePerOwner) {
        this.maxActivePerOwner = maxActivePerOwner;
    }

    public int getMaxPerHour() {
        return maxPerHour;
    }

    public void setMaxPerHour(int maxPerHour) {
        this.maxPerHour = maxPerHour;
    }
}
