package com.taskengine.app.lifecycle;

import com.taskengine.app.config.TaskEngineProperties;
import com.taskengine.engine.executor.AgentExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the worker pool once the application is ready and drains it on shutdown.
 *
 * On shutdown the pool stops claiming, in-flight runs get a grace period, and
 * whatever is still running afterwards keeps its lease until it expires and another
 * worker reclaims the task.
 */
@Component
public class WorkerLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycle.class);

    private final AgentExecutor executor;
    private final TaskEngineProperties properties;

    public WorkerLifecycle(AgentExecutor executor, TaskEngineProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.isWorkerEnabled()) {
            log.info("Worker disabled, tasks will only be enqueued by this node");
            return;
        }
        executor.startWorker();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        if (!executor.isRunning()) {
            return;
        }
        log.info("Initiating graceful shutdown for workers {}*", executor.getWorkerIdPrefix());
        executor.stopWorker();
        log.info("Graceful shutdown complete");
    }
}
