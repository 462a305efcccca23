package com.taskengine.app.health;

import com.taskengine.app.config.TaskEngineProperties;
import com.taskengine.core.model.TaskState;
import com.taskengine.core.repository.TaskRepository;
import com.taskengine.engine.executor.AgentExecutor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports store reachability, task counts by state and worker status.
 * DOWN when the store cannot be queried or an enabled worker pool is not running.
 */
@Component
public class TaskEngineHealthIndicator implements HealthIndicator {

    private final TaskRepository taskRepository;
    private final AgentExecutor executor;
    private final TaskEngineProperties properties;

    public TaskEngineHealthIndicator(
            TaskRepository taskRepository,
            AgentExecutor executor,
            TaskEngineProperties properties) {
        this.taskRepository = taskRepository;
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("store", properties.getStore().name().toLowerCase());

        try {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (TaskState state : TaskState.values()) {
                counts.put(state.wireName(), taskRepository.countByState(state));
            }
            details.put("tasks", counts);
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }

        details.put("workerEnabled", properties.isWorkerEnabled());
        details.put("workerRunning", executor.isRunning());
        if (properties.isWorkerEnabled() && !executor.isRunning()) {
            return Health.down()
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetails(details)
            .build();
    }
}
