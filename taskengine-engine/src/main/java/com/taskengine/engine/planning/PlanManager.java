package com.taskengine.engine.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskengine.core.exception.PlanValidationException;
import com.taskengine.core.model.Plan;
import com.taskengine.core.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a task kind to a plan. Unknown kinds fall back to the {@code general} strategy.
 */
public class PlanManager {

    private static final Logger log = LoggerFactory.getLogger(PlanManager.class);

    public static final String DEFAULT_KIND = "general";

    private final Map<String, PlanStrategy> strategies = new ConcurrentHashMap<>();

    /**
     * Create a manager with the built-in strategies registered.
     */
    public PlanManager() {
        register(DEFAULT_KIND, new GeneralPlanStrategy());
        register("research", new ResearchPlanStrategy());
        register("summary", new SummaryPlanStrategy());
        register("review", new ReviewPlanStrategy());
    }

    /**
     * Register or replace the strategy for a task kind.
     */
    public void register(String taskType, PlanStrategy strategy) {
        strategies.put(taskType, strategy);
        log.debug("Registered plan strategy for task type: {}", taskType);
    }

    /**
     * Build a validated plan for a task.
     *
     * @throws PlanValidationException if the strategy produced steps that are not a valid DAG
     */
    public Plan build(UUID taskId, String taskType, String inputText, JsonNode inputData) {
        PlanStrategy strategy = strategies.get(taskType);
        if (strategy == null) {
            log.debug("No plan strategy for task type {}, using {}", taskType, DEFAULT_KIND);
            strategy = strategies.get(DEFAULT_KIND);
        }

        JsonNode data = inputData != null && !inputData.isNull() ? inputData : JsonNodeFactory.instance.objectNode();
        List<Step> steps = strategy.steps(inputText, data);
        Plan plan = Plan.create(taskId, steps);

        log.info("Built plan {} for task {} type={} with {} steps",
            plan.getPlanId(), taskId, taskType, steps.size());
        return plan;
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(strategies.keySet());
    }
}
