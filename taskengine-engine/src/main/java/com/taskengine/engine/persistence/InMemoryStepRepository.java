package com.taskengine.engine.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.codec.PlanCodec;
import com.taskengine.core.model.Plan;
import com.taskengine.core.model.Step;
import com.taskengine.core.repository.StepRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of StepRepository.
 * Rows are stored as detached JSON copies so later step mutations do not leak in.
 */
public class InMemoryStepRepository implements StepRepository {

    private final Map<String, Map<String, ObjectNode>> rowsByPlan = new ConcurrentHashMap<>();
    private final PlanCodec codec;

    public InMemoryStepRepository(PlanCodec codec) {
        this.codec = codec;
    }

    @Override
    public void saveAll(Plan plan) {
        Map<String, ObjectNode> rows = rowsByPlan.computeIfAbsent(
            key(plan.getTaskId(), plan.getPlanId()), k -> Collections.synchronizedMap(new LinkedHashMap<>()));
        for (Step step : plan.getSteps()) {
            ObjectNode row = codec.stepToNode(step);
            row.put("step_index", plan.indexOf(step));
            rows.put(step.getStepId(), row);
        }
    }

    @Override
    public List<Step> findByPlan(UUID taskId, String planId) {
        Map<String, ObjectNode> rows = rowsByPlan.get(key(taskId, planId));
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return rows.values().stream()
                .sorted(Comparator.comparingInt(r -> r.get("step_index").asInt()))
                .map(codec::stepFromNode)
                .collect(Collectors.toList());
        }
    }

    /**
     * Drop the rows of one plan (for testing fallback paths).
     */
    public void deletePlan(UUID taskId, String planId) {
        rowsByPlan.remove(key(taskId, planId));
    }

    private static String key(UUID taskId, String planId) {
        return taskId + ":" + planId;
    }
}
