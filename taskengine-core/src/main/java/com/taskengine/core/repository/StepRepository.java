package com.taskengine.core.repository;

import com.taskengine.core.model.Plan;
import com.taskengine.core.model.Step;
import java.util.List;
import java.util.UUID;

/**
 * Row-per-step persistence of plans.
 * Used as the fallback restore path when a plan snapshot is missing or unreadable.
 */
public interface StepRepository {

    /**
     * Insert or update one row per step, keyed by (task, plan, step).
     *
     * @param plan The plan whose steps to persist
     */
    void saveAll(Plan plan);

    /**
     * Load steps of a plan in plan order.
     *
     * @param taskId The task ID
     * @param planId The plan ID
     * @return Reconstructed steps, empty if the plan has no rows
     */
    List<Step> findByPlan(UUID taskId, String planId);
}
