package com.taskengine.engine.persistence;

import com.taskengine.core.codec.PlanCodec;
import com.taskengine.core.exception.NotFoundException;
import com.taskengine.core.exception.PlanValidationException;
import com.taskengine.core.model.Plan;
import com.taskengine.core.model.Step;
import com.taskengine.core.model.StepStatus;
import com.taskengine.core.model.Task;
import com.taskengine.core.repository.PlanSnapshotStore;
import com.taskengine.core.repository.StepRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Persists plans in two forms: a JSON snapshot blob and one row per step.
 * Restore prefers the blob and falls back to the rows when the blob is missing or unreadable.
 */
public class PlanStore {

    private static final Logger log = LoggerFactory.getLogger(PlanStore.class);

    private final PlanSnapshotStore snapshotStore;
    private final StepRepository stepRepository;
    private final PlanCodec codec;

    public PlanStore(PlanSnapshotStore snapshotStore, StepRepository stepRepository, PlanCodec codec) {
        this.snapshotStore = snapshotStore;
        this.stepRepository = stepRepository;
        this.codec = codec;
    }

    public void save(Plan plan) {
        String ref = snapshotStore.write(plan.getTaskId(), plan.getPlanId(), codec.toJson(plan));
        for (Step step : plan.getSteps()) {
            step.setSnapshotRef(ref);
        }
        stepRepository.saveAll(plan);
        log.debug("Saved plan {} ({} steps) for task {}", plan.getPlanId(), plan.getSteps().size(), plan.getTaskId());
    }

    /**
     * Load the task's current plan. Steps left RUNNING by an interrupted run are reset to PENDING.
     *
     * @throws NotFoundException if the task has no plan pointer or nothing was persisted
     * @throws PlanValidationException if the persisted rows do not form a valid plan
     */
    public Plan restore(Task task) {
        String planId = task.currentPlanId();
        if (planId == null) {
            throw new NotFoundException("Plan", "task " + task.id());
        }

        Plan plan = readSnapshot(task, planId).orElseGet(() -> readRows(task, planId));
        for (Step step : plan.getSteps()) {
            if (step.getStatus() == StepStatus.RUNNING) {
                log.info("Resetting interrupted step {} of task {}", step.getStepId(), task.id());
                step.resetToPending();
            }
        }
        return plan;
    }

    private Optional<Plan> readSnapshot(Task task, String planId) {
        try {
            return snapshotStore.read(task.id(), planId).map(codec::fromJson);
        } catch (PlanValidationException | UncheckedIOException e) {
            log.warn("Plan snapshot {} of task {} is unreadable, restoring from step rows: {}",
                planId, task.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private Plan readRows(Task task, String planId) {
        List<Step> steps = stepRepository.findByPlan(task.id(), planId);
        if (steps.isEmpty()) {
            throw new NotFoundException("Plan", planId);
        }
        int currentIndex = 0;
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).getStepId().equals(task.currentStepId())) {
                currentIndex = i;
                break;
            }
        }
        Plan plan = new Plan(planId, task.id(), steps, currentIndex);
        plan.validate();
        log.info("Restored plan {} of task {} from {} step rows", planId, task.id(), steps.size());
        return plan;
    }
}
