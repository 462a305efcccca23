package com.taskengine.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.core.exception.PlanValidationException;

import java.util.*;

/**
 * An ordered DAG of steps built for one task.
 *
 * Invariants:
 * - step ids are unique within the plan
 * - every dependency references a step of the same plan
 * - the dependency graph is acyclic
 */
public class Plan {

    private final String planId;
    private final UUID taskId;
    private final List<Step> steps;
    private int currentStepIndex;

    public Plan(String planId, UUID taskId, List<Step> steps, int currentStepIndex) {
        this.planId = Objects.requireNonNull(planId, "planId");
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.steps = List.copyOf(steps);
        this.currentStepIndex = currentStepIndex;
    }

    /**
     * Create a validated plan with a generated id.
     *
     * @throws PlanValidationException if the steps do not form a DAG
     */
    public static Plan create(UUID taskId, List<Step> steps) {
        Plan plan = new Plan(UUID.randomUUID().toString().replace("-", "").substring(0, 8), taskId, steps, 0);
        plan.validate();
        return plan;
    }

    /**
     * Check step id uniqueness, dependency resolution and acyclicity.
     */
    public void validate() {
        if (steps.isEmpty()) {
            throw new PlanValidationException(planId, "plan has no steps");
        }
        Map<String, Step> byId = new HashMap<>();
        for (Step step : steps) {
            if (byId.put(step.getStepId(), step) != null) {
                throw new PlanValidationException(planId, "duplicate step id " + step.getStepId());
            }
        }
        for (Step step : steps) {
            for (String dep : step.getDependsOn()) {
                if (!byId.containsKey(dep)) {
                    throw new PlanValidationException(planId,
                        "step " + step.getStepId() + " depends on unknown step " + dep);
                }
            }
        }

        // Kahn's algorithm: anything left over sits on a cycle
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Step step : steps) {
            inDegree.put(step.getStepId(), step.getDependsOn().size());
            for (String dep : step.getDependsOn()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(step.getStepId());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            String id = ready.poll();
            visited++;
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (visited != steps.size()) {
            throw new PlanValidationException(planId, "dependency cycle detected");
        }
    }

    /**
     * True when every step is completed or skipped.
     */
    public boolean isComplete() {
        return steps.stream().allMatch(s -> s.getStatus().satisfiesDependency());
    }

    public boolean hasFailed() {
        return steps.stream().anyMatch(s -> s.getStatus() == StepStatus.FAILED);
    }

    public Optional<Step> getStep(String stepId) {
        return steps.stream().filter(s -> s.getStepId().equals(stepId)).findFirst();
    }

    /**
     * First pending step whose dependencies are all completed or skipped.
     */
    public Optional<Step> getNextStep() {
        for (Step step : steps) {
            if (step.getStatus() != StepStatus.PENDING) {
                continue;
            }
            boolean ready = step.getDependsOn().stream()
                .map(this::getStep)
                .allMatch(dep -> dep.isPresent() && dep.get().getStatus().satisfiesDependency());
            if (ready) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    public Optional<Step> getCurrentStep() {
        if (currentStepIndex >= 0 && currentStepIndex < steps.size()) {
            return Optional.of(steps.get(currentStepIndex));
        }
        return Optional.empty();
    }

    public void markCurrent(Step step) {
        this.currentStepIndex = steps.indexOf(step);
    }

    /**
     * Results of completed steps in plan order.
     */
    public Map<String, JsonNode> completedResults() {
        Map<String, JsonNode> results = new LinkedHashMap<>();
        for (Step step : steps) {
            if (step.getStatus() == StepStatus.COMPLETED) {
                results.put(step.getStepId(), step.getResult());
            }
        }
        return results;
    }

    public int indexOf(Step step) {
        return steps.indexOf(step);
    }

    public String getPlanId() {
        return planId;
    }

    public UUID getTaskId() {
        return taskId;
    }

    public List<Step> getSteps() {
        return steps;
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Plan other = (Plan) o;
        return planId.equals(other.planId)
            && taskId.equals(other.taskId)
            && steps.equals(other.steps)
            && currentStepIndex == other.currentStepIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(planId, taskId);
    }

    @Override
    public String toString() {
        return "Plan[" + planId + " task=" + taskId + " steps=" + steps + "]";
    }
}
