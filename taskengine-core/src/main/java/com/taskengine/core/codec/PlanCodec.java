package com.taskengine.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.exception.PlanValidationException;
import com.taskengine.core.model.Plan;
import com.taskengine.core.model.Step;
import com.taskengine.core.model.StepAction;
import com.taskengine.core.model.StepStatus;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JSON snapshot format for plans.
 *
 * <pre>
 * {
 *   "plan_id": "3f2a9c1b",
 *   "task_id": "...",
 *   "steps": [ {"step_id", "action", "action_data", "depends_on", "status",
 *               "result", "error", "snapshot_ref", "started_at", "completed_at"} ],
 *   "current_step_index": 0
 * }
 * </pre>
 */
public class PlanCodec {

    private final ObjectMapper objectMapper;

    public PlanCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(Plan plan) {
        try {
            return objectMapper.writeValueAsString(toNode(plan));
        } catch (JsonProcessingException e) {
            throw new PlanValidationException("Failed to serialize plan " + plan.getPlanId(), e);
        }
    }

    /**
     * @throws PlanValidationException if the JSON is unreadable or describes an invalid plan
     */
    public Plan fromJson(String json) {
        try {
            return fromNode(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new PlanValidationException("Failed to parse plan snapshot", e);
        }
    }

    public ObjectNode toNode(Plan plan) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("plan_id", plan.getPlanId());
        root.put("task_id", plan.getTaskId().toString());
        ArrayNode steps = root.putArray("steps");
        for (Step step : plan.getSteps()) {
            steps.add(stepToNode(step));
        }
        root.put("current_step_index", plan.getCurrentStepIndex());
        return root;
    }

    public Plan fromNode(JsonNode root) {
        if (root == null || !root.isObject() || !root.hasNonNull("plan_id") || !root.hasNonNull("task_id")) {
            throw new PlanValidationException("Plan snapshot is missing plan_id or task_id", (Throwable) null);
        }
        List<Step> steps = new ArrayList<>();
        for (JsonNode node : root.path("steps")) {
            steps.add(stepFromNode(node));
        }
        Plan plan;
        try {
            plan = new Plan(
                root.get("plan_id").asText(),
                UUID.fromString(root.get("task_id").asText()),
                steps,
                root.path("current_step_index").asInt(0)
            );
        } catch (IllegalArgumentException e) {
            throw new PlanValidationException("Plan snapshot has an invalid task_id", e);
        }
        plan.validate();
        return plan;
    }

    public ObjectNode stepToNode(Step step) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("step_id", step.getStepId());
        node.put("action", step.getAction().wireName());
        node.set("action_data", step.getActionData().deepCopy());
        ArrayNode deps = node.putArray("depends_on");
        step.getDependsOn().forEach(deps::add);
        node.put("status", step.getStatus().wireName());
        node.set("result", step.getResult());
        node.put("error", step.getError());
        node.put("snapshot_ref", step.getSnapshotRef());
        node.put("started_at", toText(step.getStartedAt()));
        node.put("completed_at", toText(step.getCompletedAt()));
        return node;
    }

    public Step stepFromNode(JsonNode node) {
        try {
            List<String> deps = new ArrayList<>();
            node.path("depends_on").forEach(d -> deps.add(d.asText()));
            JsonNode data = node.get("action_data");
            Step step = new Step(
                node.get("step_id").asText(),
                StepAction.fromWireName(node.get("action").asText()),
                data != null && data.isObject() ? ((ObjectNode) data).deepCopy() : null,
                deps
            );
            JsonNode result = node.get("result");
            step.restore(
                StepStatus.fromWireName(node.path("status").asText("pending")),
                result == null || result.isNull() ? null : result,
                textOrNull(node, "error"),
                textOrNull(node, "snapshot_ref"),
                toInstant(textOrNull(node, "started_at")),
                toInstant(textOrNull(node, "completed_at"))
            );
            return step;
        } catch (NullPointerException | IllegalArgumentException | DateTimeParseException e) {
            throw new PlanValidationException("Malformed step in plan snapshot: " + node, e);
        }
    }

    // ========== Helper Methods ==========

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String toText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant toInstant(String text) {
        return text != null ? Instant.parse(text) : null;
    }
}
