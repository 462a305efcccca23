package com.taskengine.core.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.exception.PlanValidationException;
import com.taskengine.core.model.Plan;
import com.taskengine.core.model.Step;
import com.taskengine.core.model.StepAction;
import com.taskengine.core.model.StepStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PlanCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PlanCodec codec = new PlanCodec(mapper);

    @Test
    void roundTrip_shouldPreserveStepsStatusesAndResults() {
        Instant now = Instant.parse("2024-01-15T10:00:00.123456Z");
        ObjectNode searchParams = mapper.createObjectNode().put("tool", "web_search").put("query", "java");
        Step search = Step.create(StepAction.TOOL_CALL, searchParams, List.of());
        Step analyze = Step.create(StepAction.LLM_CALL,
            mapper.createObjectNode().put("search_step_id", search.getStepId()), List.of(search.getStepId()));
        Step approve = Step.create(StepAction.APPROVAL, null, List.of(analyze.getStepId()));
        Plan plan = Plan.create(UUID.randomUUID(), List.of(search, analyze, approve));

        search.markRunning(now);
        search.markCompleted(mapper.createObjectNode().put("hits", 3), now.plusSeconds(1));
        search.setSnapshotRef("snap-1");
        analyze.markRunning(now);
        analyze.markFailed("model unavailable", now.plusSeconds(2));
        plan.markCurrent(analyze);

        Plan restored = codec.fromJson(codec.toJson(plan));

        assertEquals(plan, restored);
        assertEquals(StepStatus.COMPLETED, restored.getStep(search.getStepId()).orElseThrow().getStatus());
        assertEquals(3, restored.getStep(search.getStepId()).orElseThrow().getResult().get("hits").asInt());
        assertEquals("model unavailable", restored.getStep(analyze.getStepId()).orElseThrow().getError());
        assertEquals(1, restored.getCurrentStepIndex());
    }

    @Test
    void toNode_shouldUseSnapshotFieldNames() {
        Step step = Step.create(StepAction.AGGREGATE, null, List.of());
        Plan plan = Plan.create(UUID.randomUUID(), List.of(step));

        ObjectNode node = codec.toNode(plan);

        assertEquals(plan.getPlanId(), node.get("plan_id").asText());
        assertEquals("aggregate", node.get("steps").get(0).get("action").asText());
        assertEquals("pending", node.get("steps").get(0).get("status").asText());
        assertTrue(node.get("steps").get(0).get("depends_on").isArray());
        assertEquals(0, node.get("current_step_index").asInt());
    }

    @Test
    void fromJson_shouldRejectMalformedSnapshots() {
        assertThrows(PlanValidationException.class, () -> codec.fromJson("{not json"));
        assertThrows(PlanValidationException.class, () -> codec.fromJson("{\"steps\": []}"));
        assertThrows(PlanValidationException.class, () -> codec.fromJson(
            "{\"plan_id\":\"p\",\"task_id\":\"" + UUID.randomUUID()
                + "\",\"steps\":[{\"step_id\":\"a\",\"action\":\"teleport\"}]}"));
    }

    @Test
    void fromJson_shouldRejectCyclicSnapshots() {
        String json = "{\"plan_id\":\"p\",\"task_id\":\"" + UUID.randomUUID() + "\",\"steps\":["
            + "{\"step_id\":\"a\",\"action\":\"llm_call\",\"depends_on\":[\"b\"]},"
            + "{\"step_id\":\"b\",\"action\":\"llm_call\",\"depends_on\":[\"a\"]}]}";

        assertThrows(PlanValidationException.class, () -> codec.fromJson(json));
    }
}
