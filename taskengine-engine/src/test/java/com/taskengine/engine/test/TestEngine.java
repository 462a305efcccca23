package com.taskengine.engine.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.codec.PlanCodec;
import com.taskengine.core.condition.ConditionEvaluator;
import com.taskengine.core.model.StepAction;
import com.taskengine.engine.executor.AgentExecutor;
import com.taskengine.engine.executor.ExecutionLimits;
import com.taskengine.engine.kernel.TaskLimits;
import com.taskengine.engine.kernel.TaskManager;
import com.taskengine.engine.metrics.TaskMetrics;
import com.taskengine.engine.persistence.*;
import com.taskengine.engine.planning.PlanManager;
import com.taskengine.engine.step.ActionHandlerRegistry;
import com.taskengine.engine.step.StepExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;

/**
 * Fully wired in-memory engine for tests.
 * Model and tool calls are answered by an echo handler until a test registers its own.
 */
public class TestEngine implements AutoCloseable {

    public static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    public final MutableClock clock = MutableClock.startingAt(T0);
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    public final InMemoryTaskRepository taskRepository = new InMemoryTaskRepository();
    public final InMemoryTaskEventRepository eventRepository = new InMemoryTaskEventRepository();
    public final PlanCodec codec = new PlanCodec(objectMapper);
    public final InMemoryStepRepository stepRepository = new InMemoryStepRepository(codec);
    public final InMemoryPlanSnapshotStore snapshotStore = new InMemoryPlanSnapshotStore();

    public final TaskMetrics metrics;
    public final TaskManager taskManager;
    public final PlanManager planManager = new PlanManager();
    public final ActionHandlerRegistry handlers = ActionHandlerRegistry.withBuiltins(new ConditionEvaluator());
    public final StepExecutor stepExecutor;
    public final PlanStore planStore;
    public final AgentExecutor executor;

    public TestEngine() {
        this(TaskLimits.defaults(), ExecutionLimits.defaults());
    }

    public TestEngine(TaskLimits taskLimits, ExecutionLimits executionLimits) {
        metrics = new TaskMetrics(taskRepository);
        metrics.bindTo(meterRegistry);
        taskManager = new TaskManager(taskRepository, eventRepository, taskLimits,
            TransactionOperations.withoutTransaction(), objectMapper, metrics, clock);
        stepExecutor = new StepExecutor(handlers, taskManager, objectMapper, metrics,
            executionLimits.handlerTimeout(), clock);
        planStore = new PlanStore(snapshotStore, stepRepository, codec);
        executor = new AgentExecutor(taskManager, planManager, stepExecutor, planStore,
            objectMapper, metrics, executionLimits, clock);

        handlers.register(StepAction.LLM_CALL, context -> echo(context.param("purpose"), context.getInputText()));
        handlers.register(StepAction.TOOL_CALL, context -> echo(context.param("tool"), context.getInputText()));
    }

    public ObjectNode echo(String label, String input) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("response", label + ":" + input);
        return result;
    }

    @Override
    public void close() {
        stepExecutor.close();
    }
}
