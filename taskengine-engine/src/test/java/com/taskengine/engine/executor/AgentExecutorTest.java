package com.taskengine.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.actions.ActionException;
import com.taskengine.core.exception.InvalidStateTransitionException;
import com.taskengine.core.model.*;
import com.taskengine.engine.kernel.TaskLimits;
import com.taskengine.engine.step.ActionHandlerRegistry;
import com.taskengine.engine.step.StepExecutor;
import com.taskengine.engine.test.TestEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AgentExecutorTest {

    private TestEngine engine = new TestEngine();

    @AfterEach
    void tearDown() {
        engine.executor.stopWorker();
        engine.close();
    }

    private ObjectNode params(String purpose) {
        return engine.objectMapper.createObjectNode().put("purpose", purpose);
    }

    private List<String> recordPurposes() {
        List<String> calls = new CopyOnWriteArrayList<>();
        engine.handlers.register(StepAction.LLM_CALL, context -> {
            calls.add(context.param("purpose"));
            return engine.echo(context.param("purpose"), context.getInputText());
        });
        return calls;
    }

    private List<TaskEventType> eventTypes(UUID taskId) {
        List<TaskEventType> types = new ArrayList<>();
        engine.taskManager.getTaskEvents(taskId, 100).forEach(e -> types.add(e.eventType()));
        Collections.reverse(types);
        return types;
    }

    @Nested
    @DisplayName("agent loop")
    class AgentLoop {

        @Test
        @DisplayName("Runs a diamond-shaped plan in dependency order and builds the result")
        void diamondPlan() {
            engine.planManager.register("diamond", (text, data) -> {
                Step a = new Step("a0000001", StepAction.LLM_CALL, params("a"), List.of());
                Step b = new Step("b0000002", StepAction.LLM_CALL, params("b"), List.of("a0000001"));
                Step c = new Step("c0000003", StepAction.LLM_CALL, params("c"), List.of("a0000001"));
                Step d = new Step("d0000004", StepAction.LLM_CALL, params("d"), List.of("b0000002", "c0000003"));
                return List.of(d, c, b, a);
            });
            List<String> calls = recordPurposes();
            Task task = engine.taskManager.enqueue("alice", "diamond", "go");

            Task done = engine.executor.processOne("worker-1").orElseThrow();

            assertThat(done.state()).isEqualTo(TaskState.SUCCEEDED);
            assertThat(calls).containsExactly("a", "c", "b", "d");
            JsonNode result = done.result();
            assertThat(result.get("success").asBoolean()).isTrue();
            assertThat(result.get("steps_executed").asInt()).isEqualTo(4);
            assertThat(result.get("step_results").size()).isEqualTo(4);
            assertThat(result.get("primary_output").get("response").asText()).isEqualTo("a:go");
            assertThat(done.currentPlanId()).isNotNull();
            assertThat(eventTypes(task.id())).startsWith(
                TaskEventType.ENQUEUED, TaskEventType.CLAIMED, TaskEventType.STEP_STARTED, TaskEventType.STEP_COMPLETED);
            assertThat(eventTypes(task.id())).endsWith(TaskEventType.STEP_COMPLETED, TaskEventType.SUCCEEDED);
        }

        @Test
        @DisplayName("Primary output is the result of the last step in plan order")
        void primaryOutputIsLastStep() {
            Task task = engine.taskManager.enqueue("alice", "general", "plan a trip");

            Task done = engine.executor.processOne("worker-1").orElseThrow();

            assertThat(done.state()).isEqualTo(TaskState.SUCCEEDED);
            assertThat(done.result().get("primary_output").get("response").asText()).isEqualTo("execute:plan a trip");
            assertThat(engine.taskManager.getTask(task.id()).completedAt()).isNotNull();
        }

        @Test
        @DisplayName("Step limit fails the task without retry")
        void stepLimitIsFatal() {
            engine.close();
            engine = new TestEngine(TaskLimits.defaults(), ExecutionLimits.defaults().withMaxSteps(1));
            Task task = engine.taskManager.enqueue("alice", "general", "x");

            Task done = engine.executor.processOne("worker-1").orElseThrow();

            assertThat(done.state()).isEqualTo(TaskState.FAILED);
            assertThat(done.attempts()).isEqualTo(1);
            assertThat(done.error()).isEqualTo("Step limit exceeded: 1/1");
            assertThat(engine.executor.processOne("worker-1")).isEmpty();
            assertThat(engine.taskManager.getTask(task.id()).state()).isEqualTo(TaskState.FAILED);
        }

        @Test
        @DisplayName("Wall-time limit fails the task without retry")
        void wallTimeLimitIsFatal() {
            engine.close();
            engine = new TestEngine(TaskLimits.defaults(), ExecutionLimits.defaults().withMaxWallTime(Duration.ofSeconds(60)));
            engine.handlers.register(StepAction.LLM_CALL, context -> {
                engine.clock.advanceSeconds(61);
                return context.newObject();
            });
            engine.taskManager.enqueue("alice", "general", "x");

            Task done = engine.executor.processOne("worker-1").orElseThrow();

            assertThat(done.state()).isEqualTo(TaskState.FAILED);
            assertThat(done.error()).startsWith("Time limit exceeded");
        }

        @Test
        @DisplayName("A failed step is retried on the next attempt without redoing completed steps")
        void retryResumesAtFailedStep() {
            AtomicInteger analyzeCalls = new AtomicInteger();
            AtomicInteger executeCalls = new AtomicInteger();
            engine.handlers.register(StepAction.LLM_CALL, context -> {
                if ("analyze".equals(context.param("purpose"))) {
                    analyzeCalls.incrementAndGet();
                    return engine.echo("analyze", context.getInputText());
                }
                if (executeCalls.incrementAndGet() == 1) {
                    throw new ActionException("RATE_LIMITED", "try later");
                }
                return engine.echo("execute", context.getInputText());
            });
            Task task = engine.taskManager.enqueue("alice", "general", "x");

            Task afterFirst = engine.executor.processOne("worker-1").orElseThrow();
            assertThat(afterFirst.state()).isEqualTo(TaskState.QUEUED);
            assertThat(afterFirst.error()).contains("RATE_LIMITED");
            assertThat(eventTypes(task.id())).contains(TaskEventType.STEP_FAILED, TaskEventType.RETRY_SCHEDULED);

            Task afterSecond = engine.executor.processOne("worker-1").orElseThrow();
            assertThat(afterSecond.state()).isEqualTo(TaskState.SUCCEEDED);
            assertThat(afterSecond.attempts()).isEqualTo(2);
            assertThat(analyzeCalls).hasValue(1);
            assertThat(executeCalls).hasValue(2);
        }

        @Test
        @DisplayName("An Error from a handler consumes an attempt like any other step failure")
        void handlerErrorIsRetried() {
            AtomicInteger executeCalls = new AtomicInteger();
            engine.handlers.register(StepAction.LLM_CALL, context -> {
                if ("execute".equals(context.param("purpose")) && executeCalls.incrementAndGet() == 1) {
                    throw new AssertionError("boom-error");
                }
                return engine.echo(context.param("purpose"), context.getInputText());
            });
            Task task = engine.taskManager.enqueue("alice", "general", "x");

            Task afterFirst = engine.executor.processOne("worker-1").orElseThrow();

            assertThat(afterFirst.state()).isEqualTo(TaskState.QUEUED);
            assertThat(afterFirst.lockedBy()).isNull();
            assertThat(afterFirst.error()).contains("boom-error");
            Plan saved = engine.planStore.restore(afterFirst);
            assertThat(saved.getSteps()).extracting(Step::getStatus)
                .containsExactly(StepStatus.COMPLETED, StepStatus.FAILED);

            Task afterSecond = engine.executor.processOne("worker-1").orElseThrow();
            assertThat(afterSecond.state()).isEqualTo(TaskState.SUCCEEDED);
            assertThat(eventTypes(task.id())).contains(TaskEventType.STEP_FAILED, TaskEventType.RETRY_SCHEDULED);
        }

        @Test
        @DisplayName("A handler timeout that does not fit inside the lease is rejected")
        void handlerTimeoutMustFitLease() {
            ExecutionLimits tooLong = new ExecutionLimits(20, Duration.ofMinutes(10),
                TaskLimits.defaults().leaseTimeout(), Duration.ofSeconds(1), 1);

            assertThatThrownBy(() -> new AgentExecutor(engine.taskManager, engine.planManager, engine.stepExecutor,
                engine.planStore, engine.objectMapper, engine.metrics, tooLong, engine.clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lease");
        }

        @Test
        @DisplayName("Non-retryable action errors fail the task immediately")
        void permanentActionError() {
            engine.handlers.register(StepAction.LLM_CALL, context -> {
                throw ActionException.permanent("BAD_INPUT", "cannot parse request");
            });
            engine.taskManager.enqueue("alice", "general", "x");

            Task done = engine.executor.processOne("worker-1").orElseThrow();

            assertThat(done.state()).isEqualTo(TaskState.FAILED);
            assertThat(done.attempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("Unregistered actions fail the task immediately")
        void unknownActionIsFatal() {
            StepExecutor bareSteps = new StepExecutor(new ActionHandlerRegistry(), engine.taskManager,
                engine.objectMapper, engine.metrics, Duration.ofSeconds(5), engine.clock);
            AgentExecutor bare = new AgentExecutor(engine.taskManager, engine.planManager, bareSteps,
                engine.planStore, engine.objectMapper, engine.metrics, ExecutionLimits.defaults(), engine.clock);
            engine.taskManager.enqueue("alice", "general", "x");

            try {
                Task done = bare.processOne("worker-1").orElseThrow();

                assertThat(done.state()).isEqualTo(TaskState.FAILED);
                assertThat(done.attempts()).isEqualTo(1);
                assertThat(done.error()).contains("llm_call");
            } finally {
                bareSteps.close();
            }
        }

        @Test
        @DisplayName("A run that loses its lease leaves the task to the new holder")
        void leaseLostLeavesTaskAlone() {
            engine.close();
            engine = new TestEngine(TaskLimits.defaults(), ExecutionLimits.defaults().withMaxWallTime(Duration.ofHours(1)));
            engine.handlers.register(StepAction.LLM_CALL, context -> {
                engine.clock.advanceSeconds(301);
                engine.taskManager.claim("worker-2");
                return context.newObject();
            });
            Task task = engine.taskManager.enqueue("alice", "general", "x");

            Task after = engine.executor.processOne("worker-1").orElseThrow();

            assertThat(after.state()).isEqualTo(TaskState.RUNNING);
            assertThat(after.lockedBy()).isEqualTo("worker-2");
            assertThat(after.attempts()).isEqualTo(2);
            assertThat(eventTypes(task.id())).doesNotContain(TaskEventType.RETRY_SCHEDULED, TaskEventType.FAILED);
        }
    }

    @Nested
    @DisplayName("plan restore")
    class PlanRestore {

        private Task crashMidStep() {
            Task task = engine.taskManager.enqueue("alice", "general", "x");
            Task claimed = engine.taskManager.claim("worker-1").orElseThrow();
            Plan plan = engine.planManager.build(task.id(), task.taskType(), task.inputText(), task.inputData());
            Step analyze = plan.getSteps().get(0);
            Step execute = plan.getSteps().get(1);
            analyze.markCompleted(engine.echo("analyze", "x"), engine.clock.instant());
            execute.markRunning(engine.clock.instant());
            engine.planStore.save(plan);
            engine.taskManager.updatePointers(task.id(), plan.getPlanId(), execute.getStepId());
            engine.clock.advanceSeconds(301);
            return claimed;
        }

        @Test
        @DisplayName("A crashed run is resumed by another worker from the saved plan")
        void resumeAfterCrash() {
            List<String> calls = recordPurposes();
            Task crashed = crashMidStep();

            Task done = engine.executor.processOne("worker-2").orElseThrow();

            assertThat(done.id()).isEqualTo(crashed.id());
            assertThat(done.state()).isEqualTo(TaskState.SUCCEEDED);
            assertThat(done.attempts()).isEqualTo(2);
            assertThat(calls).containsExactly("execute");
            assertThat(done.result().get("step_results").size()).isEqualTo(2);
        }

        @Test
        @DisplayName("An unreadable snapshot falls back to the step rows")
        void fallbackToRows() {
            List<String> calls = recordPurposes();
            Task crashed = crashMidStep();
            String planId = engine.taskManager.getTask(crashed.id()).currentPlanId();
            engine.snapshotStore.corrupt(crashed.id(), planId, "{not json");

            Task done = engine.executor.processOne("worker-2").orElseThrow();

            assertThat(done.state()).isEqualTo(TaskState.SUCCEEDED);
            assertThat(calls).containsExactly("execute");
        }

        @Test
        @DisplayName("A missing plan fails the attempt")
        void missingPlanFailsAttempt() {
            Task crashed = crashMidStep();
            String planId = engine.taskManager.getTask(crashed.id()).currentPlanId();
            engine.snapshotStore.delete(crashed.id(), planId);
            engine.stepRepository.deletePlan(crashed.id(), planId);

            Task after = engine.executor.processOne("worker-2").orElseThrow();

            assertThat(after.state()).isEqualTo(TaskState.QUEUED);
            assertThat(after.error()).contains(planId);
        }
    }

    @Nested
    @DisplayName("approval")
    class Approval {

        @Test
        @DisplayName("Approval pauses the task; approving resumes after the approval step")
        void approveAndFinish() {
            List<String> calls = recordPurposes();
            Task task = engine.taskManager.enqueue("alice", "review", "release notes");

            Task paused = engine.executor.processOne("worker-1").orElseThrow();
            assertThat(paused.state()).isEqualTo(TaskState.PAUSED);
            assertThat(paused.pauseReason()).isEqualTo(PauseReason.APPROVAL);
            assertThat(eventTypes(task.id())).contains(TaskEventType.APPROVAL_REQUIRED);
            assertThat(engine.executor.processOne("worker-1")).isEmpty();

            Task resumed = engine.executor.approve(task.id(), engine.objectMapper.getNodeFactory().textNode("v2"));
            assertThat(resumed.state()).isEqualTo(TaskState.QUEUED);

            Task done = engine.executor.processOne("worker-1").orElseThrow();
            assertThat(done.state()).isEqualTo(TaskState.SUCCEEDED);
            assertThat(calls).containsExactly("draft", "finalize");
            assertThat(eventTypes(task.id())).contains(TaskEventType.APPROVAL_GRANTED);

            Plan plan = engine.planStore.restore(done);
            Step approval = plan.getSteps().get(1);
            assertThat(approval.getStatus()).isEqualTo(StepStatus.COMPLETED);
            assertThat(approval.getResult().get("edited_content").asText()).isEqualTo("v2");
        }

        @Test
        @DisplayName("Rejecting cancels the task")
        void reject() {
            Task task = engine.taskManager.enqueue("alice", "review", "release notes");
            engine.executor.processOne("worker-1");

            Task rejected = engine.executor.reject(task.id());

            assertThat(rejected.state()).isEqualTo(TaskState.CANCELLED);
            assertThat(rejected.error()).isEqualTo("user_rejected");
        }

        @Test
        @DisplayName("Approving a task that is not paused is rejected")
        void approveRequiresPause() {
            Task task = engine.taskManager.enqueue("alice", "review", "release notes");

            assertThatThrownBy(() -> engine.executor.approve(task.id(), null))
                .isInstanceOf(InvalidStateTransitionException.class);
        }
    }

    @Nested
    @DisplayName("worker loop")
    class WorkerLoop {

        @Test
        @DisplayName("Worker threads drain the queue and stop cleanly")
        void drainsQueue() throws InterruptedException {
            engine.close();
            engine = new TestEngine(TaskLimits.defaults(),
                ExecutionLimits.defaults().withPollInterval(Duration.ofMillis(10)));
            List<UUID> ids = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                ids.add(engine.taskManager.enqueue("owner-" + i, "research", "topic " + i).id());
            }

            engine.executor.startWorker();
            assertThat(engine.executor.isRunning()).isTrue();

            Instant deadline = Instant.now().plusSeconds(10);
            while (Instant.now().isBefore(deadline) && !allSucceeded(ids)) {
                Thread.sleep(20);
            }
            engine.executor.stopWorker();

            assertThat(allSucceeded(ids)).isTrue();
            assertThat(engine.executor.isRunning()).isFalse();
        }

        @Test
        @DisplayName("A worker keeps claiming after a handler throws an Error")
        void survivesHandlerError() throws InterruptedException {
            engine.close();
            engine = new TestEngine(TaskLimits.defaults(),
                ExecutionLimits.defaults().withPollInterval(Duration.ofMillis(10)));
            engine.handlers.register(StepAction.LLM_CALL, context -> {
                if ("bad".equals(context.getInputText())) {
                    throw new AssertionError("boom-error");
                }
                return engine.echo(context.param("purpose"), context.getInputText());
            });
            UUID bad = engine.taskManager.enqueue("alice", "general", "bad").id();
            UUID good = engine.taskManager.enqueue("bob", "general", "good").id();

            engine.executor.startWorker();
            Instant deadline = Instant.now().plusSeconds(10);
            while (Instant.now().isBefore(deadline)
                    && !(stateOf(good) == TaskState.SUCCEEDED && stateOf(bad) == TaskState.FAILED)) {
                Thread.sleep(20);
            }

            assertThat(engine.executor.isRunning()).isTrue();
            assertThat(stateOf(good)).isEqualTo(TaskState.SUCCEEDED);
            assertThat(stateOf(bad)).isEqualTo(TaskState.FAILED);
            assertThat(engine.taskManager.getTask(bad).error()).contains("boom-error");
        }

        private TaskState stateOf(UUID id) {
            return engine.taskManager.getTask(id).state();
        }

        private boolean allSucceeded(List<UUID> ids) {
            return ids.stream().allMatch(id -> engine.taskManager.getTask(id).state() == TaskState.SUCCEEDED);
        }
    }
}
