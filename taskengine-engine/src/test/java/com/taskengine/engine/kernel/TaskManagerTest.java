package com.taskengine.engine.kernel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.exception.InvalidStateTransitionException;
import com.taskengine.core.exception.LeaseLostException;
import com.taskengine.core.exception.NotFoundException;
import com.taskengine.core.exception.TaskLimitException;
import com.taskengine.core.model.*;
import com.taskengine.engine.executor.ExecutionLimits;
import com.taskengine.engine.test.TestEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

class TaskManagerTest {

    private TestEngine engine = new TestEngine();

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private TaskManager manager() {
        return engine.taskManager;
    }

    @Nested
    @DisplayName("enqueue and claim")
    class EnqueueAndClaim {

        @Test
        @DisplayName("Enqueue creates a QUEUED task and an enqueued event")
        void enqueueCreatesQueuedTask() {
            Task task = manager().enqueue("alice", "general", "write a haiku");

            assertThat(task.state()).isEqualTo(TaskState.QUEUED);
            assertThat(task.attempts()).isZero();
            assertThat(task.maxAttempts()).isEqualTo(3);

            List<TaskEvent> events = manager().getTaskEvents(task.id(), 10);
            assertThat(events).hasSize(1);
            assertThat(events.get(0).eventType()).isEqualTo(TaskEventType.ENQUEUED);
            assertThat(events.get(0).eventData().get("task_type").asText()).isEqualTo("general");
            assertThat(events.get(0).eventData().get("input_text").asText()).isEqualTo("write a haiku");
        }

        @Test
        @DisplayName("Claim on an empty queue returns nothing")
        void claimOnEmptyQueue() {
            assertThat(manager().claim("worker-1")).isEmpty();
        }

        @Test
        @DisplayName("Claim picks the oldest task and takes a lease")
        void claimPicksOldest() {
            Task first = manager().enqueue("alice", "general", "first");
            engine.clock.advanceSeconds(1);
            manager().enqueue("bob", "general", "second");

            Task claimed = manager().claim("worker-1").orElseThrow();

            assertThat(claimed.id()).isEqualTo(first.id());
            assertThat(claimed.state()).isEqualTo(TaskState.RUNNING);
            assertThat(claimed.lockedBy()).isEqualTo("worker-1");
            assertThat(claimed.attempts()).isEqualTo(1);
            assertThat(claimed.startedAt()).isEqualTo(engine.clock.instant());
            assertThat(claimed.leaseExpiresAt()).isEqualTo(engine.clock.instant().plus(Duration.ofSeconds(300)));
            assertThat(manager().getTaskEvents(first.id(), 1).get(0).eventType()).isEqualTo(TaskEventType.CLAIMED);
        }

        @Test
        @DisplayName("Unknown task id raises NotFoundException")
        void unknownTask() {
            assertThatThrownBy(() -> manager().getTask(UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("retry and failure")
    class RetryAndFailure {

        @Test
        @DisplayName("Failing with attempts left requeues, then fails terminally")
        void retryThenFail() {
            Task task = manager().enqueue(TaskRequest.of("alice", "general", "x").withMaxAttempts(2));

            manager().claim("worker-1").orElseThrow();
            Task afterFirst = manager().fail(task.id(), "boom");
            assertThat(afterFirst.state()).isEqualTo(TaskState.QUEUED);
            assertThat(afterFirst.attempts()).isEqualTo(1);
            assertThat(afterFirst.error()).isEqualTo("boom");
            assertThat(afterFirst.completedAt()).isNull();
            assertThat(afterFirst.lockedBy()).isNull();

            manager().claim("worker-1").orElseThrow();
            Task afterSecond = manager().fail(task.id(), "boom2");
            assertThat(afterSecond.state()).isEqualTo(TaskState.FAILED);
            assertThat(afterSecond.attempts()).isEqualTo(2);
            assertThat(afterSecond.error()).isEqualTo("boom2");
            assertThat(afterSecond.completedAt()).isNotNull();

            List<TaskEventType> types = manager().getTaskEvents(task.id(), 10).stream()
                .map(TaskEvent::eventType).toList();
            assertThat(types).containsExactly(
                TaskEventType.FAILED, TaskEventType.CLAIMED, TaskEventType.RETRY_SCHEDULED,
                TaskEventType.CLAIMED, TaskEventType.ENQUEUED);
        }

        @Test
        @DisplayName("failPermanently ignores remaining attempts")
        void failPermanently() {
            Task task = manager().enqueue("alice", "general", "x");
            manager().claim("worker-1");

            Task failed = manager().failPermanently(task.id(), "worker-1", "Step limit exceeded: 20/20");

            assertThat(failed.state()).isEqualTo(TaskState.FAILED);
            assertThat(failed.attempts()).isEqualTo(1);
            assertThat(failed.error()).isEqualTo("Step limit exceeded: 20/20");
        }

        @Test
        @DisplayName("Failing a QUEUED task is an invalid transition")
        void failQueued() {
            Task task = manager().enqueue("alice", "general", "x");

            assertThatThrownBy(() -> manager().fail(task.id(), "boom"))
                .isInstanceOf(InvalidStateTransitionException.class);
        }
    }

    @Nested
    @DisplayName("pause and resume")
    class PauseAndResume {

        @Test
        @DisplayName("Pause releases the lease and keeps the plan pointer through resume")
        void pauseResumeKeepsPointer() {
            Task task = manager().enqueue("alice", "review", "x");
            manager().claim("worker-1");
            manager().updatePointers(task.id(), "plan0001", "step0002");

            ObjectNode data = engine.objectMapper.createObjectNode();
            data.put("step_id", "step0002");
            data.put("message", "Review the draft");
            Task paused = manager().pause(task.id(), PauseReason.APPROVAL, data);

            assertThat(paused.state()).isEqualTo(TaskState.PAUSED);
            assertThat(paused.pauseReason()).isEqualTo(PauseReason.APPROVAL);
            assertThat(paused.lockedBy()).isNull();
            assertThat(paused.leaseExpiresAt()).isNull();
            assertThat(paused.currentPlanId()).isEqualTo("plan0001");

            TaskEvent pausedEvent = manager().getTaskEvents(task.id(), 1).get(0);
            assertThat(pausedEvent.eventType()).isEqualTo(TaskEventType.PAUSED);
            assertThat(pausedEvent.stepId()).isEqualTo("step0002");
            assertThat(pausedEvent.eventData().get("reason").asText()).isEqualTo("approval");
            assertThat(pausedEvent.eventData().get("message").asText()).isEqualTo("Review the draft");

            Task resumed = manager().resume(task.id());
            assertThat(resumed.state()).isEqualTo(TaskState.QUEUED);
            assertThat(resumed.pauseReason()).isNull();
            assertThat(resumed.currentPlanId()).isEqualTo("plan0001");
            assertThat(resumed.currentStepId()).isEqualTo("step0002");
        }

        @Test
        @DisplayName("Pause is only allowed from RUNNING")
        void pauseRequiresRunning() {
            Task task = manager().enqueue("alice", "general", "x");

            assertThatThrownBy(() -> manager().pause(task.id(), PauseReason.APPROVAL, null))
                .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Resume is only allowed from PAUSED")
        void resumeRequiresPaused() {
            Task task = manager().enqueue("alice", "general", "x");

            assertThatThrownBy(() -> manager().resume(task.id()))
                .isInstanceOf(InvalidStateTransitionException.class);
        }
    }

    @Nested
    @DisplayName("leases")
    class Leases {

        @Test
        @DisplayName("Heartbeat extends the lease only for the holder")
        void heartbeatOnlyForHolder() {
            Task task = manager().enqueue("alice", "general", "x");
            manager().claim("worker-1");
            engine.clock.advanceSeconds(100);

            assertThat(manager().heartbeat(task.id(), "worker-2")).isFalse();
            assertThat(manager().heartbeat(task.id(), "worker-1")).isTrue();
            assertThat(manager().getTask(task.id()).leaseExpiresAt())
                .isEqualTo(engine.clock.instant().plus(Duration.ofSeconds(300)));
        }

        @Test
        @DisplayName("An expired lease is reclaimed and the old holder is fenced out")
        void expiredLeaseReclaimed() {
            Task task = manager().enqueue("alice", "general", "x");
            manager().claim("worker-1");
            engine.clock.advanceSeconds(301);

            Task reclaimed = manager().claim("worker-2").orElseThrow();

            assertThat(reclaimed.id()).isEqualTo(task.id());
            assertThat(reclaimed.lockedBy()).isEqualTo("worker-2");
            assertThat(reclaimed.attempts()).isEqualTo(2);
            assertThat(manager().heartbeat(task.id(), "worker-1")).isFalse();
            assertThatThrownBy(() -> manager().succeed(task.id(), "worker-1", null))
                .isInstanceOf(LeaseLostException.class);
        }

        @Test
        @DisplayName("Exhausted expired leases are reaped instead of reclaimed")
        void exhaustedLeaseReaped() {
            Task task = manager().enqueue(TaskRequest.of("alice", "general", "x").withMaxAttempts(1));
            manager().claim("worker-1");
            engine.clock.advanceSeconds(301);

            assertThat(manager().claim("worker-2")).isEmpty();
            assertThat(manager().reapExhaustedLeases()).isEqualTo(1);

            Task reaped = manager().getTask(task.id());
            assertThat(reaped.state()).isEqualTo(TaskState.FAILED);
            assertThat(reaped.error()).isEqualTo("Lease expired after 1 attempts");
            assertThat(reaped.lockedBy()).isNull();
            assertThat(manager().getTaskEvents(task.id(), 1).get(0).eventType())
                .isEqualTo(TaskEventType.LEASE_EXPIRED);
            assertThat(manager().reapExhaustedLeases()).isZero();
        }

        @Test
        @DisplayName("Concurrent claims never hand out the same task twice")
        void concurrentClaims() throws Exception {
            int taskCount = 40;
            for (int i = 0; i < taskCount; i++) {
                manager().enqueue(TaskRequest.of("owner-" + (i % 4), "general", "t" + i).withoutLimits());
            }

            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            ConcurrentLinkedQueue<UUID> claimed = new ConcurrentLinkedQueue<>();
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < threads; w++) {
                String workerId = "worker-" + w;
                futures.add(pool.submit(() -> {
                    start.await();
                    Optional<Task> next;
                    while ((next = manager().claim(workerId)).isPresent()) {
                        claimed.add(next.get().id());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertThat(claimed).hasSize(taskCount);
            assertThat(new HashSet<>(claimed)).hasSize(taskCount);
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("Cancel is a no-op on terminal tasks")
        void cancelIdempotent() {
            Task task = manager().enqueue("alice", "general", "x");

            assertThat(manager().cancel(task.id(), "changed my mind")).isTrue();
            assertThat(manager().cancel(task.id(), "again")).isFalse();

            Task cancelled = manager().getTask(task.id());
            assertThat(cancelled.state()).isEqualTo(TaskState.CANCELLED);
            assertThat(cancelled.error()).isEqualTo("changed my mind");
        }

        @Test
        @DisplayName("Cancelling a running task releases its lease")
        void cancelRunning() {
            Task task = manager().enqueue("alice", "general", "x");
            manager().claim("worker-1");

            manager().cancel(task.id(), "stop");

            Task cancelled = manager().getTask(task.id());
            assertThat(cancelled.lockedBy()).isNull();
            assertThat(manager().heartbeat(task.id(), "worker-1")).isFalse();
        }
    }

    @Nested
    @DisplayName("owner limits")
    class OwnerLimits {

        @Test
        @DisplayName("Queued cap rejects further tasks for that owner only")
        void queuedCap() {
            engine.close();
            engine = new TestEngine(TaskLimits.defaults().withOwnerCaps(2, 5, 100), ExecutionLimits.defaults());

            manager().enqueue("alice", "general", "1");
            manager().enqueue("alice", "general", "2");

            assertThatThrownBy(() -> manager().enqueue("alice", "general", "3"))
                .isInstanceOf(TaskLimitException.class)
                .satisfies(e -> assertThat(((TaskLimitException) e).getLimitName()).isEqualTo("queued"));
            assertThat(manager().getOwnerTasks("alice", null, 10)).hasSize(2);
            assertThatCode(() -> manager().enqueue("bob", "general", "1")).doesNotThrowAnyException();
            assertThatCode(() -> manager().enqueue(TaskRequest.of("alice", "general", "3").withoutLimits()))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Concurrent enqueues for one owner never exceed the queued cap")
        void queuedCapUnderConcurrency() throws Exception {
            engine.close();
            engine = new TestEngine(TaskLimits.defaults().withOwnerCaps(1, 100, 100), ExecutionLimits.defaults());

            int threads = 16;
            CyclicBarrier start = new CyclicBarrier(threads);
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String input = "task " + i;
                results.add(pool.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    try {
                        manager().enqueue("alice", "general", input);
                        return true;
                    } catch (TaskLimitException e) {
                        return false;
                    }
                }));
            }
            int accepted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    accepted++;
                }
            }
            pool.shutdown();

            assertThat(accepted).isEqualTo(1);
            assertThat(manager().getOwnerTasks("alice", TaskState.QUEUED, 100)).hasSize(1);
        }

        @Test
        @DisplayName("Hourly cap uses a rolling window")
        void hourlyCap() {
            engine.close();
            engine = new TestEngine(TaskLimits.defaults().withOwnerCaps(10, 10, 2), ExecutionLimits.defaults());

            manager().enqueue("alice", "general", "1");
            manager().enqueue("alice", "general", "2");
            assertThat(manager().getOwnerLimitsStatus("alice").canEnqueue()).isFalse();
            assertThatThrownBy(() -> manager().enqueue("alice", "general", "3"))
                .isInstanceOf(TaskLimitException.class);

            engine.clock.advance(Duration.ofMinutes(61));

            assertThat(manager().getOwnerLimitsStatus("alice").canEnqueue()).isTrue();
            assertThatCode(() -> manager().enqueue("alice", "general", "3")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Queue size counts QUEUED tasks across owners")
        void queueSize() {
            manager().enqueue("alice", "general", "1");
            manager().enqueue("bob", "general", "2");
            manager().claim("worker-1");

            assertThat(manager().getQueueSize()).isEqualTo(1);
        }
    }
}
