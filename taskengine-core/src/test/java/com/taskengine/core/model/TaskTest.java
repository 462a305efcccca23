package com.taskengine.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void create_shouldSetCorrectDefaults() {
        Task task = Task.create("user-1", "general", "hello", null, 3, T0);

        assertNotNull(task.id());
        assertEquals(TaskState.QUEUED, task.state());
        assertEquals(0, task.attempts());
        assertEquals(3, task.maxAttempts());
        assertNull(task.lockedBy());
        assertNull(task.startedAt());
        assertEquals(T0, task.createdAt());
        assertEquals(0L, task.version());
    }

    @Test
    void withClaimed_shouldAcquireLeaseAndCountAttempt() {
        Task task = Task.create("user-1", "general", "hello", null, 3, T0);

        Task claimed = task.withClaimed("worker-1", T0, T0.plusSeconds(300));

        assertEquals(TaskState.RUNNING, claimed.state());
        assertEquals("worker-1", claimed.lockedBy());
        assertEquals(1, claimed.attempts());
        assertEquals(T0, claimed.startedAt());
        assertTrue(claimed.hasValidLease(T0.plusSeconds(10)));
        assertTrue(claimed.isHeldBy("worker-1"));
        assertFalse(claimed.isHeldBy("worker-2"));
        assertEquals(task.version() + 1, claimed.version());
    }

    @Test
    void withClaimed_shouldKeepFirstStartTime() {
        Task first = Task.create("user-1", "general", "hello", null, 3, T0)
            .withClaimed("worker-1", T0, T0.plusSeconds(300))
            .withRetryScheduled("boom", T0.plusSeconds(5));

        Task second = first.withClaimed("worker-2", T0.plusSeconds(60), T0.plusSeconds(360));

        assertEquals(T0, second.startedAt());
        assertEquals(2, second.attempts());
    }

    @Test
    void withClaimed_shouldNeverExceedMaxAttempts() {
        Task task = Task.create("user-1", "general", "hello", null, 1, T0)
            .withClaimed("worker-1", T0, T0.plusSeconds(1));

        Task reclaimed = task.withClaimed("worker-2", T0.plusSeconds(5), T0.plusSeconds(10));

        assertEquals(1, reclaimed.attempts());
    }

    @Test
    void leaseExpiry_shouldBeDetected() {
        Task claimed = Task.create("user-1", "general", "hello", null, 3, T0)
            .withClaimed("worker-1", T0, T0.plus(Duration.ofSeconds(30)));

        assertFalse(claimed.isLeaseExpired(T0.plusSeconds(29)));
        assertTrue(claimed.isLeaseExpired(T0.plusSeconds(30)));
        assertTrue(claimed.isClaimable(T0.plusSeconds(31)));
        assertFalse(claimed.isClaimable(T0.plusSeconds(1)));
    }

    @Test
    void withRetryScheduled_shouldReleaseLeaseAndKeepError() {
        Task retried = Task.create("user-1", "general", "hello", null, 3, T0)
            .withClaimed("worker-1", T0, T0.plusSeconds(300))
            .withRetryScheduled("boom", T0.plusSeconds(1));

        assertEquals(TaskState.QUEUED, retried.state());
        assertEquals("boom", retried.error());
        assertNull(retried.lockedBy());
        assertNull(retried.leaseExpiresAt());
        assertNull(retried.completedAt());
        assertTrue(retried.isClaimable(T0.plusSeconds(2)));
    }

    @Test
    void withPaused_shouldNotBeClaimable() {
        Task paused = Task.create("user-1", "general", "hello", null, 3, T0)
            .withClaimed("worker-1", T0, T0.plusSeconds(300))
            .withPaused(PauseReason.APPROVAL, T0.plusSeconds(1));

        assertEquals(TaskState.PAUSED, paused.state());
        assertEquals(PauseReason.APPROVAL, paused.pauseReason());
        assertNull(paused.lockedBy());
        assertFalse(paused.isClaimable(T0.plusSeconds(1000)));

        Task resumed = paused.withResumed(T0.plusSeconds(2));
        assertEquals(TaskState.QUEUED, resumed.state());
        assertNull(resumed.pauseReason());
    }

    @Test
    void terminalTransitions_shouldSetCompletionTime() {
        Task running = Task.create("user-1", "general", "hello", null, 3, T0)
            .withClaimed("worker-1", T0, T0.plusSeconds(300));

        assertEquals(T0.plusSeconds(1), running.withFailed("x", T0.plusSeconds(1)).completedAt());
        assertEquals(T0.plusSeconds(1), running.withSucceeded(null, T0.plusSeconds(1)).completedAt());
        Task cancelled = running.withCancelled("user_cancelled", T0.plusSeconds(1));
        assertEquals("user_cancelled", cancelled.error());
        assertNull(cancelled.lockedBy());
    }
}
