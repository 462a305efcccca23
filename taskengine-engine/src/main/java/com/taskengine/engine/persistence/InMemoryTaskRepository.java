package com.taskengine.engine.persistence;

import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskState;
import com.taskengine.core.repository.TaskRepository;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRepository.
 * Single-process only; writes are serialized on one lock so claims stay atomic.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<UUID, Task> tasks = new ConcurrentHashMap<>();
    private final Map<UUID, Long> insertionOrder = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object writeLock = new Object();

    private final Comparator<Task> oldestFirst = Comparator
        .comparing(Task::createdAt)
        .thenComparing(t -> insertionOrder.getOrDefault(t.id(), 0L));

    @Override
    public void save(Task task) {
        synchronized (writeLock) {
            if (tasks.putIfAbsent(task.id(), task) != null) {
                throw new IllegalStateException("Task already exists: " + task.id());
            }
            insertionOrder.put(task.id(), sequence.incrementAndGet());
        }
    }

    @Override
    public <T> T withOwnerLock(String ownerId, Supplier<T> action) {
        synchronized (writeLock) {
            return action.get();
        }
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Optional<Task> claimNext(String workerId, Instant now, Instant leaseExpiresAt) {
        synchronized (writeLock) {
            Optional<Task> next = tasks.values().stream()
                .filter(t -> t.isClaimable(now))
                .min(oldestFirst);
            next.ifPresent(t -> tasks.put(t.id(), t.withClaimed(workerId, now, leaseExpiresAt)));
            return next.map(t -> tasks.get(t.id()));
        }
    }

    @Override
    public boolean extendLease(UUID taskId, String workerId, Instant leaseExpiresAt, Instant now) {
        synchronized (writeLock) {
            Task task = tasks.get(taskId);
            if (task == null || !task.isHeldBy(workerId)) {
                return false;
            }
            tasks.put(taskId, task.withLeaseExtended(leaseExpiresAt, now));
            return true;
        }
    }

    @Override
    public boolean compareAndSet(Task updated, long expectedVersion) {
        synchronized (writeLock) {
            Task current = tasks.get(updated.id());
            if (current == null || current.version() != expectedVersion) {
                return false;
            }
            tasks.put(updated.id(), updated);
            return true;
        }
    }

    @Override
    public List<Task> findByOwner(String ownerId, TaskState state, int limit) {
        return tasks.values().stream()
            .filter(t -> t.ownerId().equals(ownerId))
            .filter(t -> state == null || t.state() == state)
            .sorted(oldestFirst.reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public int countByOwnerAndStates(String ownerId, Set<TaskState> states) {
        return (int) tasks.values().stream()
            .filter(t -> t.ownerId().equals(ownerId) && states.contains(t.state()))
            .count();
    }

    @Override
    public int countCreatedSince(String ownerId, Instant since) {
        return (int) tasks.values().stream()
            .filter(t -> t.ownerId().equals(ownerId) && !t.createdAt().isBefore(since))
            .count();
    }

    @Override
    public int countByState(TaskState state) {
        return (int) tasks.values().stream()
            .filter(t -> t.state() == state)
            .count();
    }

    @Override
    public List<Task> findExpiredExhausted(Instant now, int limit) {
        return tasks.values().stream()
            .filter(t -> t.state() == TaskState.RUNNING && t.isLeaseExpired(now) && !t.canRetry())
            .sorted(Comparator.comparing(Task::leaseExpiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    /**
     * Clear all data (for testing).
     */
    public void clear() {
        synchronized (writeLock) {
            tasks.clear();
            insertionOrder.clear();
        }
    }
}
