package com.taskengine.core.repository;

import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Repository for Task persistence.
 * All state changes are atomic against the store; no other lock is used.
 */
public interface TaskRepository {

    /**
     * Insert a new task.
     *
     * @param task The task to insert
     */
    void save(Task task);

    /**
     * Run {@code action} while holding an exclusive lock on the owner, so a quota check and
     * the insert it guards cannot interleave with another enqueue for the same owner.
     * Stores that lock through a transaction must be called inside one.
     *
     * @param ownerId The owner to lock
     * @param action Work to run under the lock
     * @return The action's result
     */
    <T> T withOwnerLock(String ownerId, Supplier<T> action);

    /**
     * Find a task by ID.
     *
     * @param taskId The task ID
     * @return The task if found
     */
    Optional<Task> findById(UUID taskId);

    /**
     * Atomically claim the oldest eligible task: QUEUED without holder, or RUNNING
     * with an expired lease and attempts remaining. The claimed task is RUNNING,
     * held by the worker, attempts incremented and started-at set on first claim.
     * At most one concurrent caller can receive a given task.
     *
     * @param workerId The claiming worker
     * @param now Current time, used for lease expiry checks
     * @param leaseExpiresAt New lease expiry
     * @return The claimed task, or empty if nothing is eligible
     */
    Optional<Task> claimNext(String workerId, Instant now, Instant leaseExpiresAt);

    /**
     * Extend a lease if the worker still holds it and the task is RUNNING.
     *
     * @param taskId The task ID
     * @param workerId The worker expected to hold the lease
     * @param leaseExpiresAt New lease expiry
     * @param now Current time
     * @return true if the lease was extended
     */
    boolean extendLease(UUID taskId, String workerId, Instant leaseExpiresAt, Instant now);

    /**
     * Replace a task row if its version still matches.
     *
     * @param updated The new task state (version already bumped)
     * @param expectedVersion Version the caller read
     * @return true if the update was applied
     */
    boolean compareAndSet(Task updated, long expectedVersion);

    /**
     * Find tasks of an owner, newest first.
     *
     * @param ownerId The owner
     * @param state Optional state filter, null for all
     * @param limit Maximum results
     * @return Matching tasks
     */
    List<Task> findByOwner(String ownerId, TaskState state, int limit);

    /**
     * Count an owner's tasks in any of the given states.
     */
    int countByOwnerAndStates(String ownerId, Set<TaskState> states);

    /**
     * Count tasks an owner created at or after the given instant.
     */
    int countCreatedSince(String ownerId, Instant since);

    /**
     * Count all tasks in a state.
     */
    int countByState(TaskState state);

    /**
     * Find RUNNING tasks whose lease expired with no attempts left.
     * These are never reclaimed and must be finalized.
     *
     * @param now Current time
     * @param limit Maximum results
     * @return Tasks ordered by lease expiry
     */
    List<Task> findExpiredExhausted(Instant now, int limit);
}
