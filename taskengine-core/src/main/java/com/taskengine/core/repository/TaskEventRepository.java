package com.taskengine.core.repository;

import com.taskengine.core.model.TaskEvent;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the task audit log.
 * Events are append-only and immutable.
 */
public interface TaskEventRepository {

    /**
     * Append a new event to the log.
     *
     * @param event The event to append
     */
    void append(TaskEvent event);

    /**
     * Get events for a task, newest first.
     *
     * @param taskId The task ID
     * @param limit Maximum results
     * @return Events ordered by creation time descending
     */
    List<TaskEvent> findByTask(UUID taskId, int limit);
}
