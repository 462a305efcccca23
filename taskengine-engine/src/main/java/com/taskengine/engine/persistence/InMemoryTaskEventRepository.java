package com.taskengine.engine.persistence;

import com.taskengine.core.model.TaskEvent;
import com.taskengine.core.repository.TaskEventRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of TaskEventRepository.
 * Events are kept per task in append order.
 */
public class InMemoryTaskEventRepository implements TaskEventRepository {

    private final Map<UUID, List<TaskEvent>> eventsByTask = new ConcurrentHashMap<>();

    @Override
    public void append(TaskEvent event) {
        eventsByTask.computeIfAbsent(event.taskId(), k -> new CopyOnWriteArrayList<>()).add(event);
    }

    @Override
    public List<TaskEvent> findByTask(UUID taskId, int limit) {
        List<TaskEvent> events = new ArrayList<>(eventsByTask.getOrDefault(taskId, List.of()));
        Collections.reverse(events);
        return events.size() > limit ? events.subList(0, limit) : events;
    }

    /**
     * Clear all data (for testing).
     */
    public void clear() {
        eventsByTask.clear();
    }
}
