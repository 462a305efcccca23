package com.taskengine.engine.persistence;

import com.taskengine.core.repository.PlanSnapshotStore;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PlanSnapshotStore.
 */
public class InMemoryPlanSnapshotStore implements PlanSnapshotStore {

    private final Map<String, String> snapshots = new ConcurrentHashMap<>();

    @Override
    public String write(UUID taskId, String planId, String json) {
        String ref = "memory:" + taskId + "/" + planId;
        snapshots.put(ref, json);
        return ref;
    }

    @Override
    public Optional<String> read(UUID taskId, String planId) {
        return Optional.ofNullable(snapshots.get("memory:" + taskId + "/" + planId));
    }

    /**
     * Overwrite a stored snapshot with arbitrary content (for testing corrupt blobs).
     */
    public void corrupt(UUID taskId, String planId, String content) {
        snapshots.put("memory:" + taskId + "/" + planId, content);
    }

    public void delete(UUID taskId, String planId) {
        snapshots.remove("memory:" + taskId + "/" + planId);
    }
}
