package com.taskengine.core.repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Blob storage for serialized plan snapshots.
 */
public interface PlanSnapshotStore {

    /**
     * Store a snapshot, replacing any previous one for the same plan.
     *
     * @param taskId The task ID
     * @param planId The plan ID
     * @param json Serialized plan
     * @return Reference to the stored snapshot
     */
    String write(UUID taskId, String planId, String json);

    /**
     * Read the latest snapshot of a plan.
     *
     * @param taskId The task ID
     * @param planId The plan ID
     * @return The serialized plan if present
     */
    Optional<String> read(UUID taskId, String planId);
}
