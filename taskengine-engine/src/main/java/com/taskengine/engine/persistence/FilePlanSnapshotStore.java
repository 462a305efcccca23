package com.taskengine.engine.persistence;

import com.taskengine.core.repository.PlanSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores plan snapshots as {@code <root>/<taskId>/plan_<planId>.json}.
 * Writes go to a temporary file first and are moved into place, so a reader never sees a
 * half-written snapshot.
 */
public class FilePlanSnapshotStore implements PlanSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FilePlanSnapshotStore.class);

    private final Path root;

    public FilePlanSnapshotStore(Path root) {
        this.root = root;
    }

    @Override
    public String write(UUID taskId, String planId, String json) {
        Path target = pathFor(taskId, planId);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), "plan_" + planId, ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write plan snapshot " + target, e);
        }
        log.debug("Wrote plan snapshot {}", target);
        return root.relativize(target).toString();
    }

    @Override
    public Optional<String> read(UUID taskId, String planId) {
        Path path = pathFor(taskId, planId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read plan snapshot " + path, e);
        }
    }

    private Path pathFor(UUID taskId, String planId) {
        return root.resolve(taskId.toString()).resolve("plan_" + planId + ".json");
    }
}
