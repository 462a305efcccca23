package com.taskengine.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.core.model.PauseReason;
import com.taskengine.core.model.Task;
import com.taskengine.core.model.TaskState;
import com.taskengine.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * PostgreSQL-backed implementation of TaskRepository.
 * Claims use {@code FOR UPDATE SKIP LOCKED} so concurrent workers never pick the same row;
 * every other write is guarded by the version column.
 */
@Repository("jdbcTaskRepository")
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRowMapper rowMapper;

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TaskRowMapper();
    }

    @Override
    @Transactional
    public void save(Task task) {
        String sql = """
            INSERT INTO tasks (
                id, owner_id, task_type, input_text, input_data,
                status, pause_reason, attempts, max_attempts,
                locked_by, locked_at, lease_expires_at,
                current_plan_id, current_step_id, result, error,
                created_at, updated_at, started_at, completed_at, version
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            task.id(),
            task.ownerId(),
            task.taskType(),
            task.inputText(),
            toJson(task.inputData()),
            task.state().wireName(),
            task.pauseReason() != null ? task.pauseReason().wireName() : null,
            task.attempts(),
            task.maxAttempts(),
            task.lockedBy(),
            toTimestamp(task.lockedAt()),
            toTimestamp(task.leaseExpiresAt()),
            task.currentPlanId(),
            task.currentStepId(),
            toJson(task.result()),
            task.error(),
            toTimestamp(task.createdAt()),
            toTimestamp(task.updatedAt()),
            toTimestamp(task.startedAt()),
            toTimestamp(task.completedAt()),
            task.version()
        );
    }

    /**
     * Takes a transaction-scoped advisory lock keyed by the owner; it is released on commit or rollback.
     */
    @Override
    @Transactional
    public <T> T withOwnerLock(String ownerId, Supplier<T> action) {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtext(?))", rs -> { }, ownerId);
        return action.get();
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";
        List<Task> results = jdbcTemplate.query(sql, rowMapper, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    @Transactional
    public Optional<Task> claimNext(String workerId, Instant now, Instant leaseExpiresAt) {
        String sql = """
            UPDATE tasks SET
                status = 'running',
                locked_by = ?,
                locked_at = ?,
                lease_expires_at = ?,
                attempts = LEAST(attempts + 1, max_attempts),
                started_at = COALESCE(started_at, ?),
                updated_at = ?,
                version = version + 1
            WHERE id = (
                SELECT id FROM tasks
                WHERE (status = 'queued' AND locked_by IS NULL)
                   OR (status = 'running' AND lease_expires_at <= ? AND attempts < max_attempts)
                ORDER BY created_at, seq
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """;

        Timestamp ts = Timestamp.from(now);
        List<Task> claimed = jdbcTemplate.query(sql, rowMapper,
            workerId, ts, Timestamp.from(leaseExpiresAt), ts, ts, ts);
        return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
    }

    @Override
    @Transactional
    public boolean extendLease(UUID taskId, String workerId, Instant leaseExpiresAt, Instant now) {
        String sql = """
            UPDATE tasks SET
                lease_expires_at = ?,
                updated_at = ?,
                version = version + 1
            WHERE id = ? AND locked_by = ? AND status = 'running'
            """;

        return jdbcTemplate.update(sql,
            Timestamp.from(leaseExpiresAt), Timestamp.from(now), taskId, workerId) > 0;
    }

    @Override
    @Transactional
    public boolean compareAndSet(Task task, long expectedVersion) {
        String sql = """
            UPDATE tasks SET
                status = ?,
                pause_reason = ?,
                attempts = ?,
                max_attempts = ?,
                locked_by = ?,
                locked_at = ?,
                lease_expires_at = ?,
                current_plan_id = ?,
                current_step_id = ?,
                result = ?::jsonb,
                error = ?,
                updated_at = ?,
                started_at = ?,
                completed_at = ?,
                version = ?
            WHERE id = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            task.state().wireName(),
            task.pauseReason() != null ? task.pauseReason().wireName() : null,
            task.attempts(),
            task.maxAttempts(),
            task.lockedBy(),
            toTimestamp(task.lockedAt()),
            toTimestamp(task.leaseExpiresAt()),
            task.currentPlanId(),
            task.currentStepId(),
            toJson(task.result()),
            task.error(),
            toTimestamp(task.updatedAt()),
            toTimestamp(task.startedAt()),
            toTimestamp(task.completedAt()),
            task.version(),
            task.id(),
            expectedVersion
        );

        if (rows == 0) {
            log.debug("Version mismatch for task {}: expected {}", task.id(), expectedVersion);
        }
        return rows > 0;
    }

    @Override
    public List<Task> findByOwner(String ownerId, TaskState state, int limit) {
        if (state == null) {
            String sql = "SELECT * FROM tasks WHERE owner_id = ? ORDER BY created_at DESC, seq DESC LIMIT ?";
            return jdbcTemplate.query(sql, rowMapper, ownerId, limit);
        }
        String sql = """
            SELECT * FROM tasks
            WHERE owner_id = ? AND status = ?
            ORDER BY created_at DESC, seq DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, ownerId, state.wireName(), limit);
    }

    @Override
    public int countByOwnerAndStates(String ownerId, Set<TaskState> states) {
        if (states.isEmpty()) {
            return 0;
        }
        String placeholders = states.stream().map(s -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT COUNT(*) FROM tasks WHERE owner_id = ? AND status IN (" + placeholders + ")";
        Object[] args = new Object[states.size() + 1];
        args[0] = ownerId;
        int i = 1;
        for (TaskState state : states) {
            args[i++] = state.wireName();
        }
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, args);
        return count != null ? count : 0;
    }

    @Override
    public int countCreatedSince(String ownerId, Instant since) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE owner_id = ? AND created_at >= ?";
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, ownerId, Timestamp.from(since));
        return count != null ? count : 0;
    }

    @Override
    public int countByState(TaskState state) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = ?";
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, state.wireName());
        return count != null ? count : 0;
    }

    @Override
    public List<Task> findExpiredExhausted(Instant now, int limit) {
        String sql = """
            SELECT * FROM tasks
            WHERE status = 'running'
              AND lease_expires_at <= ?
              AND attempts >= max_attempts
            ORDER BY lease_expires_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit);
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new Task(
                    UUID.fromString(rs.getString("id")),
                    rs.getString("owner_id"),
                    rs.getString("task_type"),
                    rs.getString("input_text"),
                    parseJsonNode(rs.getString("input_data")),
                    TaskState.fromWireName(rs.getString("status")),
                    PauseReason.fromWireName(rs.getString("pause_reason")),
                    rs.getInt("attempts"),
                    rs.getInt("max_attempts"),
                    rs.getString("locked_by"),
                    toInstant(rs.getTimestamp("locked_at")),
                    toInstant(rs.getTimestamp("lease_expires_at")),
                    rs.getString("current_plan_id"),
                    rs.getString("current_step_id"),
                    parseJsonNode(rs.getString("result")),
                    rs.getString("error"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new SQLException("Failed to map task row", e);
            }
        }

        private JsonNode parseJsonNode(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return null;
            return objectMapper.readTree(json);
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
