package com.taskengine.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskengine.core.model.TaskEvent;
import com.taskengine.core.model.TaskEventType;
import com.taskengine.core.repository.TaskEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of TaskEventRepository.
 * The table is append-only; rows are never updated.
 */
@Repository("jdbcTaskEventRepository")
public class JdbcTaskEventRepository implements TaskEventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskEventRowMapper rowMapper;

    public JdbcTaskEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new TaskEventRowMapper();
    }

    @Override
    @Transactional
    public void append(TaskEvent event) {
        String sql = """
            INSERT INTO task_events (
                event_id, task_id, event_type, event_data, step_id, tool_name, created_at
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            event.eventId(),
            event.taskId(),
            event.eventType().wireName(),
            serializeData(event.eventData()),
            event.stepId(),
            event.toolName(),
            Timestamp.from(event.createdAt())
        );
        log.debug("Appended {} event for task {}", event.eventType().wireName(), event.taskId());
    }

    @Override
    public List<TaskEvent> findByTask(UUID taskId, int limit) {
        String sql = """
            SELECT * FROM task_events
            WHERE task_id = ?
            ORDER BY created_at DESC, seq DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, taskId, limit);
    }

    private String serializeData(JsonNode data) {
        if (data == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event data", e);
        }
    }

    private class TaskEventRowMapper implements RowMapper<TaskEvent> {
        @Override
        public TaskEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new TaskEvent(
                UUID.fromString(rs.getString("event_id")),
                UUID.fromString(rs.getString("task_id")),
                TaskEventType.fromWireName(rs.getString("event_type")),
                deserializeData(rs.getString("event_data")),
                rs.getString("step_id"),
                rs.getString("tool_name"),
                rs.getTimestamp("created_at").toInstant()
            );
        }

        private JsonNode deserializeData(String json) {
            if (json == null || json.isBlank()) {
                return objectMapper.createObjectNode();
            }
            try {
                return objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                log.warn("Failed to deserialize event data: {}", e.getMessage());
                return objectMapper.createObjectNode();
            }
        }
    }
}
