package com.taskengine.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskengine.core.codec.PlanCodec;
import com.taskengine.core.model.Plan;
import com.taskengine.core.model.Step;
import com.taskengine.core.repository.StepRepository;
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
 * PostgreSQL-backed implementation of StepRepository.
 * One row per (task, plan, step); saving a plan upserts every row.
 */
@Repository("jdbcStepRepository")
public class JdbcStepRepository implements StepRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final PlanCodec codec;
    private final StepRowMapper rowMapper;

    public JdbcStepRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, PlanCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.rowMapper = new StepRowMapper();
    }

    @Override
    @Transactional
    public void saveAll(Plan plan) {
        String sql = """
            INSERT INTO task_steps (
                task_id, plan_id, step_id, step_index, action, action_data, depends_on,
                status, result, error, snapshot_ref, started_at, completed_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?::jsonb, ?, ?, ?, ?)
            ON CONFLICT (task_id, plan_id, step_id) DO UPDATE SET
                step_index = EXCLUDED.step_index,
                status = EXCLUDED.status,
                result = EXCLUDED.result,
                error = EXCLUDED.error,
                snapshot_ref = EXCLUDED.snapshot_ref,
                started_at = EXCLUDED.started_at,
                completed_at = EXCLUDED.completed_at
            """;

        List<Step> steps = plan.getSteps();
        jdbcTemplate.batchUpdate(sql, steps, steps.size(), (ps, step) -> {
            ps.setObject(1, plan.getTaskId());
            ps.setString(2, plan.getPlanId());
            ps.setString(3, step.getStepId());
            ps.setInt(4, plan.indexOf(step));
            ps.setString(5, step.getAction().wireName());
            ps.setString(6, toJson(step.getActionData()));
            ps.setString(7, toJson(objectMapper.valueToTree(step.getDependsOn())));
            ps.setString(8, step.getStatus().wireName());
            ps.setString(9, toJson(step.getResult()));
            ps.setString(10, step.getError());
            ps.setString(11, step.getSnapshotRef());
            ps.setTimestamp(12, step.getStartedAt() != null ? Timestamp.from(step.getStartedAt()) : null);
            ps.setTimestamp(13, step.getCompletedAt() != null ? Timestamp.from(step.getCompletedAt()) : null);
        });
    }

    @Override
    public List<Step> findByPlan(UUID taskId, String planId) {
        String sql = """
            SELECT * FROM task_steps
            WHERE task_id = ? AND plan_id = ?
            ORDER BY step_index
            """;
        return jdbcTemplate.query(sql, rowMapper, taskId, planId);
    }

    private String toJson(JsonNode node) {
        if (node == null) return null;
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    /**
     * Rebuilds the step through the snapshot codec so both restore paths share one parser.
     */
    private class StepRowMapper implements RowMapper<Step> {
        @Override
        public Step mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                ObjectNode node = objectMapper.createObjectNode();
                node.put("step_id", rs.getString("step_id"));
                node.put("action", rs.getString("action"));
                node.set("action_data", readJson(rs.getString("action_data")));
                node.set("depends_on", readJson(rs.getString("depends_on")));
                node.put("status", rs.getString("status"));
                node.set("result", readJson(rs.getString("result")));
                node.put("error", rs.getString("error"));
                node.put("snapshot_ref", rs.getString("snapshot_ref"));
                Timestamp startedAt = rs.getTimestamp("started_at");
                Timestamp completedAt = rs.getTimestamp("completed_at");
                node.put("started_at", startedAt != null ? startedAt.toInstant().toString() : null);
                node.put("completed_at", completedAt != null ? completedAt.toInstant().toString() : null);
                return codec.stepFromNode(node);
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map step row", e);
            }
        }

        private JsonNode readJson(String json) throws JsonProcessingException {
            return json == null ? null : objectMapper.readTree(json);
        }
    }
}
