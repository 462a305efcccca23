package com.taskengine.core.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.core.exception.ConditionValidationException;

import java.util.Map;

/**
 * Evaluates boolean condition expressions against a step result.
 *
 * <pre>
 * expression := comparison (("and" | "or") comparison)*
 * comparison := "true" | "false"
 *             | accessor ("is_null" | "is_not_null")
 *             | accessor OP value
 * accessor   := "result" ("." IDENT)* | "len(" accessor ")"
 * OP         := "==" | "!=" | ">" | "<" | ">=" | "<=" | "contains"
 * value      := STRING | NUMBER | "true" | "false" | "null"
 * </pre>
 *
 * Examples:
 * <pre>
 * result.success == true
 * result.error is_null
 * len(result.items) > 2
 * result.status == "completed" and result.score > 50
 * </pre>
 *
 * {@code and}/{@code or} share one precedence level and fold left to right, so
 * {@code a or b and c} means {@code (a or b) and c}. Keywords are case-insensitive.
 * Stateless and thread-safe.
 */
public class ConditionEvaluator {

    /**
     * Evaluate against the result of {@code sourceStepId}, or the most recent result
     * when no source is given.
     *
     * @param condition Expression; blank means true
     * @param stepResults Step results in production order
     * @param sourceStepId Step whose result is bound to {@code result}, may be null
     * @throws ConditionValidationException if the expression is malformed or the root cannot be resolved
     */
    public boolean evaluate(String condition, Map<String, JsonNode> stepResults, String sourceStepId) {
        Boolean constant = constant(condition);
        if (constant != null) {
            return constant;
        }
        return evaluate(condition, resolveRoot(stepResults, sourceStepId));
    }

    /**
     * Evaluate with an explicit root bound to {@code result}.
     *
     * @throws ConditionValidationException if the expression is malformed
     */
    public boolean evaluate(String condition, JsonNode root) {
        Boolean constant = constant(condition);
        if (constant != null) {
            return constant;
        }
        ConditionParser parser = new ConditionParser(ConditionTokenizer.tokenize(condition.strip()), root);
        boolean result = parser.parseExpression();
        parser.expectEnd();
        return result;
    }

    /**
     * Resolve a single accessor such as {@code result.a.b} or {@code len(result.items)}.
     *
     * @return The value, or null when any segment is missing or null
     */
    public JsonNode resolve(String accessor, JsonNode root) {
        ConditionParser parser = new ConditionParser(ConditionTokenizer.tokenize(accessor.strip()), root);
        JsonNode value = parser.parseAccessor();
        parser.expectEnd();
        return value;
    }

    private static Boolean constant(String condition) {
        if (condition == null || condition.isBlank() || condition.strip().equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (condition.strip().equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static JsonNode resolveRoot(Map<String, JsonNode> stepResults, String sourceStepId) {
        if (sourceStepId != null && !sourceStepId.isBlank()) {
            if (!stepResults.containsKey(sourceStepId)) {
                throw new ConditionValidationException(
                    "Source step '" + sourceStepId + "' has no result");
            }
            return stepResults.get(sourceStepId);
        }
        if (stepResults.isEmpty()) {
            throw new ConditionValidationException("No step results to bind 'result' to");
        }
        JsonNode last = null;
        for (JsonNode value : stepResults.values()) {
            last = value;
        }
        return last;
    }
}
