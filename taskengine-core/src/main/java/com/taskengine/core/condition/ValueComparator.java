package com.taskengine.core.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskengine.core.exception.ConditionValidationException;

import java.math.BigDecimal;

/**
 * Comparison rules of the condition language.
 *
 * <ul>
 *   <li>null on both sides: only {@code ==} holds; null on one side: only {@code !=} holds</li>
 *   <li>{@code contains}: substring, array membership or object key; false on type mismatch</li>
 *   <li>numbers compare as decimals; a boolean against a number counts as 1 or 0</li>
 *   <li>otherwise the right operand is coerced to the left operand's type; when that is
 *       impossible equality yields "not equal" and ordering raises</li>
 * </ul>
 */
final class ValueComparator {

    private ValueComparator() {
    }

    static boolean compare(JsonNode left, String op, JsonNode right) {
        if (left == null && right == null) {
            return op.equals("==");
        }
        if (left == null || right == null) {
            return op.equals("!=");
        }
        if (op.equals("contains")) {
            return contains(left, right);
        }

        if (left.isNumber()) {
            BigDecimal r = toDecimal(right);
            if (r == null) {
                return uncomparable(left, op, right);
            }
            return ordered(left.decimalValue().compareTo(r), op);
        }
        if (left.isTextual()) {
            String r = right.isTextual() ? right.textValue() : textOf(right);
            return ordered(left.textValue().compareTo(r), op);
        }
        if (left.isBoolean()) {
            if (right.isNumber()) {
                BigDecimal l = left.booleanValue() ? BigDecimal.ONE : BigDecimal.ZERO;
                return ordered(l.compareTo(right.decimalValue()), op);
            }
            if (!right.isBoolean()) {
                return uncomparable(left, op, right);
            }
            return ordered(Boolean.compare(left.booleanValue(), right.booleanValue()), op);
        }
        if (left.getNodeType() == right.getNodeType() && (op.equals("==") || op.equals("!="))) {
            return left.equals(right) == op.equals("==");
        }
        return uncomparable(left, op, right);
    }

    private static boolean contains(JsonNode left, JsonNode right) {
        if (left.isTextual()) {
            return right.isTextual() && left.textValue().contains(right.textValue());
        }
        if (left.isArray()) {
            for (JsonNode element : left) {
                if (sameValue(element, right)) {
                    return true;
                }
            }
            return false;
        }
        if (left.isObject()) {
            return right.isTextual() && left.has(right.textValue());
        }
        return false;
    }

    private static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    private static boolean ordered(int cmp, String op) {
        return switch (op) {
            case "==" -> cmp == 0;
            case "!=" -> cmp != 0;
            case ">" -> cmp > 0;
            case "<" -> cmp < 0;
            case ">=" -> cmp >= 0;
            case "<=" -> cmp <= 0;
            default -> throw new ConditionValidationException("Unknown operator: " + op);
        };
    }

    private static boolean uncomparable(JsonNode left, String op, JsonNode right) {
        if (op.equals("==") || op.equals("!=")) {
            return op.equals("!=");
        }
        throw new ConditionValidationException(String.format(
            "Cannot compare %s %s %s", left.getNodeType(), op, right.getNodeType()));
    }

    private static BigDecimal toDecimal(JsonNode value) {
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String textOf(JsonNode value) {
        if (value.isBigDecimal()) {
            return value.decimalValue().toPlainString();
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
