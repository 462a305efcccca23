package com.taskengine.core.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.taskengine.core.exception.ConditionValidationException;

import java.math.BigDecimal;
import java.util.List;

/**
 * Recursive descent parser that evaluates while it parses.
 * Values are JSON nodes; a Java {@code null} stands for a missing or JSON-null value.
 */
final class ConditionParser {

    private final List<Token> tokens;
    private final JsonNode root;
    private int pos;

    ConditionParser(List<Token> tokens, JsonNode root) {
        this.tokens = tokens;
        this.root = root;
    }

    /**
     * expression := comparison (("and" | "or") comparison)*
     * Folds strictly left to right; every comparison is evaluated.
     */
    boolean parseExpression() {
        boolean left = parseComparison();
        while (peek() != null && (peek().isKeyword("and") || peek().isKeyword("or"))) {
            boolean isAnd = advance().isKeyword("and");
            boolean right = parseComparison();
            left = isAnd ? left && right : left || right;
        }
        return left;
    }

    /**
     * Fails unless every token was consumed.
     */
    void expectEnd() {
        if (pos != tokens.size()) {
            throw new ConditionValidationException(
                "Unexpected token " + tokens.get(pos) + ", remaining: " + tokens.subList(pos, tokens.size()));
        }
    }

    boolean parseComparison() {
        if (match("true")) {
            advance();
            return true;
        }
        if (match("false")) {
            advance();
            return false;
        }

        JsonNode left = parseAccessor();

        if (match("is_null")) {
            advance();
            return left == null;
        }
        if (match("is_not_null")) {
            advance();
            return left != null;
        }

        String op = parseOperator();
        JsonNode right = parseValue();
        return ValueComparator.compare(left, op, right);
    }

    /**
     * accessor := "result" ("." IDENT)* | "len(" accessor ")"
     */
    JsonNode parseAccessor() {
        if (match("len")) {
            advance();
            expect(TokenType.LPAREN, "'('");
            JsonNode inner = parseAccessor();
            expect(TokenType.RPAREN, "')'");
            return IntNode.valueOf(length(inner));
        }

        Token head = expect(TokenType.IDENT, "'result'");
        if (!head.isKeyword("result")) {
            throw new ConditionValidationException("Expected 'result' but got " + head);
        }

        JsonNode current = present(root);
        while (peek() != null && peek().type() == TokenType.DOT) {
            advance();
            Token field = expect(TokenType.IDENT, "field name");
            // keep consuming the path once a null was reached
            if (current != null) {
                current = current.isObject() ? present(current.get(field.text())) : null;
            }
        }
        return current;
    }

    /**
     * value := STRING | NUMBER | "true" | "false" | "null"
     */
    JsonNode parseValue() {
        Token tok = peek();
        if (tok == null) {
            throw new ConditionValidationException("Expected value but got end of expression");
        }
        switch (tok.type()) {
            case STRING -> {
                advance();
                return TextNode.valueOf(tok.text().substring(1, tok.text().length() - 1));
            }
            case NUMBER -> {
                advance();
                return DecimalNode.valueOf(new BigDecimal(tok.text()));
            }
            case IDENT -> {
                if (tok.isKeyword("true")) {
                    advance();
                    return BooleanNode.TRUE;
                }
                if (tok.isKeyword("false")) {
                    advance();
                    return BooleanNode.FALSE;
                }
                if (tok.isKeyword("null")) {
                    advance();
                    return null;
                }
            }
            default -> {
            }
        }
        throw new ConditionValidationException("Expected value but got " + tok);
    }

    private String parseOperator() {
        Token tok = peek();
        if (tok == null) {
            throw new ConditionValidationException("Expected operator but got end of expression");
        }
        String op = switch (tok.type()) {
            case EQ -> "==";
            case NE -> "!=";
            case GT -> ">";
            case LT -> "<";
            case GE -> ">=";
            case LE -> "<=";
            default -> tok.isKeyword("contains") ? "contains" : null;
        };
        if (op == null) {
            throw new ConditionValidationException("Expected operator but got " + tok);
        }
        advance();
        return op;
    }

    // ========== Helper Methods ==========

    private static int length(JsonNode value) {
        if (value == null) {
            return 0;
        }
        if (value.isTextual()) {
            return value.textValue().length();
        }
        if (value.isContainerNode()) {
            return value.size();
        }
        throw new ConditionValidationException("len() applied to non-sized value: " + value.getNodeType());
    }

    private static JsonNode present(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private boolean match(String keyword) {
        Token tok = peek();
        return tok != null && tok.isKeyword(keyword);
    }

    private Token expect(TokenType type, String description) {
        Token tok = peek();
        if (tok == null) {
            throw new ConditionValidationException("Expected " + description + " but got end of expression");
        }
        if (tok.type() != type) {
            throw new ConditionValidationException("Expected " + description + " but got " + tok);
        }
        return advance();
    }
}
