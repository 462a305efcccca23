package com.taskengine.core.condition;

import com.taskengine.core.exception.ConditionValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a condition expression into tokens. Whitespace is dropped; any character that
 * starts no token is an error.
 */
final class ConditionTokenizer {

    private ConditionTokenizer() {
    }

    static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = expression.length();
        while (pos < length) {
            char c = expression.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            int start = pos;
            if (isDigit(c) || (c == '-' && pos + 1 < length && isDigit(expression.charAt(pos + 1)))) {
                pos = scanNumber(expression, pos);
                tokens.add(new Token(TokenType.NUMBER, expression.substring(start, pos), start));
            } else if (c == '"') {
                int close = expression.indexOf('"', pos + 1);
                if (close < 0) {
                    throw unexpected(expression, pos);
                }
                pos = close + 1;
                tokens.add(new Token(TokenType.STRING, expression.substring(start, pos), start));
            } else if (Character.isLetter(c) && c < 128 || c == '_') {
                pos++;
                while (pos < length && isIdentPart(expression.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(TokenType.IDENT, expression.substring(start, pos), start));
            } else {
                TokenType type = symbol(expression, pos);
                if (type == null) {
                    throw unexpected(expression, pos);
                }
                pos += (type == TokenType.GE || type == TokenType.LE
                    || type == TokenType.EQ || type == TokenType.NE) ? 2 : 1;
                tokens.add(new Token(type, expression.substring(start, pos), start));
            }
        }
        return tokens;
    }

    private static TokenType symbol(String expression, int pos) {
        char c = expression.charAt(pos);
        char next = pos + 1 < expression.length() ? expression.charAt(pos + 1) : '\0';
        return switch (c) {
            case '>' -> next == '=' ? TokenType.GE : TokenType.GT;
            case '<' -> next == '=' ? TokenType.LE : TokenType.LT;
            case '=' -> next == '=' ? TokenType.EQ : null;
            case '!' -> next == '=' ? TokenType.NE : null;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '.' -> TokenType.DOT;
            default -> null;
        };
    }

    private static int scanNumber(String expression, int pos) {
        if (expression.charAt(pos) == '-') {
            pos++;
        }
        while (pos < expression.length() && isDigit(expression.charAt(pos))) {
            pos++;
        }
        // fraction only when a digit follows the dot, otherwise the dot is an accessor separator
        if (pos + 1 < expression.length() && expression.charAt(pos) == '.' && isDigit(expression.charAt(pos + 1))) {
            pos++;
            while (pos < expression.length() && isDigit(expression.charAt(pos))) {
                pos++;
            }
        }
        return pos;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentPart(char c) {
        return (c < 128 && Character.isLetterOrDigit(c)) || c == '_';
    }

    private static ConditionValidationException unexpected(String expression, int pos) {
        return new ConditionValidationException(String.format(
            "Unexpected character at position %d: '%s'", pos, expression.substring(pos)));
    }
}
