package com.taskengine.core.condition;

/**
 * Lexical categories of the condition language.
 */
enum TokenType {
    NUMBER,
    STRING,
    GE,
    LE,
    EQ,
    NE,
    GT,
    LT,
    LPAREN,
    RPAREN,
    DOT,
    IDENT
}
