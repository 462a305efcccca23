package com.taskengine.core.condition;

/**
 * A lexical token with its source offset.
 */
record Token(TokenType type, String text, int position) {

    boolean isKeyword(String keyword) {
        return type == TokenType.IDENT && text.equalsIgnoreCase(keyword);
    }

    @Override
    public String toString() {
        return type + "('" + text + "') at " + position;
    }
}
