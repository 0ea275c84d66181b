package com.ember.script.expr;

final class HostToken {
    final HostTokenType type;
    final String lexeme;
    final Object literal;
    final int position;

    HostToken(HostTokenType type, String lexeme, Object literal, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    @Override
    public String toString() {
        return type + " " + lexeme;
    }
}
