package com.ember.script.expr;

enum HostTokenType {
    LEFT_PAREN, RIGHT_PAREN, COMMA,
    PLUS, MINUS, STAR, SLASH, PERCENT,
    BANG, BANG_EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL, LESS, LESS_EQUAL,
    AND_AND, OR_OR,
    NUMBER, STRING, WORD, TRUE, FALSE,
    EOF
}
