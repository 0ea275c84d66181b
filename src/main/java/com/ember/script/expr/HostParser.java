package com.ember.script.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser, lowest precedence first: {@code ||}, {@code &&}, equality, comparison,
 * {@code + -}, {@code * / %}, unary, call/primary.
 */
final class HostParser {
    private final List<HostToken> tokens;
    private int current = 0;

    HostParser(List<HostToken> tokens) { this.tokens = tokens; }

    HostExpr.Node parse() throws ExpressionException {
        HostExpr.Node expr = or();
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "'.");
        return expr;
    }

    private HostExpr.Node or() throws ExpressionException {
        HostExpr.Node expr = and();
        while (match(HostTokenType.OR_OR)) {
            HostToken op = previous();
            HostExpr.Node right = and();
            expr = new HostExpr.Logical(expr, op, right);
        }
        return expr;
    }

    private HostExpr.Node and() throws ExpressionException {
        HostExpr.Node expr = equality();
        while (match(HostTokenType.AND_AND)) {
            HostToken op = previous();
            HostExpr.Node right = equality();
            expr = new HostExpr.Logical(expr, op, right);
        }
        return expr;
    }

    private HostExpr.Node equality() throws ExpressionException {
        HostExpr.Node expr = comparison();
        while (match(HostTokenType.EQUAL_EQUAL, HostTokenType.BANG_EQUAL)) {
            HostToken op = previous();
            HostExpr.Node right = comparison();
            expr = new HostExpr.Binary(expr, op, right);
        }
        return expr;
    }

    private HostExpr.Node comparison() throws ExpressionException {
        HostExpr.Node expr = term();
        while (match(HostTokenType.GREATER, HostTokenType.GREATER_EQUAL, HostTokenType.LESS, HostTokenType.LESS_EQUAL)) {
            HostToken op = previous();
            HostExpr.Node right = term();
            expr = new HostExpr.Binary(expr, op, right);
        }
        return expr;
    }

    private HostExpr.Node term() throws ExpressionException {
        HostExpr.Node expr = factor();
        while (match(HostTokenType.PLUS, HostTokenType.MINUS)) {
            HostToken op = previous();
            HostExpr.Node right = factor();
            expr = new HostExpr.Binary(expr, op, right);
        }
        return expr;
    }

    private HostExpr.Node factor() throws ExpressionException {
        HostExpr.Node expr = unary();
        while (match(HostTokenType.STAR, HostTokenType.SLASH, HostTokenType.PERCENT)) {
            HostToken op = previous();
            HostExpr.Node right = unary();
            expr = new HostExpr.Binary(expr, op, right);
        }
        return expr;
    }

    private HostExpr.Node unary() throws ExpressionException {
        if (match(HostTokenType.BANG, HostTokenType.MINUS)) {
            HostToken op = previous();
            HostExpr.Node right = unary();
            return new HostExpr.Unary(op, right);
        }
        return primary();
    }

    private HostExpr.Node primary() throws ExpressionException {
        if (match(HostTokenType.FALSE)) return new HostExpr.Literal(Boolean.FALSE);
        if (match(HostTokenType.TRUE)) return new HostExpr.Literal(Boolean.TRUE);
        if (match(HostTokenType.NUMBER)) return new HostExpr.Literal(previous().literal);
        if (match(HostTokenType.STRING)) return new HostExpr.Literal(previous().literal);

        if (match(HostTokenType.WORD)) {
            HostToken name = previous();
            if (match(HostTokenType.LEFT_PAREN)) return finishCall(name);
            return new HostExpr.Literal(name.literal);
        }

        if (match(HostTokenType.LEFT_PAREN)) {
            HostExpr.Node expr = or();
            consume(HostTokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        throw error(peek(), "Expect expression.");
    }

    private HostExpr.Node finishCall(HostToken name) throws ExpressionException {
        List<HostExpr.Node> arguments = new ArrayList<>();
        if (!check(HostTokenType.RIGHT_PAREN)) {
            do {
                arguments.add(or());
            } while (match(HostTokenType.COMMA));
        }
        consume(HostTokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new HostExpr.Call(name.lexeme, arguments);
    }

    private boolean match(HostTokenType... types) {
        for (HostTokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private HostToken consume(HostTokenType type, String message) throws ExpressionException {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(HostTokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private HostToken advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == HostTokenType.EOF; }
    private HostToken peek() { return tokens.get(current); }
    private HostToken previous() { return tokens.get(current - 1); }

    private ExpressionException error(HostToken token, String message) {
        return new ExpressionException("[col " + (token.position + 1) + "] " + message);
    }
}
