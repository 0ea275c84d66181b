package com.ember.script.expr;

/**
 * Evaluates a fully substituted expression string such as {@code 3 > 2 && "a" == "a"}.
 */
@FunctionalInterface
public interface ExpressionHost {
    ExpressionResult evaluate(String text) throws ExpressionException;
}
