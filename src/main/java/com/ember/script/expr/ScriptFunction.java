package com.ember.script.expr;

import java.util.List;

/** Function callable from script expressions, e.g. {@code contains("%text", "sword")}. */
@FunctionalInterface
public interface ScriptFunction {
    ExpressionResult call(List<String> args) throws ExpressionException;
}
