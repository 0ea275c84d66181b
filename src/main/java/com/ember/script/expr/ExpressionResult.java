package com.ember.script.expr;

import java.util.Collections;
import java.util.List;

/**
 * Value produced by an {@link ExpressionHost} or a {@link ScriptFunction}: a {@link Boolean}, a {@link Double}
 * or a {@link String}, plus any regex groups captured while computing it.
 */
public final class ExpressionResult {
    private final Object value;
    private final List<String> groups;

    private ExpressionResult(Object value, List<String> groups) {
        this.value = value;
        this.groups = groups;
    }

    public static ExpressionResult of(Object value) {
        return new ExpressionResult(value, Collections.emptyList());
    }

    public static ExpressionResult withGroups(Object value, List<String> groups) {
        return new ExpressionResult(value, groups == null ? Collections.emptyList() : List.copyOf(groups));
    }

    public Object value() { return value; }

    public List<String> groups() { return groups; }

    public boolean isNumber() { return value instanceof Double; }

    public boolean isBoolean() { return value instanceof Boolean; }

    /** Script text form; integral numbers have no fractional part. */
    public String asText() {
        if (value == null) return "";
        if (value instanceof Double) return Numbers.format((Double) value);
        return value.toString();
    }

    @Override
    public String toString() {
        return groups.isEmpty() ? asText() : asText() + " " + groups;
    }
}
