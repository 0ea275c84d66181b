package com.ember.script.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One parsed script line.
 *
 * Tokens compare equal when their {@link Kind} matches; the payload is not part of equality.
 */
public final class ScriptToken {

    public enum Kind {
        // control flow
        IF, IF_SINGLE, IF_NEEDS_BRACE,
        IF_ARG, IF_ARG_SINGLE, IF_ARG_NEEDS_BRACE,
        ELSE_IF, ELSE_IF_SINGLE, ELSE_IF_NEEDS_BRACE,
        ELSE, ELSE_SINGLE, ELSE_NEEDS_BRACE,
        LEFT_BRACE, RIGHT_BRACE,
        // flow transfer
        GOTO, GOSUB, RETURN, LABEL, EXIT, SHIFT, MOVE, NEXTROOM,
        // i/o
        ECHO, PUT, SEND, SAVE, DEBUG, COMMENT,
        // variables
        VARIABLE, UNVAR, MATH, RANDOM, EVAL, EVAL_MATH,
        // waiting
        PAUSE, MATCH, MATCHRE, MATCHWAIT, WAITFOR, WAITFOR_RE, WAITFOR_PROMPT, WAIT_EVAL,
        // triggers
        ACTION, ACTION_TOGGLE
    }

    private static final Set<Kind> TOP_LEVEL_IFS = EnumSet.of(
            Kind.IF, Kind.IF_SINGLE, Kind.IF_NEEDS_BRACE, Kind.IF_ARG, Kind.IF_ARG_SINGLE, Kind.IF_ARG_NEEDS_BRACE);
    private static final Set<Kind> ELSE_IFS = EnumSet.of(Kind.ELSE_IF, Kind.ELSE_IF_SINGLE, Kind.ELSE_IF_NEEDS_BRACE);
    private static final Set<Kind> ELSES = EnumSet.of(Kind.ELSE, Kind.ELSE_SINGLE, Kind.ELSE_NEEDS_BRACE);
    private static final Set<Kind> SINGLES = EnumSet.of(
            Kind.IF_SINGLE, Kind.IF_ARG_SINGLE, Kind.ELSE_IF_SINGLE, Kind.ELSE_SINGLE);
    private static final Set<Kind> NEEDS_BRACE = EnumSet.of(
            Kind.IF_NEEDS_BRACE, Kind.IF_ARG_NEEDS_BRACE, Kind.ELSE_IF_NEEDS_BRACE, Kind.ELSE_NEEDS_BRACE);
    private static final Set<Kind> BLOCK_OPENERS = EnumSet.of(
            Kind.IF, Kind.IF_ARG, Kind.ELSE_IF, Kind.ELSE, Kind.LEFT_BRACE);

    private final Kind kind;
    private final List<String> values;
    private final ScriptExpression expression;
    private final ScriptToken body;
    private final int argCount;
    private final boolean leadingBrace;

    private ScriptToken(Kind kind, List<String> values, ScriptExpression expression, ScriptToken body,
                        int argCount, boolean leadingBrace) {
        this.kind = kind;
        this.values = values;
        this.expression = expression;
        this.body = body;
        this.argCount = argCount;
        this.leadingBrace = leadingBrace;
    }

    // -------------------------
    // Factories
    // -------------------------

    /** Token with plain text payload (echo, put, goto label + args, ...). */
    public static ScriptToken of(Kind kind, String... values) {
        return new ScriptToken(kind, Collections.unmodifiableList(Arrays.asList(values)), null, null, 0, false);
    }

    public static ScriptToken conditional(Kind kind, ScriptExpression expression, ScriptToken body) {
        return new ScriptToken(kind, Collections.emptyList(), expression, body, 0, false);
    }

    public static ScriptToken ifArg(Kind kind, int argCount, ScriptToken body) {
        return new ScriptToken(kind, Collections.emptyList(), null, body, argCount, false);
    }

    public static ScriptToken withExpression(Kind kind, ScriptExpression expression, String... values) {
        return new ScriptToken(kind, Collections.unmodifiableList(Arrays.asList(values)), expression, null, 0, false);
    }

    /** Copy of this token marked as closing the enclosing block first ({@code "} else ..."}). */
    public ScriptToken afterClosingBrace() {
        return new ScriptToken(kind, values, expression, body, argCount, true);
    }

    // -------------------------
    // Accessors
    // -------------------------

    public Kind kind() { return kind; }

    public List<String> values() { return values; }

    /** i-th text value, or "" when absent. */
    public String value(int i) { return i < values.size() ? values.get(i) : ""; }

    public String text() { return value(0); }

    public ScriptExpression expression() { return expression; }

    /** Embedded statement of a single-line conditional. */
    public ScriptToken body() { return body; }

    public int argCount() { return argCount; }

    /** True for else-family tokens written as {@code "} else ..."}. */
    public boolean hasLeadingBrace() { return leadingBrace; }

    public boolean isTopLevelIf() { return TOP_LEVEL_IFS.contains(kind); }

    public boolean isElseIf() { return ELSE_IFS.contains(kind); }

    public boolean isElse() { return ELSES.contains(kind); }

    /** Else-if or else: a continuation of an earlier conditional chain. */
    public boolean isChainSibling() { return isElseIf() || isElse(); }

    public boolean isSingleLine() { return SINGLES.contains(kind); }

    public boolean needsBrace() { return NEEDS_BRACE.contains(kind); }

    /** Opens a block whose closing {@code '}'} is on a later line. */
    public boolean opensBlock() { return BLOCK_OPENERS.contains(kind); }

    @Override
    public boolean equals(Object o) {
        return o instanceof ScriptToken && ((ScriptToken) o).kind == kind;
    }

    @Override
    public int hashCode() { return kind.hashCode(); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        sb.append('(');
        if (expression != null) sb.append(expression);
        if (kind == Kind.IF_ARG || kind == Kind.IF_ARG_SINGLE || kind == Kind.IF_ARG_NEEDS_BRACE) sb.append(argCount);
        if (!values.isEmpty()) {
            if (sb.length() > kind.name().length() + 1) sb.append(", ");
            sb.append(values);
        }
        if (body != null) sb.append(", ").append(body);
        return sb.append(')').toString();
    }
}
