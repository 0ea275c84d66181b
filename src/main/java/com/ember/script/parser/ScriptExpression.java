package com.ember.script.parser;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Condition or value expression as written in a script line.
 *
 * The tree is deliberately shallow: plain text fragments, script function calls and sequences of both.
 * Operators stay inside {@link Value} text and are only interpreted by the expression host.
 */
public abstract class ScriptExpression {

    public interface Visitor<R> {
        R visitValue(Value expr);
        R visitFunction(Function expr);
        R visitSequence(Sequence expr);
    }

    private ScriptExpression() {}

    public abstract <R> R accept(Visitor<R> visitor);

    public static Value value(String text) { return new Value(text); }

    public static Function function(String name, List<String> args) { return new Function(name, args); }

    public static Sequence sequence(List<ScriptExpression> parts) { return new Sequence(parts); }

    // -------------------------
    // Nodes
    // -------------------------

    public static final class Value extends ScriptExpression {
        public final String text;

        public Value(String text) {
            this.text = text == null ? "" : text;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitValue(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Value && ((Value) o).text.equals(text);
        }

        @Override
        public int hashCode() { return text.hashCode(); }

        @Override
        public String toString() { return "Value(" + text + ")"; }
    }

    public static final class Function extends ScriptExpression {
        public final String name;
        public final List<String> args;

        public Function(String name, List<String> args) {
            this.name = name;
            this.args = Collections.unmodifiableList(args);
        }

        /** Arguments as written, joined back with {@code ", "}. */
        public String argText() { return String.join(", ", args); }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFunction(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Function)) return false;
            Function other = (Function) o;
            return other.name.equals(name) && other.args.equals(args);
        }

        @Override
        public int hashCode() { return Objects.hash(name, args); }

        @Override
        public String toString() { return "Function(" + name + ", " + args + ")"; }
    }

    public static final class Sequence extends ScriptExpression {
        public final List<ScriptExpression> parts;

        public Sequence(List<ScriptExpression> parts) {
            this.parts = Collections.unmodifiableList(parts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSequence(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Sequence && ((Sequence) o).parts.equals(parts);
        }

        @Override
        public int hashCode() { return parts.hashCode(); }

        @Override
        public String toString() { return "Sequence(" + parts + ")"; }
    }
}
