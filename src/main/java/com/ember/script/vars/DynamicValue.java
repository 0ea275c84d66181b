package com.ember.script.vars;

import java.util.function.Supplier;

/**
 * Value held by a {@link VariableStore}: either a stored literal or a value computed on every read.
 */
public abstract class DynamicValue {

    private DynamicValue() {}

    /** Current value; may be null for a computed value that has nothing to report. */
    public abstract String get();

    public abstract boolean isComputed();

    public static DynamicValue literal(String value) { return new Literal(value); }

    public static DynamicValue computed(Supplier<String> supplier) { return new Computed(supplier); }

    public static final class Literal extends DynamicValue {
        private final String value;

        Literal(String value) {
            this.value = value == null ? "" : value;
        }

        @Override public String get() { return value; }

        @Override public boolean isComputed() { return false; }
    }

    public static final class Computed extends DynamicValue {
        private final Supplier<String> supplier;

        Computed(Supplier<String> supplier) {
            this.supplier = supplier;
        }

        @Override public String get() { return supplier.get(); }

        @Override public boolean isComputed() { return true; }
    }
}
