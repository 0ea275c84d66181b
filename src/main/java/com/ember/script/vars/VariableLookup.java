package com.ember.script.vars;

/** Resolves a variable name to its value, or null when the name is unknown. */
@FunctionalInterface
public interface VariableLookup {
    String lookup(String key);
}
