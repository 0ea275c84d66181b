package com.ember.script.runtime;

/** Trace output selected by the {@code debug} command; each level includes the ones below it. */
public enum ScriptDebugLevel {
    NONE,
    GOSUBS,
    WAITS,
    IFS,
    VARS,
    ACTIONS;

    public static ScriptDebugLevel of(int level) {
        ScriptDebugLevel[] all = values();
        return all[Math.max(0, Math.min(all.length - 1, level))];
    }
}
