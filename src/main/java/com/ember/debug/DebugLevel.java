package com.ember.debug;

/** Severity of a message routed through {@link Debug}. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
