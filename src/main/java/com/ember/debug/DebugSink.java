package com.ember.debug;

/** Pluggable debug output target (SLF4J, stdout, a client window, etc.). */
@FunctionalInterface
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
