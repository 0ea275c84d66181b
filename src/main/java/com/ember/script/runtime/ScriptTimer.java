package com.ember.script.runtime;

/** Runs delayed work for pauses and matchwait timeouts. */
public interface ScriptTimer {

    interface Scheduled {
        void cancel();
    }

    Scheduled schedule(double seconds, Runnable task);
}
