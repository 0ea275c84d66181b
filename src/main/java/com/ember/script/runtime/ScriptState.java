package com.ember.script.runtime;

public enum ScriptState {
    NOT_STARTED,
    RUNNING,
    PAUSED,
    STOPPED
}
