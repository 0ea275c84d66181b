package com.ember.script.runtime;

/** What the runtime does after a token has been handled. */
public enum ExecuteResult {
    NEXT,
    WAIT,
    EXIT,
    ADVANCE_TO_NEXT_BLOCK,
    ADVANCE_TO_END_OF_BLOCK
}
