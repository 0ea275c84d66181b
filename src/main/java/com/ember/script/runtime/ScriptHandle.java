package com.ember.script.runtime;

import java.util.List;
import java.util.Map;

/**
 * Control surface of one running script.
 */
public interface ScriptHandle {

    String name();

    ScriptState state();

    void pause();

    void resume();

    /** Stops the script for good; safe to call more than once. */
    void cancel();

    /** Offers one incoming text line to actions, matches and waits. */
    void deliverStreamLine(String text);

    /** Resumes a waiting script as if its wait had matched with {@code captures}. */
    void deliverMatch(List<String> captures);

    void deliverPrompt();

    void deliverRoomChange();

    /** Script-local variables, sorted by name. */
    Map<String, String> localVariables();
}
