package com.ember.script.runtime;

/**
 * Receives everything a script writes: echoed text for the user and commands for the remote service.
 */
public interface OutputSink {

    String ECHO = "scriptecho";
    String INFO = "scriptinfo";
    String ERROR = "scripterror";

    /** Text shown to the user; {@code preset} is one of the constants above. */
    void echo(String text, String preset);

    /** Command line sent to the remote service, or a client command starting with {@code #}. */
    void sendCommand(String command);
}
