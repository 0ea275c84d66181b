package com.ember.script;

/** The requested script does not exist in the engine's {@link TextSource}. */
public class ScriptNotFoundException extends RuntimeException {
    private final String scriptName;

    public ScriptNotFoundException(String scriptName) {
        super("Script '" + scriptName + "' does not exist");
        this.scriptName = scriptName;
    }

    public String scriptName() { return scriptName; }
}
