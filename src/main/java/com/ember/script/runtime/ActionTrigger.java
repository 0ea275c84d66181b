package com.ember.script.runtime;

import com.ember.script.parser.ScriptExpression;

/**
 * A registered {@code action}: commands run when a stream line matches {@code pattern}, or, for
 * {@code when eval}, when {@code condition} holds at a prompt.
 */
final class ActionTrigger {
    final String actionClass;
    final String command;
    final String pattern;
    final ScriptExpression condition;
    boolean enabled = true;

    ActionTrigger(String actionClass, String command, String pattern, ScriptExpression condition) {
        this.actionClass = actionClass;
        this.command = command;
        this.pattern = pattern;
        this.condition = condition;
    }

    boolean isEval() {
        return condition != null;
    }
}
