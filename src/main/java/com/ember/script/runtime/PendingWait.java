package com.ember.script.runtime;

import com.ember.script.parser.ScriptExpression;

/** The condition a suspended script is waiting on. */
final class PendingWait {

    enum Kind { TEXT, REGEX, PROMPT, EVAL, ROOM }

    final Kind kind;
    final String target;
    final ScriptExpression condition;

    private PendingWait(Kind kind, String target, ScriptExpression condition) {
        this.kind = kind;
        this.target = target;
        this.condition = condition;
    }

    static PendingWait text(String target) { return new PendingWait(Kind.TEXT, target, null); }

    static PendingWait regex(String pattern) { return new PendingWait(Kind.REGEX, pattern, null); }

    static PendingWait prompt() { return new PendingWait(Kind.PROMPT, null, null); }

    static PendingWait eval(ScriptExpression condition) { return new PendingWait(Kind.EVAL, null, condition); }

    static PendingWait room() { return new PendingWait(Kind.ROOM, null, null); }

    @Override
    public String toString() {
        return kind + (target == null ? "" : " " + target);
    }
}
