package com.ember.script.expr;

import java.util.Collections;
import java.util.List;

/** Outcome of evaluating a script expression: the substituted text, the result and any captured groups. */
public final class EvalResult {
    public final String text;
    public final String result;
    public final List<String> groups;

    EvalResult(String text, String result, List<String> groups) {
        this.text = text;
        this.result = result;
        this.groups = groups == null ? Collections.emptyList() : groups;
    }

    public boolean isTrue() {
        return "true".equals(result);
    }

    @Override
    public String toString() {
        return text + " = " + result;
    }
}
