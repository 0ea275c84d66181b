package com.ember.script.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.ember.script.parser.ScriptLine;

/**
 * Caller state saved by {@code gosub} and restored by {@code return}.
 *
 * Branch results live on the shared {@link ScriptLine}s, so a recursive call that runs the same {@code if}
 * overwrites them; they are copied here and put back on return.
 */
final class GosubFrame {
    final String label;
    final int returnLine;
    final Map<String, String> labelVars;
    final Deque<ScriptLine> ifStack;
    final ScriptLine lastIf;

    private final List<Boolean> ifResults = new ArrayList<>();
    private final Boolean lastIfResult;

    GosubFrame(String label, int returnLine, Map<String, String> labelVars, Deque<ScriptLine> ifStack,
               ScriptLine lastIf) {
        this.label = label;
        this.returnLine = returnLine;
        this.labelVars = labelVars;
        this.ifStack = new ArrayDeque<>(ifStack);
        this.lastIf = lastIf;
        for (ScriptLine line : this.ifStack) ifResults.add(line.ifResult());
        this.lastIfResult = lastIf == null ? null : lastIf.ifResult();
    }

    void restoreIfResults() {
        int i = 0;
        for (ScriptLine line : ifStack) line.setIfResult(ifResults.get(i++));
        if (lastIf != null) lastIf.setIfResult(lastIfResult);
    }
}
