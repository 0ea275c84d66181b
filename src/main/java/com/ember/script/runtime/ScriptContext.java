package com.ember.script.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.ember.script.parser.ScriptLine;
import com.ember.script.parser.ScriptToken;
import com.ember.script.vars.VariableContext;
import com.ember.script.vars.VariableReplacer;
import com.ember.script.vars.VariableStore;

/**
 * Execution state of one script instance: the merged line buffer, labels, program counter, if-stack and
 * the script's variable scopes.
 *
 * Scopes by sigil: {@code $} regex captures, then label arguments, then globals; {@code %} script
 * variables, then script arguments; {@code &} label arguments only.
 */
public final class ScriptContext {

    private final String name;
    private final List<ScriptLine> lines;
    private final Map<String, Label> labels;

    private int currentLineNumber = -1;

    /** Open conditional blocks, innermost first. */
    private final Deque<ScriptLine> ifStack = new ArrayDeque<>();

    /** Last branch of a chain that did not run; an else sibling may follow it. */
    private ScriptLine lastIf;

    private List<String> args = new ArrayList<>();

    private final VariableStore variables = new VariableStore();
    private final VariableStore argumentVars = new VariableStore();
    private final VariableStore labelVars = new VariableStore();
    private final VariableStore regexVars = new VariableStore();
    private final VariableStore actionVars = new VariableStore();
    private final VariableStore globals;

    private final VariableReplacer replacer = new VariableReplacer();
    private final VariableContext scope;
    private final VariableContext actionScope;

    public ScriptContext(String name, List<ScriptLine> lines, Map<String, Label> labels, VariableStore globals) {
        this.name = name;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.labels = labels;
        this.globals = globals;

        this.scope = new VariableContext()
                .add('$', regexVars).add('$', labelVars).add('$', globals)
                .add('%', variables).add('%', argumentVars)
                .add('&', labelVars);
        this.actionScope = new VariableContext()
                .add('$', actionVars).add('$', regexVars).add('$', labelVars).add('$', globals)
                .add('%', variables).add('%', argumentVars)
                .add('&', labelVars);
    }

    public String name() { return name; }

    public List<ScriptLine> lines() { return lines; }

    public Map<String, Label> labels() { return labels; }

    public Label label(String labelName) {
        return labels.get(labelName.toLowerCase());
    }

    // ===================== program counter =====================

    /**
     * Index of the line being executed: {@code -1} before the first {@link #advance()}, then
     * {@code [0, lines.size())} while running. Advancing off the last line leaves it at {@code lines.size()},
     * where {@link #currentLine()} is null and the script completes; it never moves further.
     */
    public int currentLineNumber() { return currentLineNumber; }

    void setCurrentLineNumber(int lineNumber) {
        this.currentLineNumber = Math.max(-1, Math.min(lineNumber, lines.size()));
    }

    public void advance() {
        if (currentLineNumber < lines.size()) currentLineNumber++;
    }

    public void retreat() {
        if (currentLineNumber > -1) currentLineNumber--;
    }

    /** Line at the program counter, or null before the start and past the end. */
    public ScriptLine currentLine() {
        if (currentLineNumber < 0 || currentLineNumber >= lines.size()) return null;
        return lines.get(currentLineNumber);
    }

    public ScriptLine peekNextLine() {
        int next = currentLineNumber + 1;
        if (next < 0 || next >= lines.size()) return null;
        return lines.get(next);
    }

    // ===================== if-stack =====================

    public Deque<ScriptLine> ifStack() { return ifStack; }

    ScriptLine lastIf() { return lastIf; }

    void setLastIf(ScriptLine line) { this.lastIf = line; }

    void clearConditionals() {
        ifStack.clear();
        lastIf = null;
    }

    void restoreConditionals(Deque<ScriptLine> saved, ScriptLine savedLastIf) {
        ifStack.clear();
        ifStack.addAll(saved);
        lastIf = savedLastIf;
    }

    /**
     * Skips the body of the block on top of the if-stack, whose opening line is the current line.
     * Stops just before the block's closing line ({@code }} or {@code } else ...}) so that line runs next.
     * Nested blocks are pushed and popped on the way.
     *
     * @return false when the buffer ends before the block closes
     */
    public boolean advanceToNextBlock() {
        ScriptLine target = ifStack.peek();
        if (target == null) return false;
        int depth = ifStack.size();

        while (true) {
            advance();
            ScriptLine line = currentLine();
            if (line == null) {
                while (ifStack.size() > depth) ifStack.pop();
                return false;
            }
            ScriptToken token = line.token();
            if (token == null) continue;

            if (token.hasLeadingBrace() || token.kind() == ScriptToken.Kind.RIGHT_BRACE) {
                if (ifStack.peek() == target) {
                    retreat();
                    return true;
                }
                ifStack.pop();
                if (token.opensBlock()) ifStack.push(line);
            } else if (token.opensBlock()) {
                ifStack.push(line);
            }
        }
    }

    /**
     * After a branch ran, skips the remaining else-if / else siblings of its chain, block bodies included.
     * Leaves the program counter on the last skipped line.
     *
     * @return false when a sibling block cannot be closed
     */
    public boolean advanceToEndOfBlock() {
        while (true) {
            ScriptLine next = peekNextLine();
            if (next == null) return true;
            ScriptToken token = next.token();
            if (token == null || !token.isChainSibling()) return true;

            advance();
            if (token.isSingleLine()) continue;

            if (token.needsBrace()) {
                ScriptLine brace = peekNextLine();
                if (brace == null || brace.token() == null || brace.token().kind() != ScriptToken.Kind.LEFT_BRACE) {
                    return false;
                }
                advance();
            }

            ifStack.push(currentLine());
            if (!advanceToNextBlock()) {
                ifStack.pop();
                return false;
            }
            advance();
            ifStack.pop();
            if (currentLine().token().kind() != ScriptToken.Kind.RIGHT_BRACE) {
                // "} else ..." closes the skipped block and is itself a sibling
                retreat();
            }
        }
    }

    /**
     * Same skip for single-line forms ({@code if x then ...}, {@code if_N ...}): once a single-line branch
     * is taken, the following siblings of the chain never run.
     */
    public boolean skipSingleLineIfElseElses() {
        return advanceToEndOfBlock();
    }

    // ===================== scopes =====================

    public List<String> args() { return Collections.unmodifiableList(args); }

    public VariableStore variables() { return variables; }

    public VariableStore argumentVars() { return argumentVars; }

    public VariableStore labelVars() { return labelVars; }

    public VariableStore regexVars() { return regexVars; }

    public VariableStore actionVars() { return actionVars; }

    public VariableStore globals() { return globals; }

    public String replaceVars(String text) {
        return replacer.replace(text, scope);
    }

    /** Substitution for action commands, where {@code $0..$n} are the trigger's groups. */
    public String replaceActionVars(String text) {
        return replacer.replace(text, actionScope);
    }

    /**
     * {@code %1..%N} from {@code args} (one surrounding quote trimmed each), {@code %0} all of them joined by
     * spaces, empty {@code %N} up to {@code %9}, and {@code %argcount}.
     */
    public void setArgumentVars(List<String> newArgs) {
        List<String> trimmed = new ArrayList<>();
        for (String arg : newArgs) trimmed.add(trimQuotes(arg));
        this.args = trimmed;

        argumentVars.removeAll();
        argumentVars.set("0", String.join(" ", trimmed));
        for (int i = 0; i < trimmed.size(); i++) {
            argumentVars.set(Integer.toString(i + 1), trimmed.get(i));
        }
        for (int i = trimmed.size() + 1; i <= 9; i++) {
            argumentVars.set(Integer.toString(i), "");
        }
        variables.set("argcount", Integer.toString(trimmed.size()));
    }

    public void shiftArgs() {
        if (args.isEmpty()) return;
        setArgumentVars(new ArrayList<>(args.subList(1, args.size())));
    }

    /** {@code $0}/{@code &0} the whole argument text, {@code $1..} each argument. */
    public void setLabelVars(String argumentText, List<String> labelArgs) {
        labelVars.removeAll();
        labelVars.set("0", argumentText);
        for (int i = 0; i < labelArgs.size(); i++) {
            labelVars.set(Integer.toString(i + 1), trimQuotes(labelArgs.get(i)));
        }
    }

    void restoreLabelVars(Map<String, String> saved) {
        labelVars.removeAll();
        for (Map.Entry<String, String> e : saved.entrySet()) labelVars.set(e.getKey(), e.getValue());
    }

    public void setRegexVars(List<String> groups) {
        regexVars.removeAll();
        for (int i = 0; i < groups.size(); i++) regexVars.set(Integer.toString(i), groups.get(i));
    }

    public void setActionVars(List<String> groups) {
        actionVars.removeAll();
        for (int i = 0; i < groups.size(); i++) actionVars.set(Integer.toString(i), groups.get(i));
    }

    static String trimQuotes(String text) {
        String t = text.trim();
        if (t.startsWith("\"")) t = t.substring(1);
        if (t.endsWith("\"")) t = t.substring(0, t.length() - 1);
        return t;
    }

    /** Splits on whitespace outside double quotes; quotes are kept. */
    static List<String> splitArguments(String text) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') inQuote = !inQuote;
            if (Character.isWhitespace(c) && !inQuote) {
                if (current.length() > 0) {
                    out.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) out.add(current.toString());
        return out;
    }
}
