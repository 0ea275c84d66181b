package com.ember.script.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

import com.ember.debug.Debug;
import com.ember.script.EngineConfig;
import com.ember.script.expr.EvalResult;
import com.ember.script.expr.Numbers;
import com.ember.script.expr.ScriptEvaluator;
import com.ember.script.parser.ScriptExpression;
import com.ember.script.parser.ScriptLine;
import com.ember.script.parser.ScriptToken;
import com.ember.script.parser.ScriptToken.Kind;

/**
 * Runs one script instance, one token at a time.
 *
 * Progress is cooperative: {@link #next()} runs lines until a token suspends the script (pause, match or
 * wait), then returns. Stream events and timers resume it. All entry points synchronize on the instance, so
 * the runtime never executes two lines at once.
 */
public final class ScriptRuntime implements ScriptHandle {
    private static final String TAG = "ScriptRuntime";

    /** Commands that suspend the script; not allowed in action bodies. */
    private static final Set<Kind> SUSPENDING = EnumSet.of(Kind.PAUSE, Kind.MATCHWAIT, Kind.WAITFOR,
            Kind.WAITFOR_RE, Kind.WAITFOR_PROMPT, Kind.WAIT_EVAL, Kind.MOVE, Kind.NEXTROOM);

    @FunctionalInterface
    interface TokenHandler {
        ExecuteResult handle(ScriptLine line, ScriptToken token);
    }

    private final ScriptContext context;
    private final ScriptEvaluator evaluator;
    private final StreamMatcher matcher;
    private final OutputSink sink;
    private final ScriptTimer timer;
    private final EngineConfig config;

    private final Map<Kind, TokenHandler> handlers = new EnumMap<>(Kind.class);
    private final Deque<GosubFrame> gosubStack = new ArrayDeque<>();
    private final List<MatchEntry> matchStack = new ArrayList<>();
    private final List<ActionTrigger> actions = new ArrayList<>();

    private ScriptState state = ScriptState.NOT_STARTED;
    private boolean resumePending;
    private boolean matchwaitArmed;
    private PendingWait pendingWait;
    private ScriptTimer.Scheduled scheduled;
    private int waitGeneration;
    private ScriptDebugLevel debugLevel = ScriptDebugLevel.NONE;

    private long loopWindowStart;
    private int loopJumps;

    private Consumer<ScriptRuntime> onStopped = runtime -> {};

    public ScriptRuntime(ScriptContext context, ScriptEvaluator evaluator, StreamMatcher matcher, OutputSink sink,
                         ScriptTimer timer, EngineConfig config) {
        this.context = context;
        this.evaluator = evaluator;
        this.matcher = matcher;
        this.sink = sink;
        this.timer = timer;
        this.config = config;
        registerHandlers();
    }

    private void registerHandlers() {
        handlers.put(Kind.COMMENT, (line, token) -> ExecuteResult.NEXT);
        handlers.put(Kind.LABEL, (line, token) -> ExecuteResult.NEXT);

        handlers.put(Kind.IF, this::handleIf);
        handlers.put(Kind.IF_NEEDS_BRACE, this::handleIfNeedsBrace);
        handlers.put(Kind.IF_SINGLE, this::handleIfSingle);
        handlers.put(Kind.IF_ARG, this::handleIfArg);
        handlers.put(Kind.IF_ARG_NEEDS_BRACE, this::handleIfArgNeedsBrace);
        handlers.put(Kind.IF_ARG_SINGLE, this::handleIfArgSingle);
        handlers.put(Kind.ELSE_IF, this::handleElseIf);
        handlers.put(Kind.ELSE_IF_NEEDS_BRACE, this::handleElseIfNeedsBrace);
        handlers.put(Kind.ELSE_IF_SINGLE, this::handleElseIfSingle);
        handlers.put(Kind.ELSE, this::handleElse);
        handlers.put(Kind.ELSE_NEEDS_BRACE, this::handleElseNeedsBrace);
        handlers.put(Kind.ELSE_SINGLE, this::handleElseSingle);
        handlers.put(Kind.LEFT_BRACE, this::handleLeftBrace);
        handlers.put(Kind.RIGHT_BRACE, this::handleRightBrace);

        handlers.put(Kind.GOTO, this::handleGoto);
        handlers.put(Kind.GOSUB, this::handleGosub);
        handlers.put(Kind.RETURN, (line, token) -> returnFromGosub(line));
        handlers.put(Kind.EXIT, (line, token) -> ExecuteResult.EXIT);
        handlers.put(Kind.SHIFT, this::handleShift);
        handlers.put(Kind.MOVE, this::handleMove);
        handlers.put(Kind.NEXTROOM, this::handleNextroom);

        handlers.put(Kind.ECHO, this::handleEcho);
        handlers.put(Kind.PUT, this::handlePut);
        handlers.put(Kind.SEND, this::handleSend);
        handlers.put(Kind.SAVE, this::handleSave);
        handlers.put(Kind.DEBUG, this::handleDebug);

        handlers.put(Kind.VARIABLE, this::handleVariable);
        handlers.put(Kind.UNVAR, this::handleUnvar);
        handlers.put(Kind.MATH, this::handleMath);
        handlers.put(Kind.RANDOM, this::handleRandom);
        handlers.put(Kind.EVAL, this::handleEval);
        handlers.put(Kind.EVAL_MATH, this::handleEvalMath);

        handlers.put(Kind.PAUSE, this::handlePause);
        handlers.put(Kind.MATCH, this::handleMatch);
        handlers.put(Kind.MATCHRE, this::handleMatch);
        handlers.put(Kind.MATCHWAIT, this::handleMatchwait);
        handlers.put(Kind.WAITFOR, this::handleWaitfor);
        handlers.put(Kind.WAITFOR_RE, this::handleWaitfor);
        handlers.put(Kind.WAITFOR_PROMPT, this::handleWaitforPrompt);
        handlers.put(Kind.WAIT_EVAL, this::handleWaitEval);

        handlers.put(Kind.ACTION, this::handleAction);
        handlers.put(Kind.ACTION_TOGGLE, this::handleActionToggle);
    }

    public void setOnStopped(Consumer<ScriptRuntime> onStopped) {
        this.onStopped = onStopped == null ? runtime -> {} : onStopped;
    }

    public ScriptContext context() { return context; }

    public synchronized ScriptDebugLevel debugLevel() { return debugLevel; }

    @Override
    public String name() { return context.name(); }

    @Override
    public synchronized ScriptState state() { return state; }

    @Override
    public Map<String, String> localVariables() { return context.variables().snapshot(); }

    // ===================== lifecycle =====================

    public synchronized void start(List<String> args) {
        if (state != ScriptState.NOT_STARTED) return;
        state = ScriptState.RUNNING;
        context.setArgumentVars(args);
        if (config.echoStatus()) sink.echo("[Starting '" + name() + "']", OutputSink.INFO);
        Debug.get().i(TAG, "starting '" + name() + "' with args " + args);
        next();
    }

    /** Runs lines until the script suspends, stops or reaches the end. */
    public synchronized void next() {
        if (state == ScriptState.STOPPED || state == ScriptState.NOT_STARTED) return;
        if (state == ScriptState.PAUSED) {
            resumePending = true;
            return;
        }

        while (state == ScriptState.RUNNING) {
            context.advance();
            ScriptLine line = context.currentLine();
            if (line == null) {
                cancel();
                return;
            }
            if (!continueAfter(line, handleLine(line))) return;
        }
        if (state == ScriptState.PAUSED) resumePending = true;
    }

    @Override
    public synchronized void pause() {
        if (state != ScriptState.RUNNING) return;
        state = ScriptState.PAUSED;
        if (config.echoStatus()) sink.echo("[Pausing '" + name() + "']", OutputSink.INFO);
    }

    @Override
    public synchronized void resume() {
        if (state != ScriptState.PAUSED) return;
        state = ScriptState.RUNNING;
        if (config.echoStatus()) sink.echo("[Resuming '" + name() + "']", OutputSink.INFO);
        if (resumePending) {
            resumePending = false;
            next();
        }
    }

    @Override
    public synchronized void cancel() {
        if (state == ScriptState.STOPPED) return;
        state = ScriptState.STOPPED;
        resumePending = false;
        clearWaits();
        actions.clear();
        gosubStack.clear();
        context.clearConditionals();
        if (config.echoStatus()) sink.echo("[Script '" + name() + "' finished]", OutputSink.INFO);
        Debug.get().i(TAG, "'" + name() + "' stopped at line " + context.currentLineNumber());
        onStopped.accept(this);
    }

    // ===================== dispatch =====================

    private ExecuteResult handleLine(ScriptLine line) {
        ScriptToken token = line.token();
        if (token == null) {
            sendError(line, "unknown command '" + line.originalText().trim() + "'");
            return ExecuteResult.NEXT;
        }
        if (token.kind() != Kind.COMMENT && !token.isChainSibling()) {
            context.setLastIf(null);
        }
        return execute(line, token);
    }

    private ExecuteResult execute(ScriptLine line, ScriptToken token) {
        TokenHandler handler = handlers.get(token.kind());
        if (handler == null) {
            sendError(line, "no handler for " + token.kind());
            return ExecuteResult.EXIT;
        }
        try {
            return handler.handle(line, token);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "'" + token.kind() + "' failed at " + line, e);
            sendError(line, "'" + line.originalText() + "' failed: " + e.getMessage());
            return ExecuteResult.EXIT;
        }
    }

    /** Applies {@code result}; false when the run loop must stop. */
    private boolean continueAfter(ScriptLine line, ExecuteResult result) {
        switch (result) {
            case NEXT:
                return true;
            case WAIT:
                return false;
            case ADVANCE_TO_NEXT_BLOCK:
                if (context.advanceToNextBlock()) return true;
                sendError(line, "unable to find the end of the block starting here");
                cancel();
                return false;
            case ADVANCE_TO_END_OF_BLOCK:
                if (context.advanceToEndOfBlock()) return true;
                sendError(line, "unable to find the end of an else block after this line");
                cancel();
                return false;
            default:
                cancel();
                return false;
        }
    }

    // ===================== conditionals =====================

    private boolean evaluateCondition(ScriptExpression expression) {
        EvalResult result = evaluator.evaluateBool(expression, context::replaceVars);
        if (!result.groups.isEmpty()) context.setRegexVars(result.groups);
        notify(ScriptDebugLevel.IFS, "if " + result.text + " = " + result.result);
        return result.isTrue();
    }

    private ExecuteResult openBlock(ScriptLine line, boolean taken) {
        line.setIfResult(taken);
        context.ifStack().push(line);
        return taken ? ExecuteResult.NEXT : ExecuteResult.ADVANCE_TO_NEXT_BLOCK;
    }

    private ExecuteResult singleLine(ScriptLine line, boolean taken, ScriptToken body) {
        line.setIfResult(taken);
        if (!taken) {
            context.setLastIf(line);
            return ExecuteResult.NEXT;
        }
        if (!context.skipSingleLineIfElseElses()) {
            sendError(line, "unable to find the end of an else block after this line");
            return ExecuteResult.EXIT;
        }
        return execute(line, body);
    }

    /** Moves onto the {@code {} line that must follow a needs-brace form. */
    private boolean consumeOpeningBrace(ScriptLine line) {
        ScriptLine next = context.peekNextLine();
        if (next == null || next.token() == null || next.token().kind() != Kind.LEFT_BRACE) {
            sendError(line, "expected '{' on the line after this one");
            return false;
        }
        context.advance();
        return true;
    }

    private ExecuteResult handleIf(ScriptLine line, ScriptToken token) {
        return openBlock(line, evaluateCondition(token.expression()));
    }

    private ExecuteResult handleIfNeedsBrace(ScriptLine line, ScriptToken token) {
        if (!consumeOpeningBrace(line)) return ExecuteResult.EXIT;
        return handleIf(line, token);
    }

    private ExecuteResult handleIfSingle(ScriptLine line, ScriptToken token) {
        return singleLine(line, evaluateCondition(token.expression()), token.body());
    }

    private boolean hasArgs(ScriptToken token) {
        boolean result = context.args().size() >= token.argCount();
        notify(ScriptDebugLevel.IFS, "if_" + token.argCount() + " = " + result);
        return result;
    }

    private ExecuteResult handleIfArg(ScriptLine line, ScriptToken token) {
        return openBlock(line, hasArgs(token));
    }

    private ExecuteResult handleIfArgNeedsBrace(ScriptLine line, ScriptToken token) {
        if (!consumeOpeningBrace(line)) return ExecuteResult.EXIT;
        return handleIfArg(line, token);
    }

    private ExecuteResult handleIfArgSingle(ScriptLine line, ScriptToken token) {
        return singleLine(line, hasArgs(token), token.body());
    }

    /**
     * Checks that an else-family line continues a chain whose branches have all been false so far.
     * Returns null when the line should run, otherwise the result to return instead.
     */
    private ExecuteResult enterChain(ScriptLine line, ScriptToken token) {
        if (token.hasLeadingBrace()) {
            ScriptLine closed = context.ifStack().poll();
            if (closed == null) {
                sendError(line, "'}' without a matching '{'");
                return ExecuteResult.EXIT;
            }
            context.setLastIf(closed);
        }

        ScriptLine previous = context.lastIf();
        if (previous == null) {
            sendError(line, "Expected there to be a previous 'if' or 'else if'");
            return ExecuteResult.EXIT;
        }
        context.setLastIf(null);
        if (Boolean.TRUE.equals(previous.ifResult())) {
            // an earlier branch ran: skip this sibling and the rest of the chain
            context.retreat();
            return ExecuteResult.ADVANCE_TO_END_OF_BLOCK;
        }
        return null;
    }

    private ExecuteResult handleElseIf(ScriptLine line, ScriptToken token) {
        ExecuteResult skip = enterChain(line, token);
        if (skip != null) return skip;
        return openBlock(line, evaluateCondition(token.expression()));
    }

    private ExecuteResult handleElseIfNeedsBrace(ScriptLine line, ScriptToken token) {
        ExecuteResult skip = enterChain(line, token);
        if (skip != null) return skip;
        if (!consumeOpeningBrace(line)) return ExecuteResult.EXIT;
        return openBlock(line, evaluateCondition(token.expression()));
    }

    private ExecuteResult handleElseIfSingle(ScriptLine line, ScriptToken token) {
        ExecuteResult skip = enterChain(line, token);
        if (skip != null) return skip;
        return singleLine(line, evaluateCondition(token.expression()), token.body());
    }

    private ExecuteResult handleElse(ScriptLine line, ScriptToken token) {
        ExecuteResult skip = enterChain(line, token);
        if (skip != null) return skip;
        return openBlock(line, true);
    }

    private ExecuteResult handleElseNeedsBrace(ScriptLine line, ScriptToken token) {
        ExecuteResult skip = enterChain(line, token);
        if (skip != null) return skip;
        if (!consumeOpeningBrace(line)) return ExecuteResult.EXIT;
        return openBlock(line, true);
    }

    private ExecuteResult handleElseSingle(ScriptLine line, ScriptToken token) {
        ExecuteResult skip = enterChain(line, token);
        if (skip != null) return skip;
        return singleLine(line, true, token.body());
    }

    private ExecuteResult handleLeftBrace(ScriptLine line, ScriptToken token) {
        line.setIfResult(null);
        context.ifStack().push(line);
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleRightBrace(ScriptLine line, ScriptToken token) {
        ScriptLine closed = context.ifStack().poll();
        if (closed == null) {
            Debug.get().d(TAG, "unmatched '}' at " + line);
            return ExecuteResult.NEXT;
        }
        if (Boolean.TRUE.equals(closed.ifResult())) return ExecuteResult.ADVANCE_TO_END_OF_BLOCK;
        if (Boolean.FALSE.equals(closed.ifResult())) context.setLastIf(closed);
        return ExecuteResult.NEXT;
    }

    // ===================== flow =====================

    private ExecuteResult handleGoto(ScriptLine line, ScriptToken token) {
        return gotoLabel(line, context.replaceVars(token.value(0)), context.replaceVars(token.value(1)));
    }

    private ExecuteResult gotoLabel(ScriptLine line, String labelName, String argumentText) {
        Label target = context.label(labelName);
        if (target == null) {
            if (labelName.equalsIgnoreCase("return")) return returnFromGosub(line);
            sendError(line, "label '" + labelName + "' not found");
            return ExecuteResult.EXIT;
        }
        if (!guardLoop(line)) return ExecuteResult.EXIT;

        notify(ScriptDebugLevel.GOSUBS, "goto " + labelName);
        context.regexVars().removeAll();
        context.setLabelVars(argumentText, ScriptContext.splitArguments(argumentText));
        context.clearConditionals();
        context.setCurrentLineNumber(target.line);
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleGosub(ScriptLine line, ScriptToken token) {
        String labelName = context.replaceVars(token.value(0));
        if (labelName.equalsIgnoreCase("clear")) {
            gosubStack.clear();
            return ExecuteResult.NEXT;
        }
        if (gosubStack.size() >= config.maxGosubDepth()) {
            sendError(line, "gosub depth limit of " + config.maxGosubDepth() + " reached");
            return ExecuteResult.EXIT;
        }
        if (context.label(labelName) == null) {
            sendError(line, "label '" + labelName + "' not found");
            return ExecuteResult.EXIT;
        }

        notify(ScriptDebugLevel.GOSUBS, "gosub " + labelName);
        gosubStack.push(new GosubFrame(labelName, context.currentLineNumber(), context.labelVars().snapshot(),
                context.ifStack(), context.lastIf()));
        return gotoLabel(line, labelName, context.replaceVars(token.value(1)));
    }

    private ExecuteResult returnFromGosub(ScriptLine line) {
        GosubFrame frame = gosubStack.poll();
        if (frame == null) {
            sendError(line, "no gosub to return from");
            return ExecuteResult.EXIT;
        }
        notify(ScriptDebugLevel.GOSUBS, "return from " + frame.label);
        frame.restoreIfResults();
        context.restoreLabelVars(frame.labelVars);
        context.restoreConditionals(frame.ifStack, frame.lastIf);
        context.setCurrentLineNumber(frame.returnLine);
        return ExecuteResult.NEXT;
    }

    private boolean guardLoop(ScriptLine line) {
        long now = System.currentTimeMillis();
        if (now - loopWindowStart > config.loopGuardWindowMillis()) {
            loopWindowStart = now;
            loopJumps = 0;
        }
        if (++loopJumps > config.loopGuardLimit()) {
            sendError(line, "possible infinite loop detected, stopping script");
            return false;
        }
        return true;
    }

    private ExecuteResult handleShift(ScriptLine line, ScriptToken token) {
        context.shiftArgs();
        notify(ScriptDebugLevel.VARS, "shift: " + context.args());
        return ExecuteResult.NEXT;
    }

    // ===================== output =====================

    private ExecuteResult handleEcho(ScriptLine line, ScriptToken token) {
        sink.echo(context.replaceVars(token.text()), OutputSink.ECHO);
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handlePut(ScriptLine line, ScriptToken token) {
        sink.sendCommand(context.replaceVars(token.text()));
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleSend(ScriptLine line, ScriptToken token) {
        sink.sendCommand("#send " + context.replaceVars(token.text()));
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleSave(ScriptLine line, ScriptToken token) {
        context.variables().set("s", context.replaceVars(token.text()));
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleDebug(ScriptLine line, ScriptToken token) {
        Double level = Numbers.parse(context.replaceVars(token.text()));
        debugLevel = ScriptDebugLevel.of(level == null ? 0 : level.intValue());
        notify(ScriptDebugLevel.GOSUBS, "debug level " + debugLevel.ordinal());
        return ExecuteResult.NEXT;
    }

    // ===================== variables =====================

    private ExecuteResult handleVariable(ScriptLine line, ScriptToken token) {
        String name = context.replaceVars(token.value(0));
        String value = context.replaceVars(token.value(1));
        context.variables().set(name, value);
        notify(ScriptDebugLevel.VARS, "var " + name + " " + value);
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleUnvar(ScriptLine line, ScriptToken token) {
        String name = context.replaceVars(token.value(0));
        context.variables().remove(name);
        notify(ScriptDebugLevel.VARS, "unvar " + name);
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleMath(ScriptLine line, ScriptToken token) {
        String name = context.replaceVars(token.value(0));
        String operation = token.value(1);
        Double number = Numbers.parse(context.replaceVars(token.value(2)));
        if (number == null) {
            sendError(line, "math: '" + token.value(2) + "' is not a number");
            return ExecuteResult.NEXT;
        }

        Double existing = Numbers.parse(context.variables().get(name));
        double current = existing == null ? 0 : existing;
        double result;
        switch (operation) {
            case "set":
                result = number;
                break;
            case "add": case "+":
                result = current + number;
                break;
            case "subtract": case "-":
                result = current - number;
                break;
            case "multiply": case "*":
                result = current * number;
                break;
            case "divide": case "/":
                if (number == 0) {
                    sendError(line, "cannot divide by zero!");
                    return ExecuteResult.NEXT;
                }
                result = current / number;
                break;
            case "modulus": case "mod": case "%":
                if (number == 0) {
                    sendError(line, "cannot divide by zero!");
                    return ExecuteResult.NEXT;
                }
                result = current % number;
                break;
            default:
                sendError(line, "unknown math operation '" + operation + "'");
                return ExecuteResult.NEXT;
        }

        String formatted = Numbers.formatRounded(result);
        context.variables().set(name, formatted);
        notify(ScriptDebugLevel.VARS, "math " + name + " = " + formatted);
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleRandom(ScriptLine line, ScriptToken token) {
        Double min = Numbers.parse(context.replaceVars(token.value(0)));
        Double max = Numbers.parse(context.replaceVars(token.value(1)));
        if (min == null || max == null) {
            sendError(line, "random needs a minimum and a maximum number");
            return ExecuteResult.NEXT;
        }
        long lo = (long) Math.min(min, max);
        long hi = (long) Math.max(min, max);
        long value;
        if (lo == hi) value = lo;
        else if (hi == Long.MAX_VALUE) value = ThreadLocalRandom.current().nextLong(lo, hi);
        else value = ThreadLocalRandom.current().nextLong(lo, hi + 1);
        context.variables().set("r", Long.toString(value));
        notify(ScriptDebugLevel.VARS, "random " + value);
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleEval(ScriptLine line, ScriptToken token) {
        return storeEval(token, evaluator.evaluateStrValue(token.expression(), context::replaceVars));
    }

    private ExecuteResult handleEvalMath(ScriptLine line, ScriptToken token) {
        return storeEval(token, evaluator.evaluateValue(token.expression(), context::replaceVars));
    }

    private ExecuteResult storeEval(ScriptToken token, EvalResult result) {
        String name = context.replaceVars(token.value(0));
        if (!result.groups.isEmpty()) context.setRegexVars(result.groups);
        context.variables().set(name, result.result);
        notify(ScriptDebugLevel.VARS, "eval " + name + " = " + result.result);
        return ExecuteResult.NEXT;
    }

    // ===================== waiting =====================

    private ExecuteResult handlePause(ScriptLine line, ScriptToken token) {
        Double seconds = Numbers.parse(context.replaceVars(token.text()));
        double delay = seconds == null ? config.defaultPauseSeconds() : seconds;
        notify(ScriptDebugLevel.WAITS, "pausing for " + Numbers.format(delay) + " seconds");
        schedule(delay, this::afterPause);
        return ExecuteResult.WAIT;
    }

    private void afterPause() {
        Double roundtime = Numbers.parse(context.globals().get(config.roundtimeVariable()));
        if (roundtime != null && roundtime > 0) {
            notify(ScriptDebugLevel.WAITS, "waiting for roundtime " + Numbers.format(roundtime));
            schedule(roundtime, this::next);
            return;
        }
        next();
    }

    private ExecuteResult handleMatch(ScriptLine line, ScriptToken token) {
        boolean regex = token.kind() == Kind.MATCHRE;
        matchStack.add(new MatchEntry(context.replaceVars(token.value(0)), context.replaceVars(token.value(1)), regex));
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleMatchwait(ScriptLine line, ScriptToken token) {
        Double timeout = Numbers.parse(context.replaceVars(token.text()));
        matchwaitArmed = true;
        notify(ScriptDebugLevel.WAITS, "matchwait" + (timeout == null ? "" : " " + Numbers.format(timeout)));
        if (timeout != null && timeout > 0) {
            schedule(timeout, () -> {
                notify(ScriptDebugLevel.WAITS, "matchwait timed out");
                matchwaitArmed = false;
                matchStack.clear();
                next();
            });
        }
        return ExecuteResult.WAIT;
    }

    private ExecuteResult handleWaitfor(ScriptLine line, ScriptToken token) {
        String target = context.replaceVars(token.text());
        pendingWait = token.kind() == Kind.WAITFOR_RE ? PendingWait.regex(target) : PendingWait.text(target);
        notify(ScriptDebugLevel.WAITS, "waiting for " + pendingWait);
        return ExecuteResult.WAIT;
    }

    private ExecuteResult handleWaitforPrompt(ScriptLine line, ScriptToken token) {
        pendingWait = PendingWait.prompt();
        notify(ScriptDebugLevel.WAITS, "waiting for prompt");
        return ExecuteResult.WAIT;
    }

    private ExecuteResult handleWaitEval(ScriptLine line, ScriptToken token) {
        if (evaluator.evaluateBool(token.expression(), context::replaceVars).isTrue()) return ExecuteResult.NEXT;
        pendingWait = PendingWait.eval(token.expression());
        notify(ScriptDebugLevel.WAITS, "waiteval " + token.text());
        return ExecuteResult.WAIT;
    }

    private ExecuteResult handleMove(ScriptLine line, ScriptToken token) {
        sink.sendCommand(context.replaceVars(token.text()));
        pendingWait = PendingWait.room();
        notify(ScriptDebugLevel.WAITS, "move, waiting for the next room");
        return ExecuteResult.WAIT;
    }

    private ExecuteResult handleNextroom(ScriptLine line, ScriptToken token) {
        pendingWait = PendingWait.room();
        notify(ScriptDebugLevel.WAITS, "waiting for the next room");
        return ExecuteResult.WAIT;
    }

    private void schedule(double seconds, Runnable task) {
        final int generation = waitGeneration;
        scheduled = timer.schedule(seconds, () -> {
            synchronized (this) {
                if (state == ScriptState.STOPPED || generation != waitGeneration) return;
                scheduled = null;
                task.run();
            }
        });
    }

    /** Disarms every pending wait so that late events and timers are ignored. */
    private void clearWaits() {
        matchwaitArmed = false;
        matchStack.clear();
        pendingWait = null;
        waitGeneration++;
        if (scheduled != null) {
            scheduled.cancel();
            scheduled = null;
        }
    }

    // ===================== stream events =====================

    @Override
    public synchronized void deliverStreamLine(String text) {
        if (state == ScriptState.STOPPED || state == ScriptState.NOT_STARTED || text == null) return;

        runActions(text);
        if (state == ScriptState.STOPPED) return;

        if (matchwaitArmed) {
            for (MatchEntry entry : new ArrayList<>(matchStack)) {
                List<String> groups = entry.regex
                        ? matcher.matchRegex(text, entry.value)
                        : matcher.matchText(text, entry.value);
                if (groups != null) {
                    resumeWithMatch(entry, groups);
                    return;
                }
            }
        }

        if (pendingWait == null) return;
        switch (pendingWait.kind) {
            case TEXT: {
                List<String> groups = matcher.matchText(text, pendingWait.target);
                if (groups != null) resumeWait(Collections.emptyList());
                break;
            }
            case REGEX: {
                List<String> groups = matcher.matchRegex(text, pendingWait.target);
                if (groups != null) resumeWait(groups);
                break;
            }
            default:
                break;
        }
    }

    @Override
    public synchronized void deliverMatch(List<String> captures) {
        if (state == ScriptState.STOPPED || state == ScriptState.NOT_STARTED) return;
        List<String> groups = captures == null ? Collections.emptyList() : captures;
        if (matchwaitArmed && !matchStack.isEmpty()) {
            resumeWithMatch(matchStack.get(0), groups);
            return;
        }
        if (pendingWait != null
                && (pendingWait.kind == PendingWait.Kind.TEXT || pendingWait.kind == PendingWait.Kind.REGEX)) {
            resumeWait(groups);
        }
    }

    @Override
    public synchronized void deliverPrompt() {
        if (state == ScriptState.STOPPED || state == ScriptState.NOT_STARTED) return;
        runEvalActions();
        if (pendingWait == null || state == ScriptState.STOPPED) return;
        if (pendingWait.kind == PendingWait.Kind.PROMPT) {
            resumeWait(Collections.emptyList());
        } else if (pendingWait.kind == PendingWait.Kind.EVAL) {
            EvalResult result = evaluator.evaluateBool(pendingWait.condition, context::replaceVars);
            if (result.isTrue()) resumeWait(result.groups);
        }
    }

    @Override
    public synchronized void deliverRoomChange() {
        if (state == ScriptState.STOPPED || state == ScriptState.NOT_STARTED) return;
        if (pendingWait != null && pendingWait.kind == PendingWait.Kind.ROOM) {
            resumeWait(Collections.emptyList());
        }
    }

    private void resumeWithMatch(MatchEntry entry, List<String> groups) {
        ScriptLine line = context.currentLine();
        clearWaits();
        notify(ScriptDebugLevel.WAITS, "matched '" + entry.value + "', going to " + entry.label);
        ExecuteResult result = gotoLabel(line, entry.label, "");
        if (entry.regex) context.setRegexVars(groups);
        if (continueAfter(line, result)) next();
    }

    private void resumeWait(List<String> groups) {
        clearWaits();
        if (!groups.isEmpty()) context.setRegexVars(groups);
        next();
    }

    // ===================== actions =====================

    private ExecuteResult handleAction(ScriptLine line, ScriptToken token) {
        actions.add(new ActionTrigger(token.value(0), token.value(1), token.value(2), token.expression()));
        notify(ScriptDebugLevel.ACTIONS, "action added: " + token.value(1) + " when " + token.value(2));
        return ExecuteResult.NEXT;
    }

    private ExecuteResult handleActionToggle(ScriptLine line, ScriptToken token) {
        boolean enabled = token.value(1).equals("on");
        for (ActionTrigger action : actions) {
            if (action.actionClass.equalsIgnoreCase(token.value(0))) action.enabled = enabled;
        }
        notify(ScriptDebugLevel.ACTIONS, "action class " + token.value(0) + " " + token.value(1));
        return ExecuteResult.NEXT;
    }

    private void runActions(String text) {
        for (ActionTrigger action : new ArrayList<>(actions)) {
            if (!action.enabled || action.isEval()) continue;
            List<String> groups = matcher.matchRegex(text, context.replaceVars(action.pattern));
            if (groups != null) runAction(action, groups);
            if (state == ScriptState.STOPPED) return;
        }
    }

    private void runEvalActions() {
        for (ActionTrigger action : new ArrayList<>(actions)) {
            if (!action.enabled || !action.isEval()) continue;
            if (evaluator.evaluateBool(action.condition, context::replaceVars).isTrue()) {
                runAction(action, Collections.emptyList());
            }
            if (state == ScriptState.STOPPED) return;
        }
    }

    /** Runs the {@code ;}-separated commands of a triggered action; a goto or gosub abandons any wait. */
    private void runAction(ActionTrigger action, List<String> groups) {
        context.setActionVars(groups);
        notify(ScriptDebugLevel.ACTIONS, "action triggered: " + action.command);
        ScriptLine current = context.currentLine();
        int lineNumber = current == null ? 0 : current.lineNumber();

        for (String part : action.command.split(";")) {
            String text = context.replaceActionVars(part.trim());
            if (text.isEmpty()) continue;
            ScriptLine actionLine = new ScriptLine(text, context.name(), lineNumber);
            ScriptToken token = actionLine.token();
            if (token == null) {
                sendError(actionLine, "unknown action command '" + text + "'");
                continue;
            }

            if (SUSPENDING.contains(token.kind())) {
                sendError(actionLine, "'" + text + "' cannot wait inside an action");
                continue;
            }
            if (token.kind() == Kind.GOTO || token.kind() == Kind.GOSUB) {
                clearWaits();
                if (continueAfter(actionLine, execute(actionLine, token))) next();
                return;
            }
            if (execute(actionLine, token) == ExecuteResult.EXIT) {
                cancel();
                return;
            }
        }
    }

    // ===================== reporting =====================

    private void sendError(ScriptLine line, String message) {
        String text = prefix(line) + message;
        sink.echo(text, OutputSink.ERROR);
        Debug.get().e(TAG, text);
    }

    private void notify(ScriptDebugLevel level, String message) {
        ScriptLine line = context.currentLine();
        String text = prefix(line) + message;
        Debug.get().d(TAG, text);
        if (debugLevel.compareTo(level) >= 0 && debugLevel != ScriptDebugLevel.NONE) {
            sink.echo(text, OutputSink.INFO);
        }
    }

    private String prefix(ScriptLine line) {
        if (line == null) return "[" + name() + "]: ";
        return "[" + line.fileName() + "(" + line.lineNumber() + ")]: ";
    }
}
