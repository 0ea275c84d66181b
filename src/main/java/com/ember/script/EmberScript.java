package com.ember.script;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.ember.debug.Debug;
import com.ember.script.expr.DefaultExpressionHost;
import com.ember.script.expr.ExpressionHost;
import com.ember.script.expr.ScriptEvaluator;
import com.ember.script.expr.ScriptFunction;
import com.ember.script.expr.ScriptFunctions;
import com.ember.script.plugins.StringFunctionsPlugin;
import com.ember.script.runtime.ExecutorScriptTimer;
import com.ember.script.runtime.OutputSink;
import com.ember.script.runtime.RegexStreamMatcher;
import com.ember.script.runtime.ScriptContext;
import com.ember.script.runtime.ScriptHandle;
import com.ember.script.runtime.ScriptRuntime;
import com.ember.script.runtime.ScriptTimer;
import com.ember.script.runtime.StreamMatcher;
import com.ember.script.vars.GlobalVariables;

/**
 * EmberScript engine.
 *
 * - Loads scripts (with includes) from a {@link TextSource} and runs any number of them side by side
 * - Each script owns its program counter, if-stack and local scopes; only {@link #globals()} is shared
 * - Stream events ({@link #deliverStreamLine}, {@link #deliverPrompt}, {@link #deliverRoomChange}) are
 *   broadcast to every running script
 * - Script functions: the string plugin is registered up front, hosts add more with {@link #registerFunction}
 */
public class EmberScript implements AutoCloseable {
    private static final String TAG = "EmberScript";

    private final TextSource source;
    private final OutputSink sink;
    private final EngineConfig config;
    private final GlobalVariables globals;
    private final ScriptFunctions functions = new ScriptFunctions();
    private final List<ScriptRuntime> running = new CopyOnWriteArrayList<>();

    private ExpressionHost host;
    private StreamMatcher matcher = new RegexStreamMatcher();
    private ScriptTimer timer;
    private ExecutorScriptTimer ownedTimer;

    public EmberScript(TextSource source, OutputSink sink) {
        this(source, sink, EngineConfig.defaults());
    }

    public EmberScript(TextSource source, OutputSink sink, EngineConfig config) {
        if (source == null) throw new IllegalArgumentException("source is null");
        if (sink == null) throw new IllegalArgumentException("sink is null");
        this.source = source;
        this.sink = sink;
        this.config = config == null ? EngineConfig.defaults() : config;
        this.globals = new GlobalVariables(this.config.dateFormat(), this.config.timeFormat(),
                this.config.datetimeFormat(), Clock.systemDefaultZone());
        this.host = new DefaultExpressionHost(functions);
        StringFunctionsPlugin.register(functions);
    }

    public EngineConfig config() { return config; }

    /** Variables shared by all scripts ({@code $name}). */
    public GlobalVariables globals() { return globals; }

    public ScriptFunctions functions() { return functions; }

    public void registerFunction(String name, ScriptFunction fn) { functions.register(name, fn); }

    public void setExpressionHost(ExpressionHost host) {
        this.host = host == null ? new DefaultExpressionHost(functions) : host;
    }

    public void setStreamMatcher(StreamMatcher matcher) {
        this.matcher = matcher == null ? new RegexStreamMatcher() : matcher;
    }

    /** Timer used for pause and matchwait timeouts; defaults to a shared daemon scheduler. */
    public synchronized void setTimer(ScriptTimer timer) {
        this.timer = timer;
    }

    private synchronized ScriptTimer timer() {
        if (timer != null) return timer;
        if (ownedTimer == null) ownedTimer = new ExecutorScriptTimer();
        return ownedTimer;
    }

    // ===================== RUNNING =====================

    /**
     * Loads {@code name} and starts it with {@code args}. The script runs until its first wait before this
     * returns.
     *
     * @throws ScriptNotFoundException when the script does not exist
     * @throws UncheckedIOException when the script cannot be read
     */
    public ScriptHandle loadAndRun(String name, List<String> args) {
        if (name == null) throw new IllegalArgumentException("name is null");

        ScriptLoader.LoadedScript loaded;
        try {
            loaded = new ScriptLoader(source, sink, config.scriptExtension()).load(name);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read script '" + name + "'", e);
        }

        ScriptContext context = new ScriptContext(loaded.name, loaded.lines, loaded.labels, globals);
        context.variables().set("scriptname", loaded.name);

        ScriptRuntime runtime = new ScriptRuntime(context, new ScriptEvaluator(host, functions), matcher, sink,
                timer(), config);
        runtime.setOnStopped(running::remove);
        running.add(runtime);
        Debug.get().d(TAG, "running '" + loaded.name + "' (" + running.size() + " active)");
        runtime.start(args == null ? Collections.emptyList() : args);
        return runtime;
    }

    /** Scripts that have not stopped yet, in start order. */
    public List<ScriptHandle> running() {
        return Collections.unmodifiableList(new ArrayList<>(running));
    }

    /** First running script called {@code name}, or null. */
    public ScriptHandle find(String name) {
        for (ScriptRuntime runtime : running) {
            if (runtime.name().equalsIgnoreCase(name)) return runtime;
        }
        return null;
    }

    public void deliverStreamLine(String text) {
        for (ScriptRuntime runtime : running) runtime.deliverStreamLine(text);
    }

    public void deliverPrompt() {
        for (ScriptRuntime runtime : running) runtime.deliverPrompt();
    }

    public void deliverRoomChange() {
        for (ScriptRuntime runtime : running) runtime.deliverRoomChange();
    }

    public void cancelAll() {
        for (ScriptRuntime runtime : running) runtime.cancel();
    }

    @Override
    public synchronized void close() {
        cancelAll();
        if (ownedTimer != null) {
            ownedTimer.close();
            ownedTimer = null;
        }
    }
}
