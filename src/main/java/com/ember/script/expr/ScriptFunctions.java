package com.ember.script.expr;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Named {@link ScriptFunction}s; names are case-insensitive. */
public final class ScriptFunctions {
    private final Map<String, ScriptFunction> functions = new ConcurrentHashMap<>();

    public void register(String name, ScriptFunction fn) {
        functions.put(name.toLowerCase(Locale.ROOT), fn);
    }

    public boolean has(String name) {
        return functions.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public ExpressionResult call(String name, List<String> args) throws ExpressionException {
        ScriptFunction fn = functions.get(name.toLowerCase(Locale.ROOT));
        if (fn == null) throw new ExpressionException("Unknown function: " + name);
        return fn.call(args);
    }
}
