package com.ember.script.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import com.ember.debug.Debug;
import com.ember.script.parser.ScriptExpression;

/**
 * Evaluates {@link ScriptExpression}s for the runtime.
 *
 * Variables are substituted through the caller's replacer, script functions are called directly and the
 * remaining text goes to the {@link ExpressionHost}. Evaluation never throws: any failure is logged and
 * becomes {@code false}, {@code "0"} or {@code ""}.
 */
public final class ScriptEvaluator {
    private static final String TAG = "ScriptEvaluator";

    private final ExpressionHost host;
    private final ScriptFunctions functions;

    public ScriptEvaluator(ExpressionHost host, ScriptFunctions functions) {
        this.host = host;
        this.functions = functions;
    }

    public EvalResult evaluateBool(ScriptExpression expression, UnaryOperator<String> replacer) {
        Rendered rendered = new Rendered();
        try {
            if (expression instanceof ScriptExpression.Function) {
                ExpressionResult r = call((ScriptExpression.Function) expression, replacer, rendered);
                return new EvalResult(rendered.text, bool(Boolean.TRUE.equals(Numbers.toBool(r.asText()))), r.groups());
            }

            String text = render(expression, replacer, rendered);
            if (text.trim().isEmpty()) return new EvalResult(text, "false", rendered.groups);

            Boolean literal = Numbers.toBool(text);
            if (literal != null) return new EvalResult(text, bool(literal), rendered.groups);

            ExpressionResult r = host.evaluate(text);
            boolean value = r.isBoolean() ? (Boolean) r.value() : Boolean.TRUE.equals(Numbers.toBool(r.asText()));
            return new EvalResult(text, bool(value), groupsOf(r, rendered));
        } catch (ExpressionException | RuntimeException e) {
            Debug.get().w(TAG, "condition failed: " + e.getMessage());
            return new EvalResult(rendered.text, "false", rendered.groups);
        }
    }

    /** Numeric result, {@code "0"} when the expression is not numeric. */
    public EvalResult evaluateValue(ScriptExpression expression, UnaryOperator<String> replacer) {
        Rendered rendered = new Rendered();
        try {
            if (expression instanceof ScriptExpression.Function) {
                ExpressionResult r = call((ScriptExpression.Function) expression, replacer, rendered);
                return new EvalResult(rendered.text, r.asText(), r.groups());
            }

            String text = render(expression, replacer, rendered);
            if (text.trim().isEmpty()) return new EvalResult(text, "0", rendered.groups);

            ExpressionResult r = host.evaluate(text);
            return new EvalResult(text, r.isNumber() ? r.asText() : "0", groupsOf(r, rendered));
        } catch (ExpressionException | RuntimeException e) {
            Debug.get().w(TAG, "value failed: " + e.getMessage());
            return new EvalResult(rendered.text, "0", rendered.groups);
        }
    }

    public EvalResult evaluateStrValue(ScriptExpression expression, UnaryOperator<String> replacer) {
        Rendered rendered = new Rendered();
        try {
            if (expression instanceof ScriptExpression.Function) {
                ExpressionResult r = call((ScriptExpression.Function) expression, replacer, rendered);
                return new EvalResult(rendered.text, r.asText(), r.groups());
            }

            String text = render(expression, replacer, rendered);
            if (text.trim().isEmpty()) return new EvalResult(text, "", rendered.groups);

            ExpressionResult r = host.evaluate(text);
            return new EvalResult(text, r.asText(), groupsOf(r, rendered));
        } catch (ExpressionException | RuntimeException e) {
            Debug.get().w(TAG, "eval failed: " + e.getMessage());
            return new EvalResult(rendered.text, "", rendered.groups);
        }
    }

    // -------------------------
    // Rendering
    // -------------------------

    /** Text and groups collected while flattening an expression. */
    private static final class Rendered {
        String text = "";
        List<String> groups = new ArrayList<>();
    }

    private String render(ScriptExpression expression, UnaryOperator<String> replacer, Rendered rendered)
            throws ExpressionException {
        String text;
        if (expression instanceof ScriptExpression.Value) {
            text = replacer.apply(((ScriptExpression.Value) expression).text);
        } else if (expression instanceof ScriptExpression.Function) {
            text = call((ScriptExpression.Function) expression, replacer, rendered).asText();
        } else {
            List<String> parts = new ArrayList<>();
            for (ScriptExpression part : ((ScriptExpression.Sequence) expression).parts) {
                parts.add(render(part, replacer, rendered));
            }
            text = String.join(" ", parts);
        }
        rendered.text = text;
        return text;
    }

    private ExpressionResult call(ScriptExpression.Function fn, UnaryOperator<String> replacer, Rendered rendered)
            throws ExpressionException {
        List<String> args = new ArrayList<>();
        for (String arg : fn.args) {
            args.add(unquote(replacer.apply(arg)));
        }
        rendered.text = fn.name + "(" + String.join(", ", args) + ")";
        ExpressionResult result = functions.call(fn.name, args);
        if (!result.groups().isEmpty()) rendered.groups = result.groups();
        return result;
    }

    private static List<String> groupsOf(ExpressionResult result, Rendered rendered) {
        return result.groups().isEmpty() ? rendered.groups : result.groups();
    }

    private static String bool(boolean value) {
        return value ? "true" : "false";
    }

    static String unquote(String arg) {
        String t = arg.trim();
        if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
            return t.substring(1, t.length() - 1).replace("\\\"", "\"");
        }
        return t;
    }
}
