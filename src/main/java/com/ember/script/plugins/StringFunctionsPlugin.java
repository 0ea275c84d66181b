package com.ember.script.plugins;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.ember.script.expr.ExpressionException;
import com.ember.script.expr.ExpressionResult;
import com.ember.script.expr.ScriptFunctions;

/**
 * StringFunctionsPlugin
 *
 * Text helpers available inside script conditions and eval expressions.
 *
 * Usage:
 *   StringFunctionsPlugin.register(functions);
 *
 * Then in scripts:
 *   if contains("$righthand", "sword") then put wield sword
 *   if matchre("$roomobjs", "a (\w+) wolf") then echo $1
 *   eval dir replacere("%dir", "^go ", "")
 */
public final class StringFunctionsPlugin {

    private StringFunctionsPlugin() {}

    public static void register(ScriptFunctions functions) {

        functions.register("contains", args -> {
            requireArgs("contains", args, 2);
            return ExpressionResult.of(args.get(0).contains(args.get(1)));
        });

        functions.register("count", args -> {
            requireArgs("count", args, 2);
            String text = args.get(0);
            String needle = args.get(1);
            if (needle.isEmpty()) return ExpressionResult.of(0.0);
            int count = 0;
            for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) count++;
            return ExpressionResult.of((double) count);
        });

        functions.register("countsplit", args -> {
            requireArgs("countsplit", args, 2);
            if (args.get(1).isEmpty()) return ExpressionResult.of(1.0);
            return ExpressionResult.of((double) args.get(0).split(Pattern.quote(args.get(1)), -1).length);
        });

        functions.register("endswith", args -> {
            requireArgs("endswith", args, 2);
            return ExpressionResult.of(args.get(0).endsWith(args.get(1)));
        });

        functions.register("startswith", args -> {
            requireArgs("startswith", args, 2);
            return ExpressionResult.of(args.get(0).startsWith(args.get(1)));
        });

        functions.register("indexof", args -> {
            requireArgs("indexof", args, 2);
            return ExpressionResult.of((double) args.get(0).indexOf(args.get(1)));
        });

        functions.register("len", args -> {
            requireArgs("len", args, 1);
            return ExpressionResult.of((double) args.get(0).length());
        });

        functions.register("length", args -> {
            requireArgs("length", args, 1);
            return ExpressionResult.of((double) args.get(0).length());
        });

        functions.register("tolower", args -> {
            requireArgs("tolower", args, 1);
            return ExpressionResult.of(args.get(0).toLowerCase(Locale.ROOT));
        });

        functions.register("toupper", args -> {
            requireArgs("toupper", args, 1);
            return ExpressionResult.of(args.get(0).toUpperCase(Locale.ROOT));
        });

        functions.register("tocaps", args -> {
            requireArgs("tocaps", args, 1);
            return ExpressionResult.of(args.get(0).toUpperCase(Locale.ROOT));
        });

        functions.register("trim", args -> {
            requireArgs("trim", args, 1);
            return ExpressionResult.of(args.get(0).trim());
        });

        functions.register("replace", args -> {
            requireArgs("replace", args, 3);
            return ExpressionResult.of(args.get(0).replace(args.get(1), args.get(2)));
        });

        functions.register("replacere", args -> {
            requireArgs("replacere", args, 3);
            return ExpressionResult.of(pattern(args.get(1)).matcher(args.get(0)).replaceAll(args.get(2)));
        });

        functions.register("substring", args -> {
            if (args.size() != 2 && args.size() != 3) {
                throw new ExpressionException("substring() expects 2 or 3 arguments, got " + args.size());
            }
            String text = args.get(0);
            int start = clamp(integer(args, 1), text.length());
            int end = args.size() == 3 ? clamp(integer(args, 2), text.length()) : text.length();
            return ExpressionResult.of(end <= start ? "" : text.substring(start, end));
        });

        functions.register("matchre", args -> {
            requireArgs("matchre", args, 2);
            Matcher m = pattern(args.get(1)).matcher(args.get(0));
            if (!m.find()) return ExpressionResult.of(false);
            List<String> groups = new ArrayList<>();
            for (int i = 0; i <= m.groupCount(); i++) {
                String group = m.group(i);
                groups.add(group == null ? "" : group);
            }
            return ExpressionResult.withGroups(true, groups);
        });
    }

    private static void requireArgs(String fn, List<String> args, int n) throws ExpressionException {
        if (args.size() != n) {
            throw new ExpressionException(fn + "() expects " + n + " arguments, got " + args.size());
        }
    }

    private static int integer(List<String> args, int idx) throws ExpressionException {
        try {
            return (int) Double.parseDouble(args.get(idx).trim());
        } catch (NumberFormatException e) {
            throw new ExpressionException("Argument " + idx + " must be a number", e);
        }
    }

    private static int clamp(int value, int length) {
        return Math.max(0, Math.min(length, value));
    }

    private static Pattern pattern(String regex) throws ExpressionException {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ExpressionException("Invalid regex: " + regex, e);
        }
    }
}
