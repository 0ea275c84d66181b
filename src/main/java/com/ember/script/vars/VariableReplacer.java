package com.ember.script.vars;

import java.util.List;

import com.ember.debug.Debug;

/**
 * Substitutes sigil-prefixed variables ({@code $name}, {@code %name}, {@code &name}) in script text.
 *
 * Substitution repeats until nothing changes, at most {@value #MAX_ITERATIONS} times, so values may
 * reference other variables. A name that does not resolve is shortened from the right until a prefix does;
 * the dropped characters are kept after the substituted value ({@code $weapon.skill}).
 */
public final class VariableReplacer {
    private static final String TAG = "VariableReplacer";

    public static final int MAX_ITERATIONS = 15;

    private final IndexedVariableReader indexedReader = new IndexedVariableReader();

    public String replace(String input, VariableContext context) {
        if (input == null) return "";
        if (!context.containsSigil(input)) return input;

        StringBuilder out = new StringBuilder();
        for (IndexedVariableReader.Segment segment : indexedReader.read(input)) {
            out.append(segment.isIndexed() ? resolveIndexed(segment, context) : substitute(segment.text, context));
        }
        return out.toString();
    }

    private String substitute(String text, VariableContext context) {
        String result = text;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            String last = result;
            for (char sigil : context.sigils()) {
                if (result.indexOf(sigil) >= 0) {
                    result = simplify(sigil, result, context);
                }
            }
            if (result.equals(last) || !context.containsSigil(result)) return result;
        }
        Debug.get().d(TAG, "iteration limit reached for '" + text + "'");
        return result;
    }

    private String resolveIndexed(IndexedVariableReader.Segment segment, VariableContext context) {
        String index = replace(segment.index, context).trim();
        String base = substitute(segment.name, context);

        int position;
        try {
            position = Integer.parseInt(index);
        } catch (NumberFormatException e) {
            return base + "[" + index + "]";
        }

        if (base.equals(segment.name)) return segment.text;
        List<String> items = splitList(base);
        if (position < 0 || position >= items.size()) return segment.text;
        return items.get(position);
    }

    private static String simplify(char sigil, String text, VariableContext context) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != sigil) {
                out.append(c);
                i++;
                continue;
            }

            int end = i + 1;
            while (end < text.length() && isNameChar(text.charAt(end))) end++;
            String candidate = text.substring(i + 1, end);

            String value = null;
            int keep = candidate.length();
            while (keep > 0) {
                value = context.lookup(sigil, candidate.substring(0, keep));
                if (value != null) break;
                keep--;
            }

            if (value == null) {
                out.append(sigil).append(candidate);
            } else {
                out.append(value).append(candidate, keep, candidate.length());
            }
            i = Math.max(end, i + 1);
        }
        return out.toString();
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-';
    }

    /** Splits a {@code |}-delimited list value. */
    public static List<String> splitList(String value) {
        return List.of(value.split("\\|", -1));
    }
}
