package com.ember.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text after a condition keyword into the condition itself and whatever follows it.
 *
 * The condition ends at the first {@code '{'} outside quotes or at the word {@code then}.
 * Inside the condition, {@code name(args...)} becomes a {@link ScriptExpression.Function}; everything
 * else is kept as text.
 */
public final class ExpressionTokenizer {

    public static final class Result {
        public final ScriptExpression expression;
        /** Unconsumed text after the condition, {@code then} removed and leading spaces trimmed. */
        public final String rest;
        public final boolean hadThen;

        Result(ScriptExpression expression, String rest, boolean hadThen) {
            this.expression = expression;
            this.rest = rest;
            this.hadThen = hadThen;
        }
    }

    public Result tokenize(String text) {
        TextCursor cursor = new TextCursor(text);
        int conditionEnd = -1;
        boolean hadThen = false;
        String rest = "";

        while (true) {
            cursor.consumeSpaces();
            if (cursor.isAtEnd()) break;
            if (cursor.peek() == '{') {
                conditionEnd = cursor.position();
                rest = cursor.parseToEnd();
                break;
            }
            int wordStart = cursor.position();
            String word = readWord(cursor, true);
            if (word.equalsIgnoreCase("then")) {
                conditionEnd = wordStart;
                hadThen = true;
                cursor.consumeSpaces();
                rest = cursor.parseToEnd();
                break;
            }
        }

        String source = cursor.source();
        String condition = (conditionEnd < 0 ? source : source.substring(0, conditionEnd)).trim();
        return new Result(parseCondition(condition), rest.trim(), hadThen);
    }

    // ===================== condition fragments =====================

    private ScriptExpression parseCondition(String condition) {
        List<ScriptExpression> parts = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        String previousWord = null;
        TextCursor cursor = new TextCursor(condition);

        while (true) {
            cursor.consumeSpaces();
            if (cursor.isAtEnd()) break;

            String word;
            if (Character.isLetter(cursor.peek())) {
                String name = cursor.consumeWhile(c -> Character.isLetterOrDigit(c) || c == '_');
                if (cursor.consumeExpecting('(')) {
                    flush(pending, parts);
                    previousWord = null;
                    parts.add(ScriptExpression.function(name.toLowerCase(), readArguments(cursor)));
                    continue;
                }
                word = name + readWord(cursor, false);
            } else {
                word = readWord(cursor, false);
            }

            if (pending.length() > 0 && !(isOperator(previousWord) && word.startsWith("="))) {
                pending.append(' ');
            }
            pending.append(word);
            previousWord = word;
        }
        flush(pending, parts);

        if (parts.isEmpty()) return ScriptExpression.value("");
        if (parts.size() == 1) return parts.get(0);
        return ScriptExpression.sequence(parts);
    }

    private static List<String> readArguments(TextCursor cursor) {
        List<String> args = new ArrayList<>();
        StringBuilder arg = new StringBuilder();
        int depth = 1;
        boolean inQuote = false;

        while (!cursor.isAtEnd()) {
            char c = cursor.advance();
            if (inQuote) {
                arg.append(c);
                if (c == '\\' && !cursor.isAtEnd()) arg.append(cursor.advance());
                else if (c == '"') inQuote = false;
                continue;
            }
            if (c == '"') {
                inQuote = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth == 0) break;
            } else if (c == ',' && depth == 1) {
                args.add(arg.toString().trim());
                arg.setLength(0);
                continue;
            }
            arg.append(c);
        }

        String last = arg.toString().trim();
        if (!last.isEmpty() || !args.isEmpty()) args.add(last);
        return args;
    }

    /** Reads up to whitespace (and {@code '{'} when {@code stopAtBrace}) outside double quotes. */
    private static String readWord(TextCursor cursor, boolean stopAtBrace) {
        StringBuilder word = new StringBuilder();
        boolean inQuote = false;
        while (!cursor.isAtEnd()) {
            char c = cursor.peek();
            if (!inQuote && (Character.isWhitespace(c) || (stopAtBrace && c == '{'))) break;
            cursor.advance();
            word.append(c);
            if (inQuote && c == '\\' && !cursor.isAtEnd()) {
                word.append(cursor.advance());
            } else if (c == '"') {
                inQuote = !inQuote;
            }
        }
        return word.toString();
    }

    private static boolean isOperator(String word) {
        if (word == null || word.isEmpty()) return false;
        for (int i = 0; i < word.length(); i++) {
            if ("!=<>".indexOf(word.charAt(i)) < 0) return false;
        }
        return true;
    }

    private static void flush(StringBuilder pending, List<ScriptExpression> parts) {
        if (pending.length() == 0) return;
        parts.add(ScriptExpression.value(pending.toString()));
        pending.setLength(0);
    }
}
