package com.ember.script.parser;

import java.util.function.IntPredicate;

/**
 * Forward-only character cursor over a single line of script text.
 *
 * Every tokenizer in this package is built from these primitives. The cursor never rewinds:
 * once characters are consumed they belong to the token under construction.
 */
public final class TextCursor {
    private final String source;
    private int current = 0;

    public TextCursor(String source) {
        this.source = source == null ? "" : source;
    }

    public boolean isAtEnd() { return current >= source.length(); }

    /** Next character without consuming it, or {@code '\0'} at the end. */
    public char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    public char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    public char advance() { return source.charAt(current++); }

    public int position() { return current; }

    public String consumeWhile(IntPredicate predicate) {
        int start = current;
        while (!isAtEnd() && predicate.test(source.charAt(current))) current++;
        return source.substring(start, current);
    }

    /** Consumes {@code expected} if it is the next character. */
    public boolean consumeExpecting(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    public void consumeSpaces() {
        consumeWhile(Character::isWhitespace);
    }

    /** Word up to the next whitespace; leading whitespace is skipped. */
    public String parseWord() {
        consumeSpaces();
        return consumeWhile(c -> !Character.isWhitespace(c));
    }

    public String parseToEnd() {
        String rest = source.substring(Math.min(current, source.length()));
        current = source.length();
        return rest;
    }

    /** Run of characters matching {@code predicate}, without consuming it. */
    public String peekWhile(IntPredicate predicate) {
        int end = current;
        while (end < source.length() && predicate.test(source.charAt(end))) end++;
        return source.substring(current, end);
    }

    /** True if the unconsumed text starts with {@code word} (case-insensitive) not followed by a word character. */
    public boolean startsWithWord(String word) {
        int end = current + word.length();
        if (end > source.length()) return false;
        if (!source.regionMatches(true, current, word, 0, word.length())) return false;
        return end == source.length() || !isWordChar(source.charAt(end));
    }

    /** Consumes {@code word} when {@link #startsWithWord(String)} holds. */
    public boolean consumeWord(String word) {
        if (!startsWithWord(word)) return false;
        current += word.length();
        return true;
    }

    public String remaining() {
        return source.substring(Math.min(current, source.length()));
    }

    public String source() { return source; }

    public static boolean isWordChar(int c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
