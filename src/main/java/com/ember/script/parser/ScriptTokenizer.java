package com.ember.script.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.ember.script.parser.ScriptToken.Kind;

/**
 * Turns one line of script source into one {@link ScriptToken}.
 *
 * The first word selects a {@link ReaderMode}; the mode reads the rest of the line. Multi-line structure
 * (blocks, else chains) is left to the runtime.
 */
public final class ScriptTokenizer {

    private static final Map<String, ReaderMode> commands;
    static {
        Map<String, ReaderMode> map = new HashMap<>();
        map.put("action", ReaderMode.ACTION);
        map.put("debug", ReaderMode.DEBUG);
        map.put("echo", ReaderMode.ECHO);
        map.put("eval", ReaderMode.EVAL);
        map.put("evalmath", ReaderMode.EVAL_MATH);
        map.put("exit", ReaderMode.EXIT);
        map.put("gosub", ReaderMode.GOSUB);
        map.put("goto", ReaderMode.GOTO);
        map.put("match", ReaderMode.MATCH);
        map.put("matchre", ReaderMode.MATCHRE);
        map.put("matchwait", ReaderMode.MATCHWAIT);
        map.put("math", ReaderMode.MATH);
        map.put("move", ReaderMode.MOVE);
        map.put("nextroom", ReaderMode.NEXTROOM);
        map.put("pause", ReaderMode.PAUSE);
        map.put("put", ReaderMode.PUT);
        map.put("random", ReaderMode.RANDOM);
        map.put("return", ReaderMode.RETURN);
        map.put("save", ReaderMode.SAVE);
        map.put("send", ReaderMode.SEND);
        map.put("setvariable", ReaderMode.VARIABLE);
        map.put("shift", ReaderMode.SHIFT);
        map.put("unvar", ReaderMode.UNVAR);
        map.put("var", ReaderMode.VARIABLE);
        map.put("wait", ReaderMode.WAIT);
        map.put("waiteval", ReaderMode.WAIT_EVAL);
        map.put("waitfor", ReaderMode.WAITFOR);
        map.put("waitforre", ReaderMode.WAITFOR_RE);
        commands = Collections.unmodifiableMap(map);
    }

    private final ExpressionTokenizer expressions = new ExpressionTokenizer();

    /** Token for {@code line}, or null for blank lines and unknown commands. */
    public ScriptToken read(String line) {
        if (line == null) return null;
        TextCursor cursor = new TextCursor(line.trim());
        if (cursor.isAtEnd()) return null;
        ReaderMode.ReaderState state = new ReaderMode.ReaderState(this, expressions, cursor);

        char first = cursor.peek();
        if (first == '#') {
            return ScriptToken.of(Kind.COMMENT, cursor.parseToEnd());
        }
        if (first == '{') {
            cursor.advance();
            return cursor.remaining().trim().isEmpty() ? ScriptToken.of(Kind.LEFT_BRACE) : null;
        }
        if (first == '}') {
            cursor.advance();
            cursor.consumeSpaces();
            if (cursor.isAtEnd()) return ScriptToken.of(Kind.RIGHT_BRACE);
            String word = cursor.consumeWhile(TextCursor::isWordChar).toLowerCase();
            if (!word.equals("else") && !word.equals("elseif")) return null;
            state.elseIf = word.equals("elseif");
            ScriptToken token = ReaderMode.ELSE.read(state);
            return token == null ? null : token.afterClosingBrace();
        }

        String word = cursor.consumeWhile(ScriptTokenizer::isLabelChar);
        if (word.isEmpty()) return null;
        if (cursor.consumeExpecting(':')) {
            return ScriptToken.of(Kind.LABEL, word);
        }

        String keyword = word.toLowerCase();
        if (isIfArgKeyword(keyword)) {
            state.argCount = Integer.parseInt(keyword.substring(3));
            return ReaderMode.IF_ARG.read(state);
        }
        if (keyword.equals("if")) {
            return ReaderMode.IF.read(state);
        }
        if (keyword.equals("else") || keyword.equals("elseif")) {
            state.elseIf = keyword.equals("elseif");
            return ReaderMode.ELSE.read(state);
        }

        ReaderMode mode = commands.get(keyword);
        if (mode == null) return null;
        if (!cursor.isAtEnd() && !Character.isWhitespace(cursor.peek())) return null;
        cursor.consumeSpaces();
        return mode.read(state);
    }

    static boolean isIfArgKeyword(String word) {
        if (word.length() < 4 || word.length() > 8 || !word.startsWith("if_")) return false;
        for (int i = 3; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) return false;
        }
        return true;
    }

    private static boolean isLabelChar(int c) {
        return TextCursor.isWordChar(c) || c == '.' || c == '-';
    }
}
