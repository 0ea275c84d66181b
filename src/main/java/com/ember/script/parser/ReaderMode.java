package com.ember.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.ember.script.parser.ScriptToken.Kind;

/**
 * Line reader modes. {@link ScriptTokenizer} picks one from the first word of a line; the mode consumes the
 * remainder and yields exactly one token (or null when the remainder is malformed).
 */
enum ReaderMode {

    /** Plain commands: the remainder of the line is the payload. */
    DEBUG(Kind.DEBUG),
    ECHO(Kind.ECHO),
    MATCHWAIT(Kind.MATCHWAIT),
    MOVE(Kind.MOVE),
    PAUSE(Kind.PAUSE),
    PUT(Kind.PUT),
    SAVE(Kind.SAVE),
    SEND(Kind.SEND),
    WAIT(Kind.WAITFOR_PROMPT),
    WAITFOR(Kind.WAITFOR),
    WAITFOR_RE(Kind.WAITFOR_RE),

    /** Commands that take no payload. */
    EXIT(Kind.EXIT) {
        @Override ScriptToken read(ReaderState state) { return ScriptToken.of(kind); }
    },
    NEXTROOM(Kind.NEXTROOM) {
        @Override ScriptToken read(ReaderState state) { return ScriptToken.of(kind); }
    },
    RETURN(Kind.RETURN) {
        @Override ScriptToken read(ReaderState state) { return ScriptToken.of(kind); }
    },
    SHIFT(Kind.SHIFT) {
        @Override ScriptToken read(ReaderState state) { return ScriptToken.of(kind); }
    },

    /** {@code <word> <rest>} commands. */
    GOSUB(Kind.GOSUB) {
        @Override ScriptToken read(ReaderState state) { return wordAndRest(state, kind); }
    },
    GOTO(Kind.GOTO) {
        @Override ScriptToken read(ReaderState state) { return wordAndRest(state, kind); }
    },
    MATCH(Kind.MATCH) {
        @Override ScriptToken read(ReaderState state) { return wordAndRest(state, kind); }
    },
    MATCHRE(Kind.MATCHRE) {
        @Override ScriptToken read(ReaderState state) { return wordAndRest(state, kind); }
    },
    VARIABLE(Kind.VARIABLE) {
        @Override ScriptToken read(ReaderState state) { return wordAndRest(state, kind); }
    },

    UNVAR(Kind.UNVAR) {
        @Override ScriptToken read(ReaderState state) {
            String name = state.cursor.parseWord();
            return name.isEmpty() ? null : ScriptToken.of(kind, name);
        }
    },
    MATH(Kind.MATH) {
        @Override ScriptToken read(ReaderState state) {
            String variable = state.cursor.parseWord();
            String operation = state.cursor.parseWord();
            String number = state.cursor.parseToEnd().trim();
            if (variable.isEmpty() || operation.isEmpty()) return null;
            return ScriptToken.of(kind, variable, operation.toLowerCase(), number);
        }
    },
    RANDOM(Kind.RANDOM) {
        @Override ScriptToken read(ReaderState state) {
            String min = state.cursor.parseWord();
            String max = state.cursor.parseWord();
            return ScriptToken.of(kind, min, max);
        }
    },
    EVAL(Kind.EVAL) {
        @Override ScriptToken read(ReaderState state) { return evalToken(state, kind); }
    },
    EVAL_MATH(Kind.EVAL_MATH) {
        @Override ScriptToken read(ReaderState state) { return evalToken(state, kind); }
    },
    WAIT_EVAL(Kind.WAIT_EVAL) {
        @Override ScriptToken read(ReaderState state) {
            String raw = state.cursor.remaining().trim();
            if (raw.isEmpty()) return null;
            return ScriptToken.withExpression(kind, state.expressions.tokenize(state.cursor.parseToEnd()).expression, raw);
        }
    },

    ACTION(Kind.ACTION) {
        @Override ScriptToken read(ReaderState state) {
            TextCursor cursor = state.cursor;
            cursor.consumeSpaces();
            String actionClass = "";
            if (cursor.consumeExpecting('(')) {
                actionClass = cursor.consumeWhile(c -> c != ')').trim();
                if (!cursor.consumeExpecting(')')) return null;
                cursor.consumeSpaces();
                String toggle = cursor.remaining().trim();
                if (!actionClass.isEmpty() && (toggle.equalsIgnoreCase("on") || toggle.equalsIgnoreCase("off"))) {
                    return ScriptToken.of(Kind.ACTION_TOGGLE, actionClass, toggle.toLowerCase());
                }
            }

            List<String> words = new ArrayList<>();
            boolean sawWhen = false;
            while (!cursor.isAtEnd()) {
                String word = cursor.parseWord();
                if (word.isEmpty()) break;
                if (word.equalsIgnoreCase("when")) {
                    sawWhen = true;
                    break;
                }
                words.add(word);
            }
            String command = String.join(" ", words);
            cursor.consumeSpaces();
            String trigger = cursor.parseToEnd().trim();
            if (!sawWhen || command.isEmpty() || trigger.isEmpty()) return null;

            TextCursor triggerCursor = new TextCursor(trigger);
            if (triggerCursor.consumeWord("eval")) {
                ScriptExpression condition = state.expressions.tokenize(triggerCursor.parseToEnd()).expression;
                return ScriptToken.withExpression(kind, condition, actionClass, command, trigger);
            }
            return ScriptToken.of(kind, actionClass, command, trigger);
        }
    },

    // ===================== conditionals =====================

    IF(Kind.IF) {
        @Override ScriptToken read(ReaderState state) {
            ExpressionTokenizer.Result result = state.expressions.tokenize(state.cursor.parseToEnd());
            return branch(state, result.expression, 0, result.rest, Kind.IF, Kind.IF_SINGLE, Kind.IF_NEEDS_BRACE);
        }
    },

    IF_ARG(Kind.IF_ARG) {
        @Override ScriptToken read(ReaderState state) {
            return branch(state, null, state.argCount, restAfterThen(state.cursor),
                    Kind.IF_ARG, Kind.IF_ARG_SINGLE, Kind.IF_ARG_NEEDS_BRACE);
        }
    },

    /**
     * {@code else}, {@code else if <expr>}, {@code else if_N} and {@code elseif <expr>}, each with the
     * same block / single-line / needs-brace split as {@code if}.
     */
    ELSE(Kind.ELSE) {
        @Override ScriptToken read(ReaderState state) {
            TextCursor cursor = state.cursor;
            cursor.consumeSpaces();
            boolean elseIf = state.elseIf;
            if (!elseIf) {
                String next = cursor.peekWhile(TextCursor::isWordChar);
                String lower = next.toLowerCase();
                if (lower.equals("if")) {
                    cursor.consumeWord(next);
                    elseIf = true;
                } else if (ScriptTokenizer.isIfArgKeyword(lower)) {
                    cursor.consumeWhile(TextCursor::isWordChar);
                    int argCount = Integer.parseInt(lower.substring(3));
                    ScriptExpression condition = ScriptExpression.value("%argcount >= " + argCount);
                    return branch(state, condition, 0, restAfterThen(cursor),
                            Kind.ELSE_IF, Kind.ELSE_IF_SINGLE, Kind.ELSE_IF_NEEDS_BRACE);
                }
            }
            if (elseIf) {
                ExpressionTokenizer.Result result = state.expressions.tokenize(cursor.parseToEnd());
                return branch(state, result.expression, 0, result.rest,
                        Kind.ELSE_IF, Kind.ELSE_IF_SINGLE, Kind.ELSE_IF_NEEDS_BRACE);
            }
            return branch(state, null, 0, restAfterThen(cursor), Kind.ELSE, Kind.ELSE_SINGLE, Kind.ELSE_NEEDS_BRACE);
        }
    };

    final Kind kind;

    ReaderMode(Kind kind) {
        this.kind = kind;
    }

    ScriptToken read(ReaderState state) {
        return ScriptToken.of(kind, state.cursor.parseToEnd().trim());
    }

    // -------------------------
    // Shared readers
    // -------------------------

    private static ScriptToken wordAndRest(ReaderState state, Kind kind) {
        String word = state.cursor.parseWord();
        if (word.isEmpty()) return null;
        return ScriptToken.of(kind, word, state.cursor.parseToEnd().trim());
    }

    private static ScriptToken evalToken(ReaderState state, Kind kind) {
        String variable = state.cursor.parseWord();
        if (variable.isEmpty()) return null;
        state.cursor.consumeSpaces();
        String raw = state.cursor.remaining().trim();
        ScriptExpression expression = state.expressions.tokenize(state.cursor.parseToEnd()).expression;
        return ScriptToken.withExpression(kind, expression, variable, raw);
    }

    private static String restAfterThen(TextCursor cursor) {
        cursor.consumeSpaces();
        cursor.consumeWord("then");
        return cursor.parseToEnd().trim();
    }

    /**
     * Classifies what follows a condition: nothing is needs-brace, a lone brace opens a block,
     * {@code {stmt}} or any other statement is a single-line body.
     */
    private static ScriptToken branch(ReaderState state, ScriptExpression condition, int argCount, String rest,
                                      Kind open, Kind single, Kind needsBrace) {
        if (rest.isEmpty()) return make(condition, argCount, needsBrace, null);
        if (rest.equals("{")) return make(condition, argCount, open, null);

        String statement = rest;
        if (rest.startsWith("{")) {
            if (!rest.endsWith("}")) return null;
            statement = rest.substring(1, rest.length() - 1).trim();
        }
        ScriptToken body = state.tokenizer.read(statement);
        if (body == null) return null;
        return make(condition, argCount, single, body);
    }

    private static ScriptToken make(ScriptExpression condition, int argCount, Kind kind, ScriptToken body) {
        if (kind == Kind.IF_ARG || kind == Kind.IF_ARG_SINGLE || kind == Kind.IF_ARG_NEEDS_BRACE) {
            return ScriptToken.ifArg(kind, argCount, body);
        }
        return ScriptToken.conditional(kind, condition, body);
    }

    /** Per-line state handed to a mode. */
    static final class ReaderState {
        final ScriptTokenizer tokenizer;
        final ExpressionTokenizer expressions;
        final TextCursor cursor;
        int argCount;
        boolean elseIf;

        ReaderState(ScriptTokenizer tokenizer, ExpressionTokenizer expressions, TextCursor cursor) {
            this.tokenizer = tokenizer;
            this.expressions = expressions;
            this.cursor = cursor;
        }
    }
}
