package com.ember.script.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for substituted expression text.
 *
 * Anything that is not an operator, number or quoted string is a bare word, so leftover script text such as
 * {@code north-east} or an unresolved {@code %name} still tokenizes.
 */
final class HostLexer {
    private final String source;
    private final List<HostToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    HostLexer(String source) {
        this.source = source;
    }

    List<HostToken> tokenize() throws ExpressionException {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new HostToken(HostTokenType.EOF, "", null, current));
        return tokens;
    }

    private void scanToken() throws ExpressionException {
        char c = advance();
        switch (c) {
            case '(': addToken(HostTokenType.LEFT_PAREN); break;
            case ')': addToken(HostTokenType.RIGHT_PAREN); break;
            case ',': addToken(HostTokenType.COMMA); break;
            case '+': addToken(HostTokenType.PLUS); break;
            case '-': addToken(HostTokenType.MINUS); break;
            case '*': addToken(HostTokenType.STAR); break;
            case '/': addToken(HostTokenType.SLASH); break;
            case '%':
                if (isWordStart(peek())) word();
                else addToken(HostTokenType.PERCENT);
                break;
            case '!': addToken(match('=') ? HostTokenType.BANG_EQUAL : HostTokenType.BANG); break;
            // a single '=' compares, scripts never assign inside a condition
            case '=': match('='); addToken(HostTokenType.EQUAL_EQUAL); break;
            case '<': addToken(match('=') ? HostTokenType.LESS_EQUAL : HostTokenType.LESS); break;
            case '>': addToken(match('=') ? HostTokenType.GREATER_EQUAL : HostTokenType.GREATER); break;
            case '&':
                if (match('&')) addToken(HostTokenType.AND_AND);
                else word();
                break;
            case '|':
                if (match('|')) addToken(HostTokenType.OR_OR);
                else word();
                break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else word();
        }
    }

    private void word() {
        while (!isAtEnd() && isWordPart(peek())) advance();
        String text = source.substring(start, current);
        if (text.equalsIgnoreCase("true")) addToken(HostTokenType.TRUE);
        else if (text.equalsIgnoreCase("false")) addToken(HostTokenType.FALSE);
        else addToken(HostTokenType.WORD, text);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if (Character.isLetter(peek()) || peek() == '_') {
            // 3rd, 2handed
            word();
            return;
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(HostTokenType.NUMBER, value);
    }

    private void string() throws ExpressionException {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\' && (peek() == '"' || peek() == '\\')) {
                value.append(advance());
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(HostTokenType.STRING, value.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isWordPart(char c) {
        if (Character.isWhitespace(c)) return false;
        switch (c) {
            case '(': case ')': case ',': case '"': case '!': case '=': case '<': case '>':
            case '+': case '*': case '/':
                return false;
            case '&': case '|':
                return peekNext() != c;
            default:
                return true;
        }
    }

    private void addToken(HostTokenType type) { addToken(type, null); }
    private void addToken(HostTokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new HostToken(type, text, literal, start));
    }

    private ExpressionException error(String msg) {
        return new ExpressionException("[col " + (start + 1) + "] " + msg);
    }
}
