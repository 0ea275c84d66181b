package com.ember.script.parser;

/**
 * A source line plus its lazily tokenized form.
 */
public final class ScriptLine {
    private static final ScriptTokenizer TOKENIZER = new ScriptTokenizer();

    private final String originalText;
    private final String fileName;
    private final int lineNumber;

    private boolean tokenized;
    private ScriptToken token;

    /** Whether the conditional chain this line belongs to has already taken a branch. */
    private Boolean ifResult;

    public ScriptLine(String originalText, String fileName, int lineNumber) {
        this.originalText = originalText;
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    public String originalText() { return originalText; }

    public String fileName() { return fileName; }

    public int lineNumber() { return lineNumber; }

    /** Parsed token, or null when the line is not a known command. Computed once. */
    public synchronized ScriptToken token() {
        if (!tokenized) {
            token = TOKENIZER.read(originalText);
            tokenized = true;
        }
        return token;
    }

    public Boolean ifResult() { return ifResult; }

    public void setIfResult(Boolean ifResult) { this.ifResult = ifResult; }

    @Override
    public String toString() {
        return "[" + fileName + "(" + lineNumber + ")]: " + originalText;
    }
}
