package com.ember.script.expr;

/** Raised by an {@link ExpressionHost} or a script function that cannot produce a result. */
public class ExpressionException extends Exception {
    private static final long serialVersionUID = 1L;

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
