package com.minipar.script.parser;

/** Raised when no token pattern matches at the current scan position. */
public class LexException extends MiniParException {

    private static final long serialVersionUID = 1L;

    private final char offending;

    public LexException(int line, char offending, String message) {
        super(line, message);
        this.offending = offending;
    }

    public char getOffending() {
        return offending;
    }
}
