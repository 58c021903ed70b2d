package com.minipar.script.parser;

/**
 * Base of every error raised by the MiniPar front end and executor.
 * Carries the source line when one is known, otherwise -1.
 */
public class MiniParException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public MiniParException(int line, String message) {
        super(format(line, message));
        this.line = line;
    }

    public MiniParException(int line, String message, Throwable cause) {
        super(format(line, message), cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }

    private static String format(int line, String message) {
        return line < 0 ? message : "[line " + line + "] " + message;
    }
}
