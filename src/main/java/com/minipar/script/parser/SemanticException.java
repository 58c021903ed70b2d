package com.minipar.script.parser;

public class SemanticException extends MiniParException {

    private static final long serialVersionUID = 1L;

    public SemanticException(int line, String message) {
        super(line, message);
    }
}
