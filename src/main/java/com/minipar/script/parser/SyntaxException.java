package com.minipar.script.parser;

public class SyntaxException extends MiniParException {

    private static final long serialVersionUID = 1L;

    private final String found;

    public SyntaxException(Token token, String message) {
        super(token.line, message + " (found '" + describe(token) + "')");
        this.found = token.lexeme;
    }

    /** Lexeme of the token the parser choked on; empty at end of input. */
    public String getFound() {
        return found;
    }

    private static String describe(Token token) {
        return token.type == TokenType.EOF ? "end of input" : token.lexeme;
    }
}
