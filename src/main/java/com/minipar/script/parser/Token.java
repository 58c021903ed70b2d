package com.minipar.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;

    public Token(TokenType type, String lexeme, Object literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    public boolean isTrivia() {
        return type == TokenType.WHITESPACE || type == TokenType.COMMENT;
    }

    @Override
    public String toString() {
        return "{" + lexeme + ", " + type + "} line " + line;
    }
}
