package com.minipar.script.parser;

public enum TokenType {
    // Single-character punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, SEMICOLON, COLON, DOT,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    LESS, LESS_EQUAL,
    GREATER, GREATER_EQUAL,
    AND_AND, OR_OR,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    STRING_TYPE, INT_TYPE, BOOL_TYPE,
    SEQ, PAR, C_CHANNEL, S_CHANNEL,
    FUNCTION, IF, ELSE, WHILE,
    SEND, RECEIVE, OUTPUT, INPUT,
    RETURN, BREAK, CONTINUE,
    TRUE, FALSE,

    // Trivia, only produced when the lexer keeps it
    WHITESPACE, COMMENT,

    EOF
}
