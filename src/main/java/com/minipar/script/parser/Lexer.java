package com.minipar.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Turns MiniPar source text into tokens, one at a time.
 *
 * The lexer is an {@link Iterator}: tokens are produced lazily, the sequence ends
 * with a single EOF token, and it cannot be restarted. Whitespace and comments are
 * skipped unless the lexer was created with {@link #withTrivia(String)}, in which
 * case they come out as WHITESPACE / COMMENT tokens and concatenating every lexeme
 * gives back the original text.
 */
public class Lexer implements Iterator<Token> {
    private final String source;
    private final boolean keepTrivia;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private boolean emittedEof = false;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("string", TokenType.STRING_TYPE);
        map.put("int", TokenType.INT_TYPE);
        map.put("bool", TokenType.BOOL_TYPE);
        map.put("SEQ", TokenType.SEQ);
        map.put("PAR", TokenType.PAR);
        map.put("c_channel", TokenType.C_CHANNEL);
        map.put("s_channel", TokenType.S_CHANNEL);
        map.put("function", TokenType.FUNCTION);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("send", TokenType.SEND);
        map.put("receive", TokenType.RECEIVE);
        map.put("output", TokenType.OUTPUT);
        map.put("input", TokenType.INPUT);
        map.put("return", TokenType.RETURN);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this(source, false);
    }

    private Lexer(String source, boolean keepTrivia) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
        this.keepTrivia = keepTrivia;
    }

    /** A lexer that also yields whitespace and comment tokens. */
    public static Lexer withTrivia(String source) {
        return new Lexer(source, true);
    }

    /** Drains the remaining tokens, EOF included. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) tokens.add(next());
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !emittedEof;
    }

    @Override
    public Token next() {
        if (emittedEof) throw new NoSuchElementException("lexer already reached end of input");
        while (!isAtEnd()) {
            start = current;
            Token token = scanToken();
            if (current <= start) {
                throw new IllegalStateException("lexer did not advance at offset " + start);
            }
            if (token != null) return token;
        }
        emittedEof = true;
        return new Token(TokenType.EOF, "", null, line);
    }

    /** Scans one lexeme; returns null for skipped trivia. */
    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '(': return make(TokenType.LEFT_PAREN);
            case ')': return make(TokenType.RIGHT_PAREN);
            case '{': return make(TokenType.LEFT_BRACE);
            case '}': return make(TokenType.RIGHT_BRACE);
            case '[': return make(TokenType.LEFT_BRACKET);
            case ']': return make(TokenType.RIGHT_BRACKET);
            case ',': return make(TokenType.COMMA);
            case ';': return make(TokenType.SEMICOLON);
            case ':': return make(TokenType.COLON);
            case '.': return make(TokenType.DOT);
            case '+': return make(TokenType.PLUS);
            case '-': return make(TokenType.MINUS);
            case '*': return make(TokenType.STAR);
            case '%': return make(TokenType.PERCENT);
            case '/':
                if (match('*')) return blockComment();
                return make(TokenType.SLASH);
            case '#':
                while (!isAtEnd() && peek() != '\n') advance();
                return trivia(TokenType.COMMENT);
            case '!': return make(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '=': return make(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '<': return make(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>': return make(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&':
                if (match('&')) return make(TokenType.AND_AND);
                throw error(c, "Unexpected character: '&'");
            case '|':
                if (match('|')) return make(TokenType.OR_OR);
                throw error(c, "Unexpected character: '|'");
            case '"':
                return string();
            default:
                if (Character.isWhitespace(c)) return whitespace(c);
                if (isDigit(c)) return number();
                if (isAlpha(c)) return identifier();
                throw error(c, "Unexpected character: '" + c + "'");
        }
    }

    private Token whitespace(char first) {
        // Tokens carry the line they start on.
        int startLine = line;
        if (first == '\n') line++;
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            if (advance() == '\n') line++;
        }
        return keepTrivia ? new Token(TokenType.WHITESPACE, text(), null, startLine) : null;
    }

    private Token blockComment() {
        int startLine = line;
        while (!(peek() == '*' && peekNext() == '/')) {
            if (isAtEnd()) throw new LexException(startLine, '/', "Unterminated block comment");
            if (advance() == '\n') line++;
        }
        advance();
        advance();
        return keepTrivia ? new Token(TokenType.COMMENT, text(), null, startLine) : null;
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String word = text();
        return make(keywords.getOrDefault(word, TokenType.IDENTIFIER));
    }

    private Token number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            return new Token(TokenType.NUMBER, text(), Double.parseDouble(text()), line);
        }
        try {
            return new Token(TokenType.NUMBER, text(), Long.parseLong(text()), line);
        } catch (NumberFormatException e) {
            throw new LexException(line, text().charAt(0), "Integer literal out of range: " + text());
        }
    }

    private Token string() {
        int startLine = line;
        while (!isAtEnd() && peek() != '"') {
            if (advance() == '\n') line++;
        }
        if (isAtEnd()) throw new LexException(startLine, '"', "Unterminated string");
        advance();
        String value = source.substring(start + 1, current - 1);
        return new Token(TokenType.STRING, text(), value, startLine);
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
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private String text() { return source.substring(start, current); }

    private Token make(TokenType type) {
        return new Token(type, text(), null, line);
    }

    private Token trivia(TokenType type) {
        return keepTrivia ? make(type) : null;
    }

    private LexException error(char offending, String msg) {
        return new LexException(line, offending, msg);
    }
}
