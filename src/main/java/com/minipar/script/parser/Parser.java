package com.minipar.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.minipar.script.parser.Expr.Access;
import com.minipar.script.parser.Expr.Arithmetic;
import com.minipar.script.parser.Expr.Call;
import com.minipar.script.parser.Expr.Constant;
import com.minipar.script.parser.Expr.ExprNode;
import com.minipar.script.parser.Expr.Identifier;
import com.minipar.script.parser.Expr.Logical;
import com.minipar.script.parser.Expr.Relational;
import com.minipar.script.parser.Expr.Unary;
import com.minipar.script.parser.Statement.Assign;
import com.minipar.script.parser.Statement.Break;
import com.minipar.script.parser.Statement.ClientChannelDecl;
import com.minipar.script.parser.Statement.Continue;
import com.minipar.script.parser.Statement.FuncDef;
import com.minipar.script.parser.Statement.If;
import com.minipar.script.parser.Statement.Module;
import com.minipar.script.parser.Statement.Par;
import com.minipar.script.parser.Statement.Param;
import com.minipar.script.parser.Statement.Return;
import com.minipar.script.parser.Statement.Seq;
import com.minipar.script.parser.Statement.ServerChannelDecl;
import com.minipar.script.parser.Statement.Stmt;
import com.minipar.script.parser.Statement.While;

/**
 * Predictive recursive-descent parser with one token of lookahead.
 *
 * In {@link Mode#STRICT} the first syntax error is thrown. In {@link Mode#RECOVER}
 * the error is recorded, tokens are discarded up to the next statement boundary and
 * parsing resumes; the collected errors are available from {@link #errors()}.
 */
public class Parser {

    public enum Mode {
        STRICT,
        RECOVER
    }

    private static final int MAX_PARAMS = 64;

    private final List<Token> tokens;
    private final Mode mode;
    private final List<SyntaxException> errors = new ArrayList<>();
    private int current = 0;

    public Parser(List<Token> tokens) {
        this(tokens, Mode.STRICT);
    }

    public Parser(List<Token> tokens, Mode mode) {
        List<Token> significant = new ArrayList<>(tokens.size() + 1);
        for (Token t : tokens) {
            if (!t.isTrivia()) significant.add(t);
        }
        if (significant.isEmpty() || significant.get(significant.size() - 1).type != TokenType.EOF) {
            int line = significant.isEmpty() ? 1 : significant.get(significant.size() - 1).line;
            significant.add(new Token(TokenType.EOF, "", null, line));
        }
        this.tokens = significant;
        this.mode = (mode == null) ? Mode.STRICT : mode;
    }

    public Module parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) continue;
            statementInto(statements);
        }
        return new Module(statements);
    }

    /** Syntax errors collected in RECOVER mode. Always empty in STRICT mode. */
    public List<SyntaxException> errors() {
        return Collections.unmodifiableList(errors);
    }

    // -------------------------
    // Statements
    // -------------------------

    private void statementInto(List<Stmt> out) {
        int startPos = current;
        try {
            out.add(statement());
        } catch (SyntaxException e) {
            if (mode == Mode.STRICT) throw e;
            errors.add(e);
            synchronize(startPos);
        }
    }

    /** Panic mode: skip to just past a ';', or up to a block delimiter or end of input. */
    private void synchronize(int startPos) {
        if (current == startPos && !isAtEnd()) advance();
        while (!isAtEnd()) {
            if (previous().type == TokenType.SEMICOLON) return;
            switch (peek().type) {
                case LEFT_BRACE:
                case RIGHT_BRACE:
                case SEQ:
                case PAR:
                    return;
                default:
                    advance();
            }
        }
    }

    private Stmt statement() {
        Token t = peek();
        switch (t.type) {
            case SEQ:
                advance();
                return new Seq(t, blockBody());
            case PAR:
                advance();
                return new Par(t, blockBody());
            case LEFT_BRACE:
                advance();
                return new Seq(t, braceBody());
            case STRING_TYPE:
            case INT_TYPE:
            case BOOL_TYPE:
                return typedDeclaration();
            case IF:
                return ifStatement();
            case WHILE:
                return whileStatement();
            case FUNCTION:
                return functionDeclaration();
            case BREAK:
                advance();
                consume(TokenType.SEMICOLON, "Expect ';' after 'break'.");
                return new Break(t);
            case CONTINUE:
                advance();
                consume(TokenType.SEMICOLON, "Expect ';' after 'continue'.");
                return new Continue(t);
            case RETURN:
                return returnStatement();
            case C_CHANNEL:
                return clientChannel();
            case S_CHANNEL:
                return serverChannel();
            case IDENTIFIER:
                return identifierStatement();
            case SEND:
            case RECEIVE:
            case OUTPUT:
            case INPUT: {
                advance();
                Call call = finishCall(t, null);
                consume(TokenType.SEMICOLON, "Expect ';' after call.");
                return call;
            }
            default:
                throw error(t, "Expect statement.");
        }
    }

    /** Body of SEQ / PAR: braces, or everything up to the next SEQ, PAR, '}' or end. */
    private List<Stmt> blockBody() {
        if (match(TokenType.LEFT_BRACE)) return braceBody();

        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.SEQ) && !check(TokenType.PAR) && !check(TokenType.RIGHT_BRACE)) {
            if (match(TokenType.SEMICOLON)) continue;
            statementInto(statements);
        }
        return statements;
    }

    /** Statements up to the matching '}' (the '{' is already consumed). */
    private List<Stmt> braceBody() {
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            if (match(TokenType.SEMICOLON)) continue;
            statementInto(statements);
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    /** Body of if / while / function: a braced block is inlined, otherwise one statement. */
    private List<Stmt> body() {
        if (match(TokenType.LEFT_BRACE)) return braceBody();
        List<Stmt> single = new ArrayList<>(1);
        single.add(statement());
        return single;
    }

    private Stmt typedDeclaration() {
        String type = advance().lexeme;
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name after type '" + type + "'.");
        return finishDeclaration(name, type);
    }

    private Stmt identifierStatement() {
        Token name = advance();

        if (match(TokenType.COLON)) {
            String type = typeName();
            return finishDeclaration(name, type);
        }
        if (match(TokenType.EQUAL)) {
            ExprNode value = expression();
            consume(TokenType.SEMICOLON, "Expect ';' after assignment.");
            return new Assign(new Identifier(name), value);
        }
        if (check(TokenType.LEFT_PAREN) || check(TokenType.DOT)) {
            Call call = check(TokenType.DOT) ? channelMethodCall(name) : finishCall(name, null);
            consume(TokenType.SEMICOLON, "Expect ';' after call.");
            return call;
        }
        throw error(peek(), "Expect '=', ':' or '(' after identifier '" + name.lexeme + "'.");
    }

    private String typeName() {
        if (match(TokenType.STRING_TYPE, TokenType.INT_TYPE, TokenType.BOOL_TYPE, TokenType.IDENTIFIER)) {
            return previous().lexeme;
        }
        throw error(peek(), "Expect type name.");
    }

    private Stmt finishDeclaration(Token name, String type) {
        Identifier target = new Identifier(name, type, true);
        ExprNode value;
        if (match(TokenType.EQUAL)) {
            value = expression();
        } else {
            value = zeroConstant(type, name.line);
        }
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new Assign(target, value);
    }

    private static Constant zeroConstant(String type, int line) {
        Value zero = Value.zeroOf(type);
        TokenType kind;
        String lexeme;
        switch (zero.getType()) {
            case STRING:
                kind = TokenType.STRING;
                lexeme = "\"\"";
                break;
            case BOOL:
                kind = TokenType.FALSE;
                lexeme = "false";
                break;
            default:
                kind = TokenType.NUMBER;
                lexeme = zero.stringify();
        }
        return new Constant(new Token(kind, lexeme, zero.value, line), zero);
    }

    private Stmt ifStatement() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        ExprNode condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        List<Stmt> body = body();
        List<Stmt> elseBody = new ArrayList<>();
        if (match(TokenType.ELSE)) elseBody = body();
        return new If(keyword, condition, body, elseBody);
    }

    private Stmt whileStatement() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        ExprNode condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after condition.");
        return new While(keyword, condition, body());
    }

    private Stmt functionDeclaration() {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Param> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMS + ").");
                }
                params.add(param());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");

        return new FuncDef(name, params, body());
    }

    private Param param() {
        String type = null;
        if (match(TokenType.STRING_TYPE, TokenType.INT_TYPE, TokenType.BOOL_TYPE)) {
            type = previous().lexeme;
        }
        Token name = consume(TokenType.IDENTIFIER, "Expect parameter name.");
        if (type == null && match(TokenType.COLON)) {
            type = typeName();
        }
        ExprNode defaultValue = null;
        if (match(TokenType.EQUAL)) {
            defaultValue = expression();
        }
        return new Param(name, type, defaultValue);
    }

    private Stmt returnStatement() {
        Token keyword = advance();
        ExprNode value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new Return(keyword, value);
    }

    // c_channel NAME host port;
    private Stmt clientChannel() {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expect channel name after 'c_channel'.");
        ExprNode host = unary();
        ExprNode port = unary();
        consume(TokenType.SEMICOLON, "Expect ';' after client channel declaration.");
        return new ClientChannelDecl(name, host, port);
    }

    // s_channel NAME { handler, description, host, port }
    private Stmt serverChannel() {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expect channel name after 's_channel'.");
        consume(TokenType.LEFT_BRACE, "Expect '{' after server channel name.");
        Token handler = consume(TokenType.IDENTIFIER, "Expect handler function name.");
        consume(TokenType.COMMA, "Expect ',' after handler name.");
        ExprNode description = expression();
        consume(TokenType.COMMA, "Expect ',' after description.");
        ExprNode host = expression();
        consume(TokenType.COMMA, "Expect ',' after host.");
        ExprNode port = expression();
        consume(TokenType.RIGHT_BRACE, "Expect '}' after server channel settings.");
        match(TokenType.SEMICOLON);
        return new ServerChannelDecl(name, handler, description, host, port);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprNode expression() { return or(); }

    private ExprNode or() {
        ExprNode expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            ExprNode right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprNode and() {
        ExprNode expr = relational();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            ExprNode right = relational();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprNode relational() {
        ExprNode expr = additive();
        if (matchRelational()) {
            Token op = previous();
            ExprNode right = additive();
            expr = new Relational(expr, op, right);
            if (matchRelational()) {
                throw error(previous(), "Relational operators cannot be chained.");
            }
        }
        return expr;
    }

    private boolean matchRelational() {
        return match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL);
    }

    private ExprNode additive() {
        ExprNode expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            ExprNode right = multiplicative();
            expr = new Arithmetic(expr, op, right);
        }
        return expr;
    }

    private ExprNode multiplicative() {
        ExprNode expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            ExprNode right = unary();
            expr = new Arithmetic(expr, op, right);
        }
        return expr;
    }

    private ExprNode unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            ExprNode right = unary();
            return new Unary(op, right);
        }
        return postfix();
    }

    private ExprNode postfix() {
        ExprNode expr = primary();
        while (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            ExprNode index = expression();
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
            expr = new Access(expr, index, bracket);
        }
        return expr;
    }

    private ExprNode primary() {
        Token t = peek();
        switch (t.type) {
            case NUMBER:
                advance();
                return new Constant(t, (t.literal instanceof Double)
                        ? Value.floating((Double) t.literal)
                        : Value.integer((Long) t.literal));
            case STRING:
                advance();
                return new Constant(t, Value.string((String) t.literal));
            case TRUE:
                advance();
                return new Constant(t, Value.bool(true));
            case FALSE:
                advance();
                return new Constant(t, Value.bool(false));
            case IDENTIFIER:
                advance();
                if (check(TokenType.LEFT_PAREN)) return finishCall(t, null);
                if (check(TokenType.DOT)) return channelMethodCall(t);
                return new Identifier(t);
            case SEND:
            case RECEIVE:
            case OUTPUT:
            case INPUT:
                advance();
                return finishCall(t, null);
            case LEFT_PAREN: {
                advance();
                ExprNode expr = expression();
                consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
                return expr;
            }
            default:
                throw error(t, "Expect expression.");
        }
    }

    // NAME.send(data) / NAME.receive() / NAME.close()
    private Call channelMethodCall(Token channel) {
        consume(TokenType.DOT, "Expect '.' after channel name.");
        Token method = peek();
        boolean allowed = method.type == TokenType.SEND
                || method.type == TokenType.RECEIVE
                || (method.type == TokenType.IDENTIFIER && "close".equals(method.lexeme));
        if (!allowed) {
            throw error(method, "Only send, receive and close can be called on a channel.");
        }
        advance();
        return finishCall(method, channel);
    }

    private Call finishCall(Token callee, Token channel) {
        consume(TokenType.LEFT_PAREN, "Expect '(' after '" + callee.lexeme + "'.");
        List<ExprNode> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Call(callee, channel, arguments);
    }

    // -------------------------
    // Token plumbing
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private SyntaxException error(Token token, String message) {
        return new SyntaxException(token, message);
    }
}
