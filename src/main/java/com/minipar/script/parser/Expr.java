package com.minipar.script.parser;

import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprNode {
        <R> R accept(ExprVisitor<R> visitor);

        /** Source line used in error messages. */
        int line();
    }

    public interface ExprVisitor<R> {
        R visitConstantExpr(Constant expr);
        R visitIdentifierExpr(Identifier expr);
        R visitLogicalExpr(Logical expr);
        R visitRelationalExpr(Relational expr);
        R visitArithmeticExpr(Arithmetic expr);
        R visitUnaryExpr(Unary expr);
        R visitCallExpr(Call expr);
        R visitAccessExpr(Access expr);
    }

    // -------------------------
    // Leaves
    // -------------------------

    public static final class Constant implements ExprNode {
        public final Token token;
        public final Value value;

        public Constant(Token token, Value value) {
            this.token = token;
            this.value = value;
        }

        /** Literal's type tag: int, float, bool or string. */
        public String typeTag() {
            return value.typeTag();
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConstantExpr(this);
        }

        @Override
        public int line() { return token.line; }
    }

    public static final class Identifier implements ExprNode {
        public final Token name;
        public final String declaredType; // null unless this identifier declares a variable
        public final boolean declaration;

        public Identifier(Token name) {
            this(name, null, false);
        }

        public Identifier(Token name, String declaredType, boolean declaration) {
            this.name = name;
            this.declaredType = declaredType;
            this.declaration = declaration;
        }

        public String name() { return name.lexeme; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }

        @Override
        public int line() { return name.line; }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Logical implements ExprNode {
        public final ExprNode left;
        public final Token operator;
        public final ExprNode right;

        public Logical(ExprNode left, Token operator, ExprNode right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }

        @Override
        public int line() { return operator.line; }
    }

    public static final class Relational implements ExprNode {
        public final ExprNode left;
        public final Token operator;
        public final ExprNode right;

        public Relational(ExprNode left, Token operator, ExprNode right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRelationalExpr(this);
        }

        @Override
        public int line() { return operator.line; }
    }

    public static final class Arithmetic implements ExprNode {
        public final ExprNode left;
        public final Token operator;
        public final ExprNode right;

        public Arithmetic(ExprNode left, Token operator, ExprNode right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArithmeticExpr(this);
        }

        @Override
        public int line() { return operator.line; }
    }

    public static final class Unary implements ExprNode {
        public final Token operator;
        public final ExprNode right;

        public Unary(Token operator, ExprNode right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public int line() { return operator.line; }
    }

    // -------------------------
    // Calls and indexing
    // -------------------------

    /**
     * Function or builtin call. Also valid in statement position.
     *
     * For the channel method form {@code cli.send(x)} the callee is {@code send}
     * and {@link #channel} holds {@code cli}; otherwise channel is null.
     */
    public static final class Call implements ExprNode, Statement.Stmt {
        public final Token callee;
        public final Token channel;
        public final List<ExprNode> arguments;

        public Call(Token callee, Token channel, List<ExprNode> arguments) {
            this.callee = callee;
            this.channel = channel;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        public String name() { return callee.lexeme; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public <R> R accept(Statement.StmtVisitor<R> visitor) {
            return visitor.visitCallStmt(this);
        }

        @Override
        public int line() { return callee.line; }
    }

    public static final class Access implements ExprNode {
        public final ExprNode base;
        public final ExprNode index;
        public final Token bracket;

        public Access(ExprNode base, ExprNode index, Token bracket) {
            this.base = base;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAccessExpr(this);
        }

        @Override
        public int line() { return bracket.line; }
    }
}
