package com.minipar.script.parser;

import com.minipar.script.parser.Expr.Access;
import com.minipar.script.parser.Expr.Arithmetic;
import com.minipar.script.parser.Expr.Call;
import com.minipar.script.parser.Expr.Constant;
import com.minipar.script.parser.Expr.ExprNode;
import com.minipar.script.parser.Expr.ExprVisitor;
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
import com.minipar.script.parser.Statement.StmtVisitor;
import com.minipar.script.parser.Statement.While;

import java.util.List;

/**
 * Single-pass check over a parsed module.
 *
 * Expressions are mapped to a type tag ({@code int}, {@code float}, {@code bool},
 * {@code string}) where it can be read off the tree, or to null when it cannot.
 * Conditions with a known tag must be {@code bool}; assignments whose two sides
 * both have a known tag must agree. Nothing is tracked across statements.
 */
public class SemanticAnalyzer implements ExprVisitor<String>, StmtVisitor<Void> {

    public void check(Module module) {
        module.accept(this);
    }

    private void checkAll(List<Stmt> body) {
        for (Stmt s : body) s.accept(this);
    }

    private String tagOf(ExprNode expr) {
        return expr.accept(this);
    }

    private void requireBool(ExprNode condition, String where) {
        String tag = tagOf(condition);
        if (tag != null && !Value.TAG_BOOL.equals(tag)) {
            throw new SemanticException(condition.line(),
                    where + " condition must be bool, got " + tag);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Void visitModuleStmt(Module stmt) {
        checkAll(stmt.statements);
        return null;
    }

    @Override
    public Void visitAssignStmt(Assign stmt) {
        String left = tagOf(stmt.target);
        String right = tagOf(stmt.value);
        if (left != null && right != null && !left.equals(right)) {
            throw new SemanticException(stmt.line(),
                    "Cannot assign " + right + " to '" + stmt.target.name() + "' of type " + left);
        }
        return null;
    }

    @Override
    public Void visitIfStmt(If stmt) {
        requireBool(stmt.condition, "if");
        checkAll(stmt.body);
        checkAll(stmt.elseBody);
        return null;
    }

    @Override
    public Void visitWhileStmt(While stmt) {
        requireBool(stmt.condition, "while");
        checkAll(stmt.body);
        return null;
    }

    @Override
    public Void visitFuncDefStmt(FuncDef stmt) {
        for (Param p : stmt.params) {
            if (p.defaultValue != null) tagOf(p.defaultValue);
        }
        checkAll(stmt.body);
        return null;
    }

    @Override
    public Void visitSeqStmt(Seq stmt) {
        checkAll(stmt.body);
        return null;
    }

    @Override
    public Void visitParStmt(Par stmt) {
        checkAll(stmt.body);
        return null;
    }

    @Override
    public Void visitClientChannelStmt(ClientChannelDecl stmt) {
        tagOf(stmt.host);
        tagOf(stmt.port);
        return null;
    }

    @Override
    public Void visitServerChannelStmt(ServerChannelDecl stmt) {
        tagOf(stmt.description);
        tagOf(stmt.host);
        tagOf(stmt.port);
        return null;
    }

    @Override
    public Void visitBreakStmt(Break stmt) { return null; }

    @Override
    public Void visitContinueStmt(Continue stmt) { return null; }

    @Override
    public Void visitReturnStmt(Return stmt) {
        if (stmt.value != null) tagOf(stmt.value);
        return null;
    }

    @Override
    public Void visitCallStmt(Call stmt) {
        tagOf(stmt);
        return null;
    }

    // -------------------------
    // Expressions (type tags)
    // -------------------------

    @Override
    public String visitConstantExpr(Constant expr) {
        return expr.typeTag();
    }

    @Override
    public String visitIdentifierExpr(Identifier expr) {
        return expr.declaration ? expr.declaredType : null;
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        tagOf(expr.left);
        tagOf(expr.right);
        return Value.TAG_BOOL;
    }

    @Override
    public String visitRelationalExpr(Relational expr) {
        tagOf(expr.left);
        tagOf(expr.right);
        return Value.TAG_BOOL;
    }

    @Override
    public String visitArithmeticExpr(Arithmetic expr) {
        tagOf(expr.left);
        tagOf(expr.right);
        return null;
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        String operand = tagOf(expr.right);
        return expr.operator.type == TokenType.BANG ? Value.TAG_BOOL : operand;
    }

    @Override
    public String visitCallExpr(Call expr) {
        for (ExprNode arg : expr.arguments) tagOf(arg);
        return null;
    }

    @Override
    public String visitAccessExpr(Access expr) {
        tagOf(expr.base);
        tagOf(expr.index);
        return null;
    }
}
