package com.minipar.script.parser;

import java.util.Collections;
import java.util.List;

import com.minipar.script.parser.Expr.Call;
import com.minipar.script.parser.Expr.ExprNode;
import com.minipar.script.parser.Expr.Identifier;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);

        int line();
    }

    public interface StmtVisitor<R> {
        R visitModuleStmt(Module stmt);
        R visitAssignStmt(Assign stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitFuncDefStmt(FuncDef stmt);
        R visitSeqStmt(Seq stmt);
        R visitParStmt(Par stmt);
        R visitClientChannelStmt(ClientChannelDecl stmt);
        R visitServerChannelStmt(ServerChannelDecl stmt);
        R visitBreakStmt(Break stmt);
        R visitContinueStmt(Continue stmt);
        R visitReturnStmt(Return stmt);
        R visitCallStmt(Call stmt);
    }

    private static List<Stmt> freeze(List<Stmt> body) {
        return Collections.unmodifiableList(body);
    }

    /** Root of a parsed program. */
    public static final class Module implements Stmt {
        public final List<Stmt> statements;

        public Module(List<Stmt> statements) { this.statements = freeze(statements); }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitModuleStmt(this); }
        public int line() { return statements.isEmpty() ? 1 : statements.get(0).line(); }
    }

    /**
     * Assignment or declaration. A declaration without initialiser gets the zero
     * constant of its declared type as value.
     */
    public static final class Assign implements Stmt {
        public final Identifier target;
        public final ExprNode value;

        public Assign(Identifier target, ExprNode value) {
            this.target = target;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
        public int line() { return target.line(); }
    }

    public static final class If implements Stmt {
        public final Token keyword;
        public final ExprNode condition;
        public final List<Stmt> body;
        public final List<Stmt> elseBody; // empty when there is no else

        public If(Token keyword, ExprNode condition, List<Stmt> body, List<Stmt> elseBody) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = freeze(body);
            this.elseBody = freeze(elseBody);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class While implements Stmt {
        public final Token keyword;
        public final ExprNode condition;
        public final List<Stmt> body;

        public While(Token keyword, ExprNode condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = freeze(body);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
        public int line() { return keyword.line; }
    }

    /** Function parameter: {@code [type] name [: type] [= default]}. */
    public static final class Param {
        public final Token name;
        public final String type;         // may be null
        public final ExprNode defaultValue; // may be null

        public Param(Token name, String type, ExprNode defaultValue) {
            this.name = name;
            this.type = type;
            this.defaultValue = defaultValue;
        }

        public String name() { return name.lexeme; }
    }

    public static final class FuncDef implements Stmt {
        public final Token name;
        public final List<Param> params;
        public final List<Stmt> body;

        public FuncDef(Token name, List<Param> params, List<Stmt> body) {
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.body = freeze(body);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFuncDefStmt(this); }
        public int line() { return name.line; }
    }

    public static final class Seq implements Stmt {
        public final Token keyword;
        public final List<Stmt> body;

        public Seq(Token keyword, List<Stmt> body) {
            this.keyword = keyword;
            this.body = freeze(body);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitSeqStmt(this); }
        public int line() { return keyword.line; }
    }

    /** Concurrent block: every statement of the body is one branch. */
    public static final class Par implements Stmt {
        public final Token keyword;
        public final List<Stmt> body;

        public Par(Token keyword, List<Stmt> body) {
            this.keyword = keyword;
            this.body = freeze(body);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitParStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class ClientChannelDecl implements Stmt {
        public final Token name;
        public final ExprNode host;
        public final ExprNode port;

        public ClientChannelDecl(Token name, ExprNode host, ExprNode port) {
            this.name = name;
            this.host = host;
            this.port = port;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitClientChannelStmt(this); }
        public int line() { return name.line; }
    }

    public static final class ServerChannelDecl implements Stmt {
        public final Token name;
        public final Token handler;
        public final ExprNode description;
        public final ExprNode host;
        public final ExprNode port;

        public ServerChannelDecl(Token name, Token handler, ExprNode description, ExprNode host, ExprNode port) {
            this.name = name;
            this.handler = handler;
            this.description = description;
            this.host = host;
            this.port = port;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitServerChannelStmt(this); }
        public int line() { return name.line; }
    }

    public static final class Break implements Stmt {
        public final Token keyword;
        public Break(Token keyword) { this.keyword = keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class Continue implements Stmt {
        public final Token keyword;
        public Continue(Token keyword) { this.keyword = keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinueStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class Return implements Stmt {
        public final Token keyword;
        public final ExprNode value; // may be null

        public Return(Token keyword, ExprNode value) {
            this.keyword = keyword;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
        public int line() { return keyword.line; }
    }
}
