package com.minipar.script.diag;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import com.minipar.script.parser.Token;
import com.minipar.script.parser.Value;

/**
 * JSON views of tokens and syntax trees, for the CLI's -tok / -ast modes and for
 * tooling. Every tree node is an object with a {@code "node"} field naming its kind.
 */
public final class MiniParJson implements ExprVisitor<ObjectNode>, StmtVisitor<ObjectNode> {

    private static final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private MiniParJson() {}

    /** {@code [{"kind": "...", "lexeme": "...", "line": n}, ...]} */
    public static ArrayNode tokens(List<Token> tokens) {
        ArrayNode arr = om.createArrayNode();
        for (Token t : tokens) {
            ObjectNode o = arr.addObject();
            o.put("kind", t.type.name());
            o.put("lexeme", t.lexeme);
            o.put("line", t.line);
        }
        return arr;
    }

    public static ObjectNode tree(Stmt root) {
        return root.accept(new MiniParJson());
    }

    public static String write(JsonNode node) {
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialise diagnostic JSON", e);
        }
    }

    public static JsonNode read(String json) {
        try {
            return om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    private ObjectNode node(String kind, int line) {
        ObjectNode o = om.createObjectNode();
        o.put("node", kind);
        o.put("line", line);
        return o;
    }

    private ArrayNode body(List<Stmt> stmts) {
        ArrayNode arr = om.createArrayNode();
        for (Stmt s : stmts) arr.add(s.accept(this));
        return arr;
    }

    private ObjectNode expr(ExprNode e) {
        return e.accept(this);
    }

    @Override
    public ObjectNode visitModuleStmt(Module stmt) {
        ObjectNode o = node("Module", stmt.line());
        o.set("body", body(stmt.statements));
        return o;
    }

    @Override
    public ObjectNode visitAssignStmt(Assign stmt) {
        ObjectNode o = node("Assign", stmt.line());
        o.set("target", expr(stmt.target));
        o.set("value", expr(stmt.value));
        return o;
    }

    @Override
    public ObjectNode visitIfStmt(If stmt) {
        ObjectNode o = node("If", stmt.line());
        o.set("condition", expr(stmt.condition));
        o.set("body", body(stmt.body));
        if (!stmt.elseBody.isEmpty()) o.set("else", body(stmt.elseBody));
        return o;
    }

    @Override
    public ObjectNode visitWhileStmt(While stmt) {
        ObjectNode o = node("While", stmt.line());
        o.set("condition", expr(stmt.condition));
        o.set("body", body(stmt.body));
        return o;
    }

    @Override
    public ObjectNode visitFuncDefStmt(FuncDef stmt) {
        ObjectNode o = node("FuncDef", stmt.line());
        o.put("name", stmt.name.lexeme);
        ArrayNode params = o.putArray("params");
        for (Param p : stmt.params) {
            ObjectNode po = params.addObject();
            po.put("name", p.name());
            if (p.type != null) po.put("type", p.type);
            if (p.defaultValue != null) po.set("default", expr(p.defaultValue));
        }
        o.set("body", body(stmt.body));
        return o;
    }

    @Override
    public ObjectNode visitSeqStmt(Seq stmt) {
        ObjectNode o = node("Seq", stmt.line());
        o.set("body", body(stmt.body));
        return o;
    }

    @Override
    public ObjectNode visitParStmt(Par stmt) {
        ObjectNode o = node("Par", stmt.line());
        o.set("body", body(stmt.body));
        return o;
    }

    @Override
    public ObjectNode visitClientChannelStmt(ClientChannelDecl stmt) {
        ObjectNode o = node("ClientChannelDecl", stmt.line());
        o.put("name", stmt.name.lexeme);
        o.set("host", expr(stmt.host));
        o.set("port", expr(stmt.port));
        return o;
    }

    @Override
    public ObjectNode visitServerChannelStmt(ServerChannelDecl stmt) {
        ObjectNode o = node("ServerChannelDecl", stmt.line());
        o.put("name", stmt.name.lexeme);
        o.put("handler", stmt.handler.lexeme);
        o.set("description", expr(stmt.description));
        o.set("host", expr(stmt.host));
        o.set("port", expr(stmt.port));
        return o;
    }

    @Override
    public ObjectNode visitBreakStmt(Break stmt) {
        return node("Break", stmt.line());
    }

    @Override
    public ObjectNode visitContinueStmt(Continue stmt) {
        return node("Continue", stmt.line());
    }

    @Override
    public ObjectNode visitReturnStmt(Return stmt) {
        ObjectNode o = node("Return", stmt.line());
        if (stmt.value != null) o.set("value", expr(stmt.value));
        return o;
    }

    @Override
    public ObjectNode visitCallStmt(Call stmt) {
        return visitCallExpr(stmt);
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public ObjectNode visitConstantExpr(Constant expr) {
        ObjectNode o = node("Constant", expr.line());
        o.put("type", expr.typeTag());
        Value v = expr.value;
        switch (v.getType()) {
            case INT: o.put("value", v.asInt()); break;
            case FLOAT: o.put("value", v.asFloat()); break;
            case BOOL: o.put("value", v.asBool()); break;
            case STRING: o.put("value", v.asString()); break;
            default: o.putNull("value");
        }
        return o;
    }

    @Override
    public ObjectNode visitIdentifierExpr(Identifier expr) {
        ObjectNode o = node("Identifier", expr.line());
        o.put("name", expr.name());
        if (expr.declaration) o.put("declares", expr.declaredType);
        return o;
    }

    private ObjectNode binary(String kind, ExprNode left, Token op, ExprNode right) {
        ObjectNode o = node(kind, op.line);
        o.put("op", op.lexeme);
        o.set("left", expr(left));
        o.set("right", expr(right));
        return o;
    }

    @Override
    public ObjectNode visitLogicalExpr(Logical expr) {
        return binary("Logical", expr.left, expr.operator, expr.right);
    }

    @Override
    public ObjectNode visitRelationalExpr(Relational expr) {
        return binary("Relational", expr.left, expr.operator, expr.right);
    }

    @Override
    public ObjectNode visitArithmeticExpr(Arithmetic expr) {
        return binary("Arithmetic", expr.left, expr.operator, expr.right);
    }

    @Override
    public ObjectNode visitUnaryExpr(Unary expr) {
        ObjectNode o = node("Unary", expr.line());
        o.put("op", expr.operator.lexeme);
        o.set("operand", expr(expr.right));
        return o;
    }

    @Override
    public ObjectNode visitCallExpr(Call expr) {
        ObjectNode o = node("Call", expr.line());
        o.put("name", expr.name());
        if (expr.channel != null) o.put("channel", expr.channel.lexeme);
        ArrayNode args = o.putArray("args");
        for (ExprNode a : expr.arguments) args.add(expr(a));
        return o;
    }

    @Override
    public ObjectNode visitAccessExpr(Access expr) {
        ObjectNode o = node("Access", expr.line());
        o.set("base", expr(expr.base));
        o.set("index", expr(expr.index));
        return o;
    }
}
