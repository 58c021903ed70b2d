package com.minipar.script.parser;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import com.minipar.debug.Debug;
import com.minipar.script.MiniPar.BuiltinFunction;
import com.minipar.script.channel.ChannelConnection;
import com.minipar.script.channel.ChannelTable;
import com.minipar.script.channel.ClientChannel;
import com.minipar.script.channel.ServerChannel;
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
import com.minipar.script.parser.MiniParRuntimeException.Kind;
import com.minipar.script.parser.Statement.Assign;
import com.minipar.script.parser.Statement.Break;
import com.minipar.script.parser.Statement.ClientChannelDecl;
import com.minipar.script.parser.Statement.Continue;
import com.minipar.script.parser.Statement.FuncDef;
import com.minipar.script.parser.Statement.If;
import com.minipar.script.parser.Statement.Module;
import com.minipar.script.parser.Statement.Par;
import com.minipar.script.parser.Statement.Return;
import com.minipar.script.parser.Statement.Seq;
import com.minipar.script.parser.Statement.ServerChannelDecl;
import com.minipar.script.parser.Statement.Stmt;
import com.minipar.script.parser.Statement.StmtVisitor;
import com.minipar.script.parser.Statement.While;


public class Interpreter implements ExprVisitor<Value>, StmtVisitor<ControlResult> {
    private static final AtomicInteger PAR_THREAD_IDS = new AtomicInteger();

    // Whole-string numbers accepted by coercion: 12, -3, 4.5, .5, 1e3
    private static final Pattern FLOAT_TEXT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final String SEND = "send";
    private static final String RECEIVE = "receive";
    private static final String CLOSE = "close";

    private final ScopeChain scopes;
    private final Map<String, UserFunction> functions;
    private final ChannelTable channels = new ChannelTable();
    private final Map<String, BuiltinFunction> hostFunctions;
    private final Map<String, BuiltinFunction> builtins = new HashMap<>();
    private final InterpreterOptions options;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();

    public Interpreter(InterpreterOptions options, Map<String, BuiltinFunction> hostFunctions) {
        this(new ScopeChain(), new LinkedHashMap<>(), options,
                (hostFunctions == null) ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(hostFunctions)));
        scopes.defineGlobal("pi", Value.floating(Math.PI));
        scopes.defineGlobal("e", Value.floating(Math.E));
    }

    private Interpreter(ScopeChain scopes, Map<String, UserFunction> functions,
                        InterpreterOptions options, Map<String, BuiltinFunction> hostFunctions) {
        this.scopes = scopes;
        this.functions = functions;
        this.options = (options == null) ? InterpreterOptions.defaults() : options;
        this.hostFunctions = hostFunctions;
        registerCoreBuiltins();
        builtins.putAll(hostFunctions);
    }

    // -------------------------
    // Entry points
    // -------------------------

    /**
     * Executes a module in the root frame. Any channel still open when the module
     * finishes or fails is closed.
     */
    public void run(Module module) {
        runToCompletion(module, "at top level");
    }

    /** Read-only copy of the root frame. */
    public Map<String, Value> globals() {
        return scopes.globals();
    }

    ScopeChain scopes() {
        return scopes;
    }

    Value evaluate(ExprNode expr) {
        return expr.accept(this);
    }

    /** Runs statements in the current frame, stopping at the first non-normal result. */
    ControlResult executeBody(List<Stmt> body) {
        for (Stmt s : body) {
            ControlResult r = s.accept(this);
            if (!r.isNormal()) return r;
        }
        return ControlResult.NORMAL;
    }

    /** Runs statements in a new child frame. */
    ControlResult executeBlock(List<Stmt> body) {
        scopes.pushBlock();
        try {
            return executeBody(body);
        } finally {
            scopes.pop();
        }
    }

    private void runToCompletion(Stmt stmt, String where) {
        Throwable failure = null;
        try {
            ControlResult r = stmt.accept(this);
            if (!r.isNormal()) throw misplaced(r, where);
        } catch (RuntimeException | Error e) {
            failure = e;
            throw e;
        } finally {
            releaseChannels(failure);
        }
    }

    private void releaseChannels(Throwable failure) {
        try {
            channels.close();
        } catch (IOException e) {
            MiniParRuntimeException err = new MiniParRuntimeException(Kind.CHANNEL, -1,
                    "failed to close channels: " + e.getMessage(), e);
            if (failure == null) throw err;
            failure.addSuppressed(err);
        }
    }

    private static MiniParRuntimeException misplaced(ControlResult r, String where) {
        String what = (r.kind == ControlResult.Kind.RETURN) ? "outside of a function" : "outside of a loop";
        return new MiniParRuntimeException(Kind.MISPLACED_CONTROL, r.line,
                "'" + r.keyword() + "' " + what + " (" + where + ")");
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public ControlResult visitModuleStmt(Module stmt) {
        return executeBody(stmt.statements);
    }

    @Override
    public ControlResult visitAssignStmt(Assign stmt) {
        Value value = evaluate(stmt.value);
        if (stmt.target.declaration) {
            scopes.declare(stmt.target.name(), value);
        } else {
            scopes.assign(stmt.target.name(), value);
        }
        return ControlResult.NORMAL;
    }

    @Override
    public ControlResult visitIfStmt(If stmt) {
        List<Stmt> branch = evaluate(stmt.condition).isTruthy() ? stmt.body : stmt.elseBody;
        if (branch.isEmpty()) return ControlResult.NORMAL;
        return executeBlock(branch);
    }

    @Override
    public ControlResult visitWhileStmt(While stmt) {
        while (evaluate(stmt.condition).isTruthy()) {
            ControlResult r = executeBlock(stmt.body);
            if (r.kind == ControlResult.Kind.BREAK) break;
            if (r.kind == ControlResult.Kind.RETURN) return r;
        }
        return ControlResult.NORMAL;
    }

    @Override
    public ControlResult visitFuncDefStmt(FuncDef stmt) {
        String name = stmt.name.lexeme;
        if (builtins.containsKey(name)) {
            throw new MiniParRuntimeException(Kind.BUILTIN_REDEFINITION, stmt.line(),
                    "Cannot redefine builtin function '" + name + "'");
        }
        functions.put(name, new UserFunction(stmt));
        return ControlResult.NORMAL;
    }

    @Override
    public ControlResult visitSeqStmt(Seq stmt) {
        return executeBlock(stmt.body);
    }

    @Override
    public ControlResult visitParStmt(Par stmt) {
        List<Stmt> branches = stmt.body;
        if (branches.isEmpty()) return ControlResult.NORMAL;

        int line = stmt.line();
        Debug.get().d(Debug.TAG_PAR, "PAR at line " + line + ": forking " + branches.size() + " branches");

        ExecutorService pool = Executors.newFixedThreadPool(branches.size(), r -> {
            Thread t = new Thread(r, "minipar-par-" + PAR_THREAD_IDS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<?>> futures = new ArrayList<>(branches.size());
            for (Stmt branch : branches) {
                Interpreter child = fork();
                futures.add(pool.submit(() -> child.runToCompletion(branch, "in a PAR branch")));
            }

            List<Throwable> failures = new ArrayList<>();
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MiniParRuntimeException(Kind.BRANCH_FAILURE, line,
                            "interrupted while joining PAR branches", e);
                }
            }

            if (!failures.isEmpty()) {
                MiniParRuntimeException aggregate = new MiniParRuntimeException(Kind.BRANCH_FAILURE, line,
                        failures.size() + " of " + branches.size() + " PAR branches failed; first: "
                                + failures.get(0).getMessage());
                for (Throwable t : failures) aggregate.addSuppressed(t);
                Debug.get().w(Debug.TAG_PAR, aggregate.getMessage());
                throw aggregate;
            }
        } finally {
            pool.shutdownNow();
        }

        Debug.get().d(Debug.TAG_PAR, "PAR at line " + line + ": joined " + branches.size() + " branches");
        return ControlResult.NORMAL;
    }

    /** Branch interpreter: cloned scopes and functions, its own channel table. */
    private Interpreter fork() {
        return new Interpreter(scopes.snapshot(), new LinkedHashMap<>(functions), options, hostFunctions);
    }

    @Override
    public ControlResult visitClientChannelStmt(ClientChannelDecl stmt) {
        String name = stmt.name.lexeme;
        String host = unquote(channelOperand(stmt.host).stringify());
        int port = portOf(channelOperand(stmt.port), stmt.line());
        try {
            channels.put(name, ClientChannel.connect(name, host, port, options.channels));
        } catch (IOException e) {
            throw new MiniParRuntimeException(Kind.CHANNEL, stmt.line(),
                    "Cannot open channel '" + name + "' to " + host + ":" + port + ": " + e.getMessage(), e);
        }
        return ControlResult.NORMAL;
    }

    @Override
    public ControlResult visitServerChannelStmt(ServerChannelDecl stmt) {
        String name = stmt.name.lexeme;
        String handler = stmt.handler.lexeme;
        int line = stmt.line();
        if (!functions.containsKey(handler) && !builtins.containsKey(handler)) {
            throw new MiniParRuntimeException(Kind.UNDEFINED_FUNCTION, line,
                    "Server channel '" + name + "' handler '" + handler + "' is not defined");
        }

        String host = unquote(channelOperand(stmt.host).stringify());
        int port = portOf(channelOperand(stmt.port), line);
        ServerChannel server = new ServerChannel(name, host, port, options.channels);
        try {
            server.serve(
                    () -> {
                        Value d = evaluate(stmt.description);
                        return (d.getType() == Value.Type.NULL) ? null : d.stringify();
                    },
                    request -> invoke(handler, Collections.singletonList(Value.string(request)), line).stringify());
        } catch (IOException e) {
            throw new MiniParRuntimeException(Kind.CHANNEL, line,
                    "Server channel '" + name + "' on " + host + ":" + port + " failed: " + e.getMessage(), e);
        }
        return ControlResult.NORMAL;
    }

    /** Host and port operands: a bare identifier that is not a variable stands for itself. */
    private Value channelOperand(ExprNode expr) {
        if (expr instanceof Identifier) {
            Identifier id = (Identifier) expr;
            Value v = scopes.lookup(id.name());
            return (v == null) ? Value.string(id.name()) : v;
        }
        return evaluate(expr);
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) return s.substring(1, s.length() - 1);
        return s;
    }

    private static int portOf(Value v, int line) {
        Value n = toNumeric(v);
        if (n == null || n.getType() != Value.Type.INT || n.asInt() < 0 || n.asInt() > 65535) {
            throw new MiniParRuntimeException(Kind.CHANNEL, line, "Invalid port: " + v.stringify());
        }
        return (int) n.asInt();
    }

    @Override
    public ControlResult visitBreakStmt(Break stmt) {
        return ControlResult.breaking(stmt.line());
    }

    @Override
    public ControlResult visitContinueStmt(Continue stmt) {
        return ControlResult.continuing(stmt.line());
    }

    @Override
    public ControlResult visitReturnStmt(Return stmt) {
        Value value = (stmt.value == null) ? Value.nil() : evaluate(stmt.value);
        return ControlResult.returning(value, stmt.line());
    }

    @Override
    public ControlResult visitCallStmt(Call stmt) {
        evaluate(stmt);
        return ControlResult.NORMAL;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitConstantExpr(Constant expr) {
        return expr.value;
    }

    @Override
    public Value visitIdentifierExpr(Identifier expr) {
        Value v = scopes.lookup(expr.name());
        if (v == null) {
            throw new MiniParRuntimeException(Kind.UNDEFINED_VARIABLE, expr.line(),
                    "Undefined variable '" + expr.name() + "'");
        }
        return v;
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        boolean left = evaluate(expr.left).isTruthy();
        if (expr.operator.type == TokenType.OR_OR) {
            if (left) return Value.bool(true);
        } else {
            if (!left) return Value.bool(false);
        }
        return Value.bool(evaluate(expr.right).isTruthy());
    }

    @Override
    public Value visitRelationalExpr(Relational expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        return compare(expr.operator, left, right);
    }

    @Override
    public Value visitArithmeticExpr(Arithmetic expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        return arithmetic(expr.operator, left, right);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        if (expr.operator.type == TokenType.BANG) {
            return Value.bool(!right.isTruthy());
        }
        Value n = toNumeric(right);
        if (n == null) {
            throw new MiniParRuntimeException(Kind.INVALID_OPERAND, expr.line(),
                    "Operand of unary '-' must be a number, got " + right);
        }
        return (n.getType() == Value.Type.INT) ? exact(expr.operator, () -> Math.negateExact(n.asInt()))
                : Value.floating(-n.asFloat());
    }

    @Override
    public Value visitCallExpr(Call expr) {
        String name = expr.name();
        List<Value> args = new ArrayList<>(expr.arguments.size() + 1);

        if (expr.channel != null) {
            args.add(Value.string(channelName(expr.channel.lexeme)));
            for (ExprNode a : expr.arguments) args.add(evaluate(a));
        } else if (isChannelOp(name) && !expr.arguments.isEmpty()) {
            args.add(Value.string(channelNameOf(expr.arguments.get(0))));
            for (int i = 1; i < expr.arguments.size(); i++) args.add(evaluate(expr.arguments.get(i)));
        } else {
            for (ExprNode a : expr.arguments) args.add(evaluate(a));
        }
        return invoke(name, args, expr.line());
    }

    @Override
    public Value visitAccessExpr(Access expr) {
        Value base = evaluate(expr.base);
        Value index = evaluate(expr.index);
        if (base.getType() != Value.Type.STRING) {
            throw new MiniParRuntimeException(Kind.INVALID_ACCESS, expr.line(),
                    "Only strings can be indexed, got " + base);
        }
        Value i = toNumeric(index);
        if (i == null || i.getType() != Value.Type.INT) {
            throw new MiniParRuntimeException(Kind.INVALID_ACCESS, expr.line(),
                    "String index must be an int, got " + index);
        }
        String s = base.asString();
        long at = i.asInt();
        if (at < 0 || at >= s.length()) {
            throw new MiniParRuntimeException(Kind.INVALID_ACCESS, expr.line(),
                    "String index out of range: " + at + " (length " + s.length() + ")");
        }
        return Value.string(String.valueOf(s.charAt((int) at)));
    }

    // -------------------------
    // Calls
    // -------------------------

    private static boolean isChannelOp(String name) {
        return SEND.equals(name) || RECEIVE.equals(name) || CLOSE.equals(name);
    }

    /** Channel argument: an open channel's name, else the variable's value, else the name itself. */
    private String channelNameOf(ExprNode expr) {
        if (expr instanceof Identifier) return channelName(((Identifier) expr).name());
        return evaluate(expr).stringify();
    }

    private String channelName(String identifier) {
        if (channels.isOpen(identifier)) return identifier;
        Value v = scopes.lookup(identifier);
        return (v == null) ? identifier : v.stringify();
    }

    Value invoke(String name, List<Value> args, int line) {
        UserFunction fn = functions.get(name);
        if (fn != null) return callUser(fn, args, line);

        BuiltinFunction builtin = builtins.get(name);
        if (builtin == null) {
            throw new MiniParRuntimeException(Kind.UNDEFINED_FUNCTION, line, "Undefined function '" + name + "'");
        }
        try {
            Value v = builtin.call(args);
            return (v == null) ? Value.nil() : v;
        } catch (MiniParRuntimeException e) {
            if (e.getLine() >= 0) throw e;
            throw new MiniParRuntimeException(e.getKind(), line, e.getMessage(), e);
        }
    }

    private Value callUser(UserFunction fn, List<Value> args, int line) {
        if (callStack.size() >= options.maxCallDepth) {
            throw new MiniParRuntimeException(Kind.CALL_DEPTH, line,
                    "Max call depth " + options.maxCallDepth + " exceeded calling " + fn.name + "()");
        }
        CallFrame frame = new CallFrame(fn.name, args, line);
        callStack.push(frame);
        try {
            return fn.call(this, args, line);
        } catch (MiniParRuntimeException e) {
            e.addCallFrame(frame);
            throw e;
        } finally {
            callStack.pop();
        }
    }

    // -------------------------
    // Coercion and operators
    // -------------------------

    /** Numeric view of a value, or null when it has none. */
    public static Value toNumeric(Value v) {
        switch (v.getType()) {
            case INT:
            case FLOAT:
                return v;
            case BOOL:
                return Value.integer(v.asBool() ? 1 : 0);
            case NULL:
                return Value.integer(0);
            default:
                String s = v.asString().trim();
                if (!FLOAT_TEXT.matcher(s).matches()) return null;
                try {
                    return Value.integer(Long.parseLong(s));
                } catch (NumberFormatException notAnInt) {
                    return Value.floating(Double.parseDouble(s));
                }
        }
    }

    private static Value arithmetic(Token op, Value left, Value right) {
        Value l = toNumeric(left);
        Value r = toNumeric(right);
        if (l == null || r == null) {
            if (op.type == TokenType.PLUS) return Value.string(left.stringify() + right.stringify());
            throw new MiniParRuntimeException(Kind.INVALID_OPERAND, op.line,
                    "Operands of '" + op.lexeme + "' must be numbers, got " + left + " and " + right);
        }

        boolean ints = l.getType() == Value.Type.INT && r.getType() == Value.Type.INT;
        switch (op.type) {
            case PLUS:
                return ints ? exact(op, () -> Math.addExact(l.asInt(), r.asInt()))
                        : Value.floating(l.asDouble() + r.asDouble());
            case MINUS:
                return ints ? exact(op, () -> Math.subtractExact(l.asInt(), r.asInt()))
                        : Value.floating(l.asDouble() - r.asDouble());
            case STAR:
                return ints ? exact(op, () -> Math.multiplyExact(l.asInt(), r.asInt()))
                        : Value.floating(l.asDouble() * r.asDouble());
            case SLASH: {
                if (r.asDouble() == 0.0) throw divisionByZero(op);
                if (ints && l.asInt() % r.asInt() == 0) {
                    return exact(op, () -> exactQuotient(l.asInt(), r.asInt()));
                }
                return demote(l.asDouble() / r.asDouble());
            }
            case PERCENT: {
                if (r.asDouble() == 0.0) throw divisionByZero(op);
                if (ints) return Value.integer(Math.floorMod(l.asInt(), r.asInt()));
                double a = l.asDouble();
                double b = r.asDouble();
                return Value.floating(a - b * Math.floor(a / b));
            }
            default:
                throw new MiniParRuntimeException(Kind.INVALID_OPERAND, op.line, "Unknown operator " + op.lexeme);
        }
    }

    private interface LongOp {
        long apply();
    }

    /** Int results that do not fit a long are errors rather than wrapping. */
    private static Value exact(Token op, LongOp body) {
        try {
            return Value.integer(body.apply());
        } catch (ArithmeticException e) {
            throw new MiniParRuntimeException(Kind.INVALID_OPERAND, op.line,
                    "integer overflow in '" + op.lexeme + "'", e);
        }
    }

    private static long exactQuotient(long a, long b) {
        if (a == Long.MIN_VALUE && b == -1) throw new ArithmeticException("long overflow");
        return a / b;
    }

    private static MiniParRuntimeException divisionByZero(Token op) {
        return new MiniParRuntimeException(Kind.DIVISION_BY_ZERO, op.line, "division/modulo by zero");
    }

    /** Whole quotients become ints. */
    private static Value demote(double q) {
        if (!Double.isInfinite(q) && q == Math.rint(q) && Math.abs(q) < 9.0e18) {
            return Value.integer((long) q);
        }
        return Value.floating(q);
    }

    private static Value compare(Token op, Value left, Value right) {
        Value l = toNumeric(left);
        Value r = toNumeric(right);
        int c;
        if (l != null && r != null) {
            c = compareNumbers(l, r);
        } else if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
            c = left.asString().compareTo(right.asString());
        } else if (op.type == TokenType.EQUAL_EQUAL) {
            return Value.bool(false);
        } else if (op.type == TokenType.BANG_EQUAL) {
            return Value.bool(true);
        } else {
            throw new MiniParRuntimeException(Kind.INVALID_OPERAND, op.line,
                    "Cannot order " + left + " and " + right + " with '" + op.lexeme + "'");
        }

        switch (op.type) {
            case EQUAL_EQUAL: return Value.bool(c == 0);
            case BANG_EQUAL: return Value.bool(c != 0);
            case LESS: return Value.bool(c < 0);
            case LESS_EQUAL: return Value.bool(c <= 0);
            case GREATER: return Value.bool(c > 0);
            case GREATER_EQUAL: return Value.bool(c >= 0);
            default:
                throw new MiniParRuntimeException(Kind.INVALID_OPERAND, op.line, "Unknown operator " + op.lexeme);
        }
    }

    private static int compareNumbers(Value l, Value r) {
        if (l.getType() == Value.Type.INT && r.getType() == Value.Type.INT) {
            return Long.compare(l.asInt(), r.asInt());
        }
        double a = l.asDouble();
        double b = r.asDouble();
        return (a < b) ? -1 : (a > b) ? 1 : 0;
    }

    // -------------------------
    // Core builtins
    // -------------------------

    private void registerCoreBuiltins() {
        BuiltinFunction print = args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(args.get(i).stringify());
            }
            options.out.println(sb);
            return Value.nil();
        };
        builtins.put("print", print);
        builtins.put("output", print);
        builtins.put("input", this::input);

        builtins.put("to_number", args -> {
            expectArgs("to_number", args, 1, 1);
            Value n = toNumeric(args.get(0));
            if (n == null) {
                throw new MiniParRuntimeException(Kind.INVALID_OPERAND, "to_number: not a number: " + args.get(0));
            }
            return n;
        });
        builtins.put("to_string", args -> {
            expectArgs("to_string", args, 1, 1);
            return Value.string(args.get(0).stringify());
        });
        builtins.put("to_bool", args -> {
            expectArgs("to_bool", args, 1, 1);
            Value v = args.get(0);
            if (v.getType() == Value.Type.STRING) {
                if ("true".equals(v.asString())) return Value.bool(true);
                if ("false".equals(v.asString())) return Value.bool(false);
            }
            return Value.bool(v.isTruthy());
        });
        builtins.put("len", args -> {
            expectArgs("len", args, 1, 1);
            Value v = args.get(0);
            if (v.getType() != Value.Type.STRING) {
                throw new MiniParRuntimeException(Kind.INVALID_OPERAND, "len() expects a string, got " + v);
            }
            return Value.integer(v.asString().length());
        });
        builtins.put("isalpha", args -> {
            expectArgs("isalpha", args, 1, 1);
            String s = args.get(0).stringify();
            return Value.bool(!s.isEmpty() && s.chars().allMatch(Character::isLetter));
        });
        builtins.put("isnum", args -> {
            expectArgs("isnum", args, 1, 1);
            String s = args.get(0).stringify();
            return Value.bool(!s.isEmpty() && s.chars().allMatch(Character::isDigit));
        });
        builtins.put("sleep", args -> {
            expectArgs("sleep", args, 1, 1);
            Value secs = toNumeric(args.get(0));
            if (secs == null || secs.asDouble() < 0) {
                throw new MiniParRuntimeException(Kind.INVALID_OPERAND, "sleep() expects a non-negative number");
            }
            try {
                Thread.sleep((long) (secs.asDouble() * 1000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MiniParRuntimeException(Kind.IO, -1, "sleep interrupted", e);
            }
            return Value.nil();
        });

        builtins.put(SEND, args -> {
            expectArgs(SEND, args, 2, 2);
            ChannelConnection conn = openChannel(args.get(0));
            try {
                return Value.string(conn.request(args.get(1).stringify()));
            } catch (IOException e) {
                throw new MiniParRuntimeException(Kind.CHANNEL, -1,
                        "send on channel '" + conn.name() + "' failed: " + e.getMessage(), e);
            }
        });
        builtins.put(RECEIVE, args -> {
            expectArgs(RECEIVE, args, 1, 1);
            ChannelConnection conn = openChannel(args.get(0));
            String msg;
            try {
                msg = conn.read();
            } catch (IOException e) {
                throw new MiniParRuntimeException(Kind.CHANNEL, -1,
                        "receive on channel '" + conn.name() + "' failed: " + e.getMessage(), e);
            }
            if (msg == null) {
                throw new MiniParRuntimeException(Kind.CHANNEL, "Channel '" + conn.name() + "' closed by peer");
            }
            return Value.string(msg);
        });
        builtins.put(CLOSE, args -> {
            expectArgs(CLOSE, args, 1, 1);
            String name = args.get(0).stringify();
            boolean wasOpen;
            try {
                wasOpen = channels.close(name);
            } catch (IOException e) {
                throw new MiniParRuntimeException(Kind.CHANNEL, -1,
                        "close of channel '" + name + "' failed: " + e.getMessage(), e);
            }
            if (!wasOpen) throw new MiniParRuntimeException(Kind.CHANNEL, "Channel '" + name + "' is not open");
            return Value.nil();
        });
    }

    private ChannelConnection openChannel(Value name) {
        ChannelConnection conn = channels.get(name.stringify());
        if (conn == null) {
            throw new MiniParRuntimeException(Kind.CHANNEL, "Channel '" + name.stringify() + "' is not open");
        }
        return conn;
    }

    private Value input(List<Value> args) {
        expectArgs("input", args, 0, 1);
        if (args.size() == 1) {
            options.out.print(args.get(0).stringify());
            options.out.flush();
        }
        String line;
        try {
            synchronized (options.in) {
                line = options.in.readLine();
            }
        } catch (IOException e) {
            throw new MiniParRuntimeException(Kind.IO, -1, "input failed: " + e.getMessage(), e);
        }
        if (line == null) return Value.string("");
        Value n = toNumeric(Value.string(line));
        return (n == null) ? Value.string(line) : n;
    }

    private static void expectArgs(String name, List<Value> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = (min == max) ? String.valueOf(min) : min + ".." + max;
            throw new MiniParRuntimeException(Kind.ARITY,
                    name + "() expects " + expected + " arguments, got " + args.size());
        }
    }
}
