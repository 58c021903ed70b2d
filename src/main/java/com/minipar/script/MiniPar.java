package com.minipar.script;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.minipar.debug.Debug;
import com.minipar.script.channel.ChannelSettings;
import com.minipar.script.channel.Framing;
import com.minipar.script.parser.Interpreter;
import com.minipar.script.parser.InterpreterOptions;
import com.minipar.script.parser.Lexer;
import com.minipar.script.parser.MiniParException;
import com.minipar.script.parser.Parser;
import com.minipar.script.parser.SemanticAnalyzer;
import com.minipar.script.parser.Statement.Module;
import com.minipar.script.parser.SyntaxException;
import com.minipar.script.parser.Token;
import com.minipar.script.parser.Value;
import com.minipar.script.plugins.MiniParMathPlugin;

/**
 * MiniPar engine.
 *
 * - Pipeline: scan -> parse -> check -> run, each step usable on its own
 * - Types: int, float, bool, string (dynamic, with numeric coercion)
 * - Blocks: SEQ (in order) and PAR (one thread per statement, joined at block end)
 * - Channels: c_channel (TCP client), s_channel (TCP request/reply server)
 * - Function calls:
 *     - Core builtins (print, input, send, ...) and host functions registered via registerFunction
 *     - User functions (function name(a, b = 1) { ...; return ...; })
 *
 * Errors are reported to the {@link Debug} hub and then rethrown to the host.
 */
public class MiniPar {

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<String, BuiltinFunction>();
    private PrintStream out = System.out;
    private BufferedReader in = null;
    private int maxCallDepth = InterpreterOptions.DEFAULT_MAX_CALL_DEPTH;
    private Framing framing = Framing.RAW;
    private int receiveBufferSize = ChannelSettings.DEFAULT_RECEIVE_BUFFER;
    private int maxServerConnections = ChannelSettings.DEFAULT_MAX_SERVER_CONNECTIONS;
    private int connectAttempts = ChannelSettings.DEFAULT_CONNECT_ATTEMPTS;
    private long connectRetryDelayMillis = ChannelSettings.DEFAULT_CONNECT_RETRY_DELAY_MILLIS;

    public MiniPar() {
        MiniParMathPlugin.register(this);
    }

    // ===================== CONFIGURATION =====================

    public void setOutput(PrintStream out) { this.out = (out == null) ? System.out : out; }

    public void setInput(BufferedReader in) { this.in = in; }

    public void setInput(Reader reader) {
        this.in = (reader == null) ? null
                : (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);
    }

    public void setMaxCallDepth(int depth) { this.maxCallDepth = depth; }

    public void setChannelFraming(Framing framing) { this.framing = (framing == null) ? Framing.RAW : framing; }

    public void setReceiveBufferSize(int bytes) { this.receiveBufferSize = bytes; }

    /** 0 keeps a server channel accepting forever. */
    public void setMaxServerConnections(int max) { this.maxServerConnections = max; }

    public void setConnectAttempts(int attempts) { this.connectAttempts = attempts; }

    public void setConnectRetryDelayMillis(long millis) { this.connectRetryDelayMillis = millis; }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    /** Freezes the current settings for one run. */
    public InterpreterOptions options() {
        ChannelSettings channels = new ChannelSettings(framing, receiveBufferSize, maxServerConnections,
                connectAttempts, connectRetryDelayMillis);
        return new InterpreterOptions(out, in, maxCallDepth, channels);
    }

    // ===================== PIPELINE =====================

    public List<Token> scan(String source) {
        return guarded("scan", () -> new Lexer(source).tokenize());
    }

    public Module parse(List<Token> tokens) {
        return guarded("parse", () -> new Parser(tokens).parse());
    }

    public void check(Module module) {
        guarded("check", () -> {
            new SemanticAnalyzer().check(module);
            return null;
        });
    }

    public Interpreter run(Module module) {
        return guarded("run", () -> {
            Interpreter interpreter = new Interpreter(options(), functions);
            interpreter.run(module);
            return interpreter;
        });
    }

    /** scan + parse + check + run; returns the root frame after the run. */
    public Map<String, Value> execute(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        Module module = parse(scan(source));
        check(module);
        return run(module).globals();
    }

    /** Parses in recovering mode and returns every syntax error found. */
    public List<SyntaxException> diagnose(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        List<Token> tokens = scan(source);
        Parser parser = new Parser(tokens, Parser.Mode.RECOVER);
        parser.parse();
        return parser.errors();
    }

    private interface Step<T> {
        T get();
    }

    private static <T> T guarded(String step, Step<T> body) {
        try {
            return body.get();
        } catch (MiniParException e) {
            Debug.get().e(Debug.TAG_ENGINE, step + " failed: " + e.getMessage(), e);
            throw e;
        }
    }
}
