package com.minipar.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global log hub shared by the lexer, interpreter and channel code.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - No-op until a sink is installed, so embedding hosts stay quiet
 * - Messages below the minimum level are dropped before reaching the sink
 */
public final class Debug {

    public static final String TAG_ENGINE = "minipar.engine";
    public static final String TAG_PAR = "minipar.par";
    public static final String TAG_CHANNEL = "minipar.channel";

    private static final Debug INSTANCE = new Debug();

    private static final DebugSink NOOP = (level, tag, message, error) -> {
    };

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel minLevel = DebugLevel.INFO;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setMinLevel(DebugLevel level) {
        this.minLevel = (level == null) ? DebugLevel.INFO : level;
    }

    public DebugLevel getMinLevel() {
        return minLevel;
    }

    /** Installs a sink that writes one line per message to stderr. */
    public static void useSysErr() {
        INSTANCE.setSink(printing(System.err));
    }

    public static DebugSink printing(PrintStream out) {
        return (level, tag, message, error) -> {
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public boolean isEnabled(DebugLevel level) {
        return level.ordinal() >= minLevel.ordinal();
    }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!isEnabled(level)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
