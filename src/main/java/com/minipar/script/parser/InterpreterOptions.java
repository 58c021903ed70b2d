package com.minipar.script.parser;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import com.minipar.script.channel.ChannelSettings;

/**
 * Settings frozen for one run. Shared as-is by PAR branches, so everything here is
 * either immutable or safe to use from several threads.
 */
public final class InterpreterOptions {
    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    public final PrintStream out;
    public final BufferedReader in;
    public final int maxCallDepth;
    public final ChannelSettings channels;

    public InterpreterOptions(PrintStream out, BufferedReader in, int maxCallDepth, ChannelSettings channels) {
        if (maxCallDepth <= 0) throw new IllegalArgumentException("maxCallDepth must be > 0");
        this.out = (out == null) ? System.out : out;
        this.in = (in == null) ? new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)) : in;
        this.maxCallDepth = maxCallDepth;
        this.channels = (channels == null) ? ChannelSettings.defaults() : channels;
    }

    public static InterpreterOptions defaults() {
        return new InterpreterOptions(null, null, DEFAULT_MAX_CALL_DEPTH, null);
    }
}
