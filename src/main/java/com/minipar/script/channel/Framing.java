package com.minipar.script.channel;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * How one message is delimited on a channel socket. Payloads are UTF-8 text.
 */
public enum Framing {

    /**
     * No delimiting: a write sends the payload bytes as they are and a read returns
     * whatever a single socket read delivers, up to the receive buffer size.
     * A message split across TCP segments is seen as two messages.
     */
    RAW {
        @Override
        public void write(OutputStream out, String payload) throws IOException {
            out.write(payload.getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        @Override
        public String read(InputStream in, int bufferSize) throws IOException {
            byte[] buf = new byte[bufferSize];
            int n = in.read(buf);
            if (n < 0) return null;
            return new String(buf, 0, n, StandardCharsets.UTF_8);
        }
    },

    /** uint32 big-endian length followed by that many payload bytes. */
    LENGTH_PREFIXED {
        @Override
        public void write(OutputStream out, String payload) throws IOException {
            byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
            byte[] lenBuf = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(bytes.length).array();
            out.write(lenBuf);
            out.write(bytes);
            out.flush();
        }

        @Override
        public String read(InputStream in, int bufferSize) throws IOException {
            byte[] lenBuf = in.readNBytes(4);
            if (lenBuf.length == 0) return null;
            if (lenBuf.length < 4) throw new EOFException("partial length header");

            int len = ByteBuffer.wrap(lenBuf).order(ByteOrder.BIG_ENDIAN).getInt();
            if (len < 0 || len > MAX_FRAME_BYTES) {
                throw new IOException("bad frame length: " + len);
            }
            byte[] payload = in.readNBytes(len);
            if (payload.length < len) throw new EOFException("partial frame payload");
            return new String(payload, StandardCharsets.UTF_8);
        }
    };

    static final int MAX_FRAME_BYTES = 32 * 1024 * 1024;

    public abstract void write(OutputStream out, String payload) throws IOException;

    /** One message, or null when the peer has closed the stream. */
    public abstract String read(InputStream in, int bufferSize) throws IOException;

    /** Accepts {@code raw}, {@code length} and the constant names, case-insensitively. */
    public static Framing parse(String name) {
        if (name == null) throw new IllegalArgumentException("framing must not be null");
        String n = name.trim().toLowerCase(Locale.ROOT);
        switch (n) {
            case "raw":
                return RAW;
            case "length":
            case "length_prefixed":
                return LENGTH_PREFIXED;
            default:
                throw new IllegalArgumentException("Unknown framing: " + name + " (expected raw or length)");
        }
    }
}
