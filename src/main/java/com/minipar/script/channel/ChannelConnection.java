package com.minipar.script.channel;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/** One open socket plus the framing used to talk over it. */
public final class ChannelConnection implements Closeable {
    private final String name;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final Framing framing;
    private final int bufferSize;

    public ChannelConnection(String name, Socket socket, ChannelSettings settings) throws IOException {
        this.name = name;
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
        this.framing = settings.framing;
        this.bufferSize = settings.receiveBufferSize;
    }

    public String name() { return name; }

    public void write(String payload) throws IOException {
        framing.write(out, payload);
    }

    /** Next message, or null once the peer has disconnected. */
    public String read() throws IOException {
        return framing.read(in, bufferSize);
    }

    /** Writes the payload and waits for exactly one reply. */
    public String request(String payload) throws IOException {
        write(payload);
        String reply = read();
        if (reply == null) throw new EOFException("channel '" + name + "' closed by peer");
        return reply;
    }

    public boolean isClosed() {
        return socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    @Override
    public String toString() {
        return name + "->" + socket.getRemoteSocketAddress();
    }
}
