package com.minipar.script.channel;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.function.Supplier;

import com.minipar.debug.Debug;

/**
 * Inbound side of {@code s_channel}. Binds, then serves connections one at a time:
 * an optional greeting, followed by request/reply rounds until the peer hangs up.
 */
public final class ServerChannel {

    /** Turns one request payload into the reply text. */
    public interface Handler {
        String handle(String request);
    }

    private final String name;
    private final String host;
    private final int port;
    private final ChannelSettings settings;

    public ServerChannel(String name, String host, int port, ChannelSettings settings) {
        this.name = name;
        this.host = host;
        this.port = port;
        this.settings = settings;
    }

    /**
     * Blocks until the configured number of connections has been served.
     *
     * @param greeting evaluated for each accepted connection; null or empty sends nothing
     * @return the number of connections served
     */
    public int serve(Supplier<String> greeting, Handler handler) throws IOException {
        int served = 0;
        try (ServerSocket server = new ServerSocket()) {
            server.setReuseAddress(true);
            server.bind(new InetSocketAddress(host, port));
            Debug.get().i(Debug.TAG_CHANNEL, "server '" + name + "' listening on " + host + ":" + port);

            int max = settings.maxServerConnections;
            while (max == 0 || served < max) {
                Socket socket = server.accept();
                served++;
                try (ChannelConnection conn = new ChannelConnection(name, socket, settings)) {
                    Debug.get().i(Debug.TAG_CHANNEL, "server '" + name + "' accepted " + socket.getRemoteSocketAddress());
                    String hello = greeting.get();
                    if (hello != null && !hello.isEmpty()) conn.write(hello);

                    String request;
                    while ((request = conn.read()) != null) {
                        Debug.get().t(Debug.TAG_CHANNEL, "server '" + name + "' received: " + request);
                        String reply = handler.handle(request);
                        if (reply.isEmpty() && settings.framing == Framing.RAW) {
                            Debug.get().w(Debug.TAG_CHANNEL, "server '" + name
                                    + "' handler returned an empty reply, which RAW framing cannot deliver");
                        }
                        conn.write(reply);
                    }
                }
                Debug.get().i(Debug.TAG_CHANNEL, "server '" + name + "' connection closed");
            }
        }
        return served;
    }
}
