package com.minipar.script.channel;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;

import com.minipar.debug.Debug;

/** Outbound side of {@code c_channel}: a blocking TCP connect with optional retries. */
public final class ClientChannel {

    private ClientChannel() {}

    public static ChannelConnection connect(String name, String host, int port, ChannelSettings settings)
            throws IOException {
        IOException last = null;
        for (int attempt = 1; attempt <= settings.connectAttempts; attempt++) {
            Socket socket = new Socket();
            try {
                socket.connect(new InetSocketAddress(host, port));
                Debug.get().i(Debug.TAG_CHANNEL, "client '" + name + "' connected to " + host + ":" + port);
                return new ChannelConnection(name, socket, settings);
            } catch (IOException e) {
                socket.close();
                last = e;
                Debug.get().d(Debug.TAG_CHANNEL, "client '" + name + "' connect attempt " + attempt + "/"
                        + settings.connectAttempts + " failed: " + e.getMessage());
            }
            if (attempt < settings.connectAttempts) pause(settings.connectRetryDelayMillis);
        }
        throw last;
    }

    private static void pause(long millis) throws InterruptedIOException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting to reconnect");
        }
    }
}
