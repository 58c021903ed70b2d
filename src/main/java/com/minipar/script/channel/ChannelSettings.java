package com.minipar.script.channel;

/** Socket behaviour shared by every channel an interpreter opens. */
public final class ChannelSettings {
    public static final int DEFAULT_RECEIVE_BUFFER = 2048;
    public static final int DEFAULT_MAX_SERVER_CONNECTIONS = 1;
    public static final int DEFAULT_CONNECT_ATTEMPTS = 1;
    public static final long DEFAULT_CONNECT_RETRY_DELAY_MILLIS = 200;

    public final Framing framing;
    public final int receiveBufferSize;
    /** Connections a server channel accepts before it stops; 0 means no limit. */
    public final int maxServerConnections;
    public final int connectAttempts;
    public final long connectRetryDelayMillis;

    public ChannelSettings(Framing framing, int receiveBufferSize, int maxServerConnections,
                           int connectAttempts, long connectRetryDelayMillis) {
        if (receiveBufferSize <= 0) throw new IllegalArgumentException("receiveBufferSize must be > 0");
        if (maxServerConnections < 0) throw new IllegalArgumentException("maxServerConnections must be >= 0");
        if (connectAttempts <= 0) throw new IllegalArgumentException("connectAttempts must be > 0");
        if (connectRetryDelayMillis < 0) throw new IllegalArgumentException("connectRetryDelayMillis must be >= 0");
        this.framing = (framing == null) ? Framing.RAW : framing;
        this.receiveBufferSize = receiveBufferSize;
        this.maxServerConnections = maxServerConnections;
        this.connectAttempts = connectAttempts;
        this.connectRetryDelayMillis = connectRetryDelayMillis;
    }

    public static ChannelSettings defaults() {
        return new ChannelSettings(Framing.RAW, DEFAULT_RECEIVE_BUFFER, DEFAULT_MAX_SERVER_CONNECTIONS,
                DEFAULT_CONNECT_ATTEMPTS, DEFAULT_CONNECT_RETRY_DELAY_MILLIS);
    }
}
