package com.minipar.script.channel;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.minipar.debug.Debug;

/**
 * Channel name to open connection, owned by a single interpreter. Never shared
 * between threads: every PAR branch starts with its own empty table.
 */
public final class ChannelTable implements Closeable {
    private final Map<String, ChannelConnection> open = new LinkedHashMap<>();

    /** Stores the connection, closing any previous one registered under the same name. */
    public void put(String name, ChannelConnection connection) throws IOException {
        ChannelConnection previous = open.put(name, connection);
        if (previous != null && previous != connection) {
            Debug.get().i(Debug.TAG_CHANNEL, "replacing channel '" + name + "'");
            previous.close();
        }
    }

    public boolean isOpen(String name) {
        ChannelConnection c = open.get(name);
        return c != null && !c.isClosed();
    }

    /** The open connection for the name, or null. */
    public ChannelConnection get(String name) {
        ChannelConnection c = open.get(name);
        return (c == null || c.isClosed()) ? null : c;
    }

    /** Closes and forgets the channel; false when it was not open. */
    public boolean close(String name) throws IOException {
        ChannelConnection c = open.remove(name);
        if (c == null) return false;
        boolean wasOpen = !c.isClosed();
        c.close();
        Debug.get().i(Debug.TAG_CHANNEL, "closed channel '" + name + "'");
        return wasOpen;
    }


    /** Closes every remaining channel; the first failure is rethrown after all were tried. */
    @Override
    public void close() throws IOException {
        IOException first = null;
        List<ChannelConnection> all = new ArrayList<>(open.values());
        open.clear();
        for (ChannelConnection c : all) {
            try {
                c.close();
            } catch (IOException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
