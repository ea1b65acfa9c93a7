package com.ctm.server.live;

import io.netty.channel.Channel;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of open live connections, one table per {@link ConnectionRole}.
 *
 * Accessed from every Netty I/O thread; mutations and snapshots are protected by
 * simple synchronized blocks (low contention: connects/disconnects are rare).
 * No I/O happens while the lock is held.
 *
 * Ids come from a monotonic counter and are never reused within the process, so an id
 * is present in at most one table.
 */
public final class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<ConnectionRole, Object2ObjectLinkedOpenHashMap<String, LiveConnection>> tables =
            new EnumMap<>(ConnectionRole.class);
    private final AtomicLong nextId = new AtomicLong(1);

    public ConnectionRegistry() {
        for (ConnectionRole role : ConnectionRole.values()) {
            tables.put(role, new Object2ObjectLinkedOpenHashMap<>());
        }
    }

    /** Assigns a fresh id to {@code channel} and records it under {@code role}. */
    public String register(ConnectionRole role, Channel channel) {
        String id = Long.toHexString(nextId.getAndIncrement());
        LiveConnection connection = new LiveConnection(id, role, channel);
        synchronized (this) {
            tables.get(role).put(id, connection);
        }
        log.debug("Registered {} {}", role, id);
        return id;
    }

    /**
     * Removes {@code id} from the {@code role} table. Safe to call more than once.
     *
     * @return true if this call removed the connection
     */
    public boolean deregister(String id, ConnectionRole role) {
        LiveConnection removed;
        synchronized (this) {
            removed = tables.get(role).remove(id);
        }
        if (removed != null) log.debug("Deregistered {} {}", role, id);
        return removed != null;
    }

    /** Point-in-time copy; safe to iterate while connections come and go. */
    public synchronized List<LiveConnection> list(ConnectionRole role) {
        return List.copyOf(tables.get(role).values());
    }

    public synchronized LiveConnection get(String id, ConnectionRole role) {
        return tables.get(role).get(id);
    }

    public synchronized int size(ConnectionRole role) {
        return tables.get(role).size();
    }
}
