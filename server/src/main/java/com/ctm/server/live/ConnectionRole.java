package com.ctm.server.live;

/**
 * Which side of the live channel a connection speaks for.
 */
public enum ConnectionRole {
    /** Dashboard viewer receiving broadcast updates. */
    SUBSCRIBER("subscriber"),
    /** Upstream producer pushing events into the server. */
    SOURCE("source");

    public final String queryValue;

    ConnectionRole(String queryValue) { this.queryValue = queryValue; }

    /** Null when the value names no role. */
    public static ConnectionRole fromQuery(String value) {
        for (ConnectionRole r : values()) {
            if (r.queryValue.equalsIgnoreCase(value)) return r;
        }
        return null;
    }
}
