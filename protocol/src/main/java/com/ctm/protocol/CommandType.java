package com.ctm.protocol;

/**
 * Inbound live-channel command kinds, keyed by the {@code cmd} field of the envelope.
 *
 * UNKNOWN covers every value this server does not recognise; peers may speak a newer
 * vocabulary, so unknown commands are accepted and ignored rather than rejected.
 */
public enum CommandType {
    /** Source pushes an event; fanned out to every subscriber. */
    EVENT("event"),
    /** Dashboard pushes a command upstream; fanned out to every source. */
    SOURCE_COMMAND("source_command"),

    UNKNOWN(null);

    public final String wireName;

    CommandType(String wireName) { this.wireName = wireName; }

    public static CommandType fromWire(String cmd) {
        for (CommandType t : values()) {
            if (t.wireName != null && t.wireName.equals(cmd)) return t;
        }
        return UNKNOWN;
    }
}
