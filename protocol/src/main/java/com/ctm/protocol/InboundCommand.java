package com.ctm.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded client → server envelope {@code {cmd, data}}.
 *
 * @param type decoded kind, UNKNOWN for unrecognised names
 * @param cmd  the raw command name as sent
 * @param data payload, a JSON null node when absent
 */
public record InboundCommand(CommandType type, String cmd, JsonNode data) {
}
