package com.ctm.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts between live-channel JSON text and typed commands, and serializes
 * response bodies for the HTTP surface.
 *
 * Client → server: {@code {"cmd": <string>, "data": <any>}}
 * Server → client: {@code {"command": <string>, "data": <any>}}
 *
 * Record types serialize with snake_case field names; null fields are omitted.
 */
public final class JsonMessages {

    public static final String REGISTER       = "register";
    public static final String SNAPSHOT       = "snapshot";
    public static final String EVENT          = "event";
    public static final String SOURCE_COMMAND = "source_command";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private JsonMessages() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // ── Client → Server ──────────────────────────────────────────────────────

    public static InboundCommand parseCommand(String text) throws MalformedCommandException {
        JsonNode node = parse(text);
        if (!node.isObject()) {
            throw new MalformedCommandException("Command envelope must be a JSON object");
        }
        JsonNode cmd = node.get("cmd");
        if (cmd == null || !cmd.isTextual()) {
            throw new MalformedCommandException("Command envelope has no string 'cmd'");
        }
        JsonNode data = node.has("data") ? node.get("data") : NullNode.getInstance();
        return new InboundCommand(CommandType.fromWire(cmd.asText()), cmd.asText(), data);
    }

    public static JsonNode parse(String text) throws MalformedCommandException {
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new MalformedCommandException("Empty payload");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedCommandException("Payload is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ── Server → Client ──────────────────────────────────────────────────────

    public static String register(String connectionId) {
        return envelope(REGISTER, connectionId);
    }

    public static String snapshot(Object data) {
        return envelope(SNAPSHOT, data);
    }

    public static String event(JsonNode data) {
        return envelope(EVENT, data);
    }

    public static String sourceCommand(JsonNode data) {
        return envelope(SOURCE_COMMAND, data);
    }

    public static String envelope(String command, Object data) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("command", command);
        node.set("data", MAPPER.valueToTree(data));
        return toJson(node);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON", e);
        }
    }
}
