package com.signals.arena.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;

/**
 * JSON envelope codec for the real-time channel: {@code {type, payload, timestamp}}.
 */
@Component
public class ArenaMessageCodec {

    private final ObjectMapper objectMapper;

    public ArenaMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ArenaEventType type, Object payload, Instant timestamp) {
        try {
            return objectMapper.writeValueAsString(new OutboundEnvelope(type, payload, timestamp.toEpochMilli()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + type + " event", ex);
        }
    }

    public InboundMessage decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw ProtocolException.malformed("Message is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw ProtocolException.malformed("Message must be a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw ProtocolException.missingField("type");
        }

        String rawType = typeNode.asText().trim().toUpperCase(Locale.ROOT);
        InboundMessageType type;
        try {
            type = InboundMessageType.valueOf(rawType);
        } catch (IllegalArgumentException ex) {
            throw ProtocolException.unknownType(typeNode.asText());
        }
        if (type == InboundMessageType.DISCONNECT) {
            throw ProtocolException.unknownType(typeNode.asText());
        }

        JsonNode payload = root.get("payload");
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw ProtocolException.malformed("payload must be a JSON object");
        }
        return new InboundMessage(type, payload);
    }

    public record OutboundEnvelope(ArenaEventType type, Object payload, long timestamp) {
    }
}
