package com.signals.arena.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigInteger;

/**
 * A decoded client frame. Field accessors raise {@link ProtocolException} so handlers can read
 * required values without repeating null checks.
 */
public record InboundMessage(InboundMessageType type, JsonNode payload) {

    public InboundMessage {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }

    public String requireText(String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw ProtocolException.missingField(field);
        }
        return node.asText().trim();
    }

    public String optionalText(String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().trim();
    }

    public long requireLong(String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            throw ProtocolException.missingField(field);
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException ex) {
                throw ProtocolException.invalidField(field, "must be an integer");
            }
        }
        throw ProtocolException.invalidField(field, "must be an integer");
    }

    public BigInteger requireAmount(String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            throw ProtocolException.missingField(field);
        }
        try {
            if (node.isIntegralNumber()) {
                return node.bigIntegerValue();
            }
            if (node.isTextual()) {
                return new BigInteger(node.asText().trim());
            }
        } catch (NumberFormatException ex) {
            throw ProtocolException.invalidField(field, "must be an integer amount");
        }
        throw ProtocolException.invalidField(field, "must be an integer amount");
    }
}
