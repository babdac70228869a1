package com.signals.arena.ws;

import lombok.Getter;

/**
 * An inbound frame that could not be understood. Answered with {@code ERROR}; the connection stays open.
 */
@Getter
public class ProtocolException extends RuntimeException {

    private final String code;

    public ProtocolException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static ProtocolException malformed(String detail) {
        return new ProtocolException("malformed_message", detail);
    }

    public static ProtocolException unknownType(String type) {
        return new ProtocolException("unknown_type", "Unknown message type: " + type);
    }

    public static ProtocolException missingField(String field) {
        return new ProtocolException("missing_field", "Field '" + field + "' is required");
    }

    public static ProtocolException invalidField(String field, String detail) {
        return new ProtocolException("invalid_field", "Field '" + field + "' " + detail);
    }
}
