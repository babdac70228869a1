package com.signals.arena.match;

import java.util.Locale;

/**
 * The secret move of one agent. The numeric code is used in commitment preimages and on the wire.
 */
public enum Choice {
    SPLIT(1),
    STEAL(2);

    private final int code;

    Choice(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Choice fromCode(int code) {
        for (Choice choice : values()) {
            if (choice.code == code) {
                return choice;
            }
        }
        throw new IllegalArgumentException("Unknown choice code: " + code);
    }

    /**
     * Accepts either the symbolic name ({@code "split"}, {@code "STEAL"}) or the numeric code.
     */
    public static Choice parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Choice is required");
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            return fromCode(Integer.parseInt(value));
        }
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown choice: " + raw);
        }
    }
}
