package com.signals.arena.match;

import java.util.Locale;

/**
 * The four mutually exclusive match results. Each carries the payoff it awards and the effective
 * pair of choices that produces it.
 */
public enum PoolOutcome {
    BOTH_SPLIT(0, Choice.SPLIT, Choice.SPLIT, 3, 3),
    AGENT_A_STEALS(1, Choice.STEAL, Choice.SPLIT, 5, 0),
    AGENT_B_STEALS(2, Choice.SPLIT, Choice.STEAL, 0, 5),
    BOTH_STEAL(3, Choice.STEAL, Choice.STEAL, 0, 0);

    private final int code;
    private final Choice choiceA;
    private final Choice choiceB;
    private final int pointsA;
    private final int pointsB;

    PoolOutcome(int code, Choice choiceA, Choice choiceB, int pointsA, int pointsB) {
        this.code = code;
        this.choiceA = choiceA;
        this.choiceB = choiceB;
        this.pointsA = pointsA;
        this.pointsB = pointsB;
    }

    public int code() {
        return code;
    }

    public Choice choiceA() {
        return choiceA;
    }

    public Choice choiceB() {
        return choiceB;
    }

    public int pointsA() {
        return pointsA;
    }

    public int pointsB() {
        return pointsB;
    }

    public static PoolOutcome of(Choice choiceA, Choice choiceB) {
        if (choiceA == null || choiceB == null) {
            throw new IllegalArgumentException("Both choices are required");
        }
        for (PoolOutcome outcome : values()) {
            if (outcome.choiceA == choiceA && outcome.choiceB == choiceB) {
                return outcome;
            }
        }
        throw new IllegalStateException("No outcome for " + choiceA + "/" + choiceB);
    }

    /**
     * A forfeiting agent is treated as the victim of a steal by its compliant opponent;
     * when both forfeit the match resolves as both stealing.
     */
    public static PoolOutcome resolve(Choice choiceA, boolean forfeitA, Choice choiceB, boolean forfeitB) {
        if (forfeitA && forfeitB) {
            return BOTH_STEAL;
        }
        if (forfeitB) {
            return AGENT_A_STEALS;
        }
        if (forfeitA) {
            return AGENT_B_STEALS;
        }
        return of(choiceA, choiceB);
    }

    public static PoolOutcome fromCode(int code) {
        for (PoolOutcome outcome : values()) {
            if (outcome.code == code) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown outcome code: " + code);
    }

    public static PoolOutcome parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Outcome is required");
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            return fromCode(Integer.parseInt(value));
        }
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown outcome: " + raw);
        }
    }
}
