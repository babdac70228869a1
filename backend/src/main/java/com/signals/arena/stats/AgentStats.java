package com.signals.arena.stats;

import com.signals.arena.match.Choice;
import lombok.Getter;

import java.time.Instant;

/**
 * Lifetime counters for one agent address. Survives match eviction.
 */
@Getter
public class AgentStats {

    private final String address;
    private int matchesPlayed;
    private int splits;
    private int steals;
    private int forfeits;
    private int totalPoints;
    private int tournamentMatches;
    private Instant lastMatchAt;

    public AgentStats(String address) {
        this.address = address;
    }

    void record(Choice revealedChoice, boolean forfeited, int points, boolean tournamentMatch, Instant completedAt) {
        matchesPlayed++;
        totalPoints += points;
        if (forfeited) {
            forfeits++;
        } else if (revealedChoice == Choice.SPLIT) {
            splits++;
        } else if (revealedChoice == Choice.STEAL) {
            steals++;
        }
        if (tournamentMatch) {
            tournamentMatches++;
        }
        lastMatchAt = completedAt;
    }
}
