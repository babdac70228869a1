package com.signals.arena.stats;

import com.signals.arena.match.Choice;
import com.signals.arena.match.PoolOutcome;

import java.time.Instant;

/**
 * One completed match as seen from a single agent.
 */
public record MatchSummary(
        long matchId,
        long tournamentId,
        String opponent,
        Choice choice,
        Choice opponentChoice,
        PoolOutcome outcome,
        int points,
        int opponentPoints,
        boolean forfeited,
        Instant completedAt
) {
}
