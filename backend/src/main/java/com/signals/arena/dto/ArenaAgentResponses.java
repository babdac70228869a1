package com.signals.arena.dto;

import com.signals.arena.match.Choice;
import com.signals.arena.match.MatchPhase;
import com.signals.arena.match.PoolOutcome;

import java.math.BigInteger;
import java.time.Instant;

public final class ArenaAgentResponses {

    private ArenaAgentResponses() {
    }

    public record AgentStatus(
            String address,
            boolean connected,
            String displayName,
            boolean queued,
            boolean tournamentQueued,
            Long currentMatchId,
            MatchPhase currentMatchPhase,
            Long currentTournamentId
    ) {
    }

    public record AgentStats(
            String address,
            int matchesPlayed,
            int splits,
            int steals,
            int forfeits,
            int totalPoints,
            int tournamentMatches,
            Instant lastMatchAt
    ) {
    }

    public record AgentMatch(
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

    public record LeaderboardEntry(
            int rank,
            String address,
            int totalPoints,
            int matchesPlayed,
            int splits,
            int steals,
            int forfeits
    ) {
    }

    public record BettorBet(
            long matchId,
            PoolOutcome outcome,
            BigInteger amount,
            Instant placedAt,
            BigInteger payout,
            boolean settled
    ) {
    }
}
