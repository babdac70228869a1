package com.signals.arena.dto;

import com.signals.arena.betting.PoolState;
import com.signals.arena.match.Choice;
import com.signals.arena.match.MatchPhase;
import com.signals.arena.match.PoolOutcome;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class ArenaMatchResponses {

    private ArenaMatchResponses() {
    }

    public record MatchSummary(
            long matchId,
            long tournamentId,
            String agentA,
            String agentB,
            MatchPhase phase,
            Instant phaseDeadline,
            boolean agentACommitted,
            boolean agentBCommitted,
            Instant createdAt
    ) {
    }

    public record MatchDetail(
            long matchId,
            long tournamentId,
            String agentA,
            String agentB,
            MatchPhase phase,
            Instant phaseDeadline,
            boolean agentACommitted,
            boolean agentBCommitted,
            List<MessageLine> messages,
            MatchResultView result,
            String settlementTxRef,
            Instant createdAt,
            Instant completedAt
    ) {
    }

    public record MessageLine(
            String from,
            String message,
            Instant sentAt
    ) {
    }

    public record MatchResultView(
            PoolOutcome outcome,
            Choice choiceA,
            Choice choiceB,
            int pointsA,
            int pointsB,
            boolean forfeitA,
            boolean forfeitB
    ) {
    }

    public record PoolOdds(
            long matchId,
            PoolState state,
            BigInteger totalPool,
            Map<PoolOutcome, BigDecimal> odds
    ) {
    }

    public record PoolDetail(
            long matchId,
            PoolState state,
            BigInteger totalPool,
            Map<PoolOutcome, BigInteger> stakes,
            int betCount,
            PoolOutcome winningOutcome,
            boolean refunded,
            List<PayoutLine> payouts
    ) {
    }

    public record PayoutLine(
            String bettor,
            PoolOutcome outcome,
            BigInteger stake,
            BigInteger payout
    ) {
    }
}
