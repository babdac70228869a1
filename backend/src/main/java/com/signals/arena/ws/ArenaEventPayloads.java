package com.signals.arena.ws;

import com.signals.arena.betting.PoolState;
import com.signals.arena.match.Choice;
import com.signals.arena.match.MatchPhase;
import com.signals.arena.match.PoolOutcome;
import com.signals.arena.tournament.TournamentPhase;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Payload shapes of outbound real-time events, keyed by {@link ArenaEventType}.
 */
public final class ArenaEventPayloads {

    private ArenaEventPayloads() {
    }

    public record AuthChallenge(
            String challengeId,
            String nonce,
            String message,
            Instant expiresAt
    ) {
    }

    public record AuthSuccess(
            String address,
            String name,
            ConnectionRole role
    ) {
    }

    public record AuthFailed(
            String reason
    ) {
    }

    public record QueueJoined(
            String address,
            int position,
            int queueSize
    ) {
    }

    public record QueueUpdate(
            int queueSize
    ) {
    }

    public record QueueLeft(
            String address
    ) {
    }

    public record MatchStarted(
            long matchId,
            long tournamentId,
            String agentA,
            String agentAName,
            String agentB,
            String agentBName,
            MatchPhase phase,
            Instant phaseDeadline
    ) {
    }

    public record NegotiationLine(
            long matchId,
            String from,
            String fromName,
            String message,
            Instant sentAt
    ) {
    }

    public record ChoicePhaseStarted(
            long matchId,
            MatchPhase phase,
            Instant deadline
    ) {
    }

    public record SignChoice(
            long matchId,
            String address,
            String commitmentScheme,
            int splitCode,
            int stealCode,
            Instant deadline
    ) {
    }

    public record ChoiceLocked(
            long matchId,
            String agent,
            boolean agentALocked,
            boolean agentBLocked
    ) {
    }

    public record ChoiceAccepted(
            long matchId,
            String stage,
            String commitHash
    ) {
    }

    public record ChoiceTimeout(
            long matchId,
            MatchPhase phase,
            List<String> missingAgents
    ) {
    }

    public record ChoicesRevealed(
            long matchId,
            long tournamentId,
            String agentA,
            String agentB,
            Choice choiceA,
            Choice choiceB,
            int pointsA,
            int pointsB,
            PoolOutcome outcome,
            boolean forfeitA,
            boolean forfeitB
    ) {
    }

    public record MatchConfirmed(
            long matchId,
            PoolOutcome outcome,
            String txRef
    ) {
    }

    public record TournamentCreated(
            long tournamentId,
            int playerCount,
            int totalRounds
    ) {
    }

    public record TournamentInvite(
            long tournamentId,
            String address,
            List<String> players,
            int totalRounds
    ) {
    }

    public record TournamentPlayerJoined(
            long tournamentId,
            String address,
            int playerCount
    ) {
    }

    public record TournamentStarted(
            long tournamentId,
            List<String> players,
            int totalRounds
    ) {
    }

    public record RoundPairing(
            long matchId,
            String agentA,
            String agentB
    ) {
    }

    public record TournamentRoundStarted(
            long tournamentId,
            int round,
            int totalRounds,
            List<RoundPairing> pairings,
            String byeAddress
    ) {
    }

    public record TournamentUpdate(
            long tournamentId,
            TournamentPhase phase,
            int currentRound,
            int matchesRemaining,
            String detail
    ) {
    }

    public record StandingLine(
            int rank,
            String address,
            int points,
            int buchholz,
            int matchesPlayed
    ) {
    }

    public record TournamentRoundComplete(
            long tournamentId,
            int round,
            List<StandingLine> standings
    ) {
    }

    public record TournamentComplete(
            long tournamentId,
            String winner,
            List<StandingLine> standings
    ) {
    }

    public record TournamentQueueJoined(
            String address,
            int position,
            int queueSize,
            Instant registrationDeadline
    ) {
    }

    public record TournamentQueueUpdate(
            int queueSize,
            int capacity,
            int minPlayers,
            Instant registrationDeadline
    ) {
    }

    public record TournamentQueueLeft(
            String address
    ) {
    }

    public record BetPlaced(
            long matchId,
            PoolOutcome outcome,
            BigInteger amount,
            BigInteger totalPool
    ) {
    }

    public record PoolUpdate(
            long matchId,
            PoolState state,
            Map<PoolOutcome, BigInteger> stakes,
            Map<PoolOutcome, BigDecimal> odds,
            BigInteger totalPool
    ) {
    }

    public record PoolSettled(
            long matchId,
            PoolOutcome winningOutcome,
            BigInteger totalPool,
            boolean refunded,
            int payoutCount
    ) {
    }

    public record Pong(
            long serverTime
    ) {
    }

    public record Error(
            String code,
            String message
    ) {
    }
}
