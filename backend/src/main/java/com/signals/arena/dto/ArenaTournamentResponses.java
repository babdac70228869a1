package com.signals.arena.dto;

import com.signals.arena.tournament.TournamentPhase;

import java.time.Instant;
import java.util.List;

public final class ArenaTournamentResponses {

    private ArenaTournamentResponses() {
    }

    public record TournamentSummary(
            long tournamentId,
            TournamentPhase phase,
            int playerCount,
            int currentRound,
            int totalRounds,
            Instant createdAt
    ) {
    }

    public record TournamentDetail(
            long tournamentId,
            TournamentPhase phase,
            List<String> players,
            int currentRound,
            int totalRounds,
            List<RoundView> rounds,
            List<StandingView> standings,
            String cancelReason,
            Instant createdAt,
            Instant startedAt,
            Instant completedAt
    ) {
    }

    public record RoundView(
            int round,
            List<PairingView> pairings,
            String byeAddress
    ) {
    }

    public record PairingView(
            long matchId,
            String agentA,
            String agentB
    ) {
    }

    public record StandingView(
            int rank,
            String address,
            int points,
            int buchholz,
            int matchesPlayed,
            boolean hadBye
    ) {
    }

    public record TournamentQueueView(
            int queueSize,
            int capacity,
            int minPlayers,
            Instant registrationDeadline,
            List<QueueEntryView> entries
    ) {
    }

    public record QueueEntryView(
            String address,
            Instant joinedAt
    ) {
    }
}
