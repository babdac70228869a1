package com.signals.arena.dto;

import com.signals.arena.config.LedgerMode;

import java.time.Instant;

public final class ArenaStatsResponses {

    private ArenaStatsResponses() {
    }

    public record HealthResponse(
            String service,
            String status,
            Instant startedAt,
            long uptimeSeconds,
            LedgerMode ledgerMode,
            ConnectionCounts connections
    ) {
    }

    public record ConnectionCounts(
            int total,
            int agents,
            int spectators,
            int bettors,
            int authenticated
    ) {
    }

    public record ArenaStats(
            ConnectionCounts connections,
            int queueSize,
            int tournamentQueueSize,
            int activeMatches,
            int activeTournaments,
            int openPools,
            long completedMatches,
            int pendingSettlements,
            long confirmedSettlements,
            long abandonedSettlements
    ) {
    }
}
