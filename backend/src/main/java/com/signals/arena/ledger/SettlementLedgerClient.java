package com.signals.arena.ledger;

import com.signals.arena.match.PoolOutcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Boundary to the external settlement ledger. Calls are idempotent per id and may fail transiently;
 * implementations must not block the caller.
 */
public interface SettlementLedgerClient {

    CompletableFuture<String> recordSettlement(long matchId, PoolOutcome outcome, String addressA, String addressB);

    CompletableFuture<String> recordTournamentResult(long tournamentId, List<String> rankedAddresses);

    LedgerStatus status();
}
