package com.signals.arena.ledger;

import com.signals.arena.match.PoolOutcome;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Deterministic local ledger used for development and tests. The returned reference is a
 * stable hash of the call, so repeating a call yields the same reference.
 */
@Component
@ConditionalOnProperty(prefix = "arena.ledger", name = "mode", havingValue = "logging", matchIfMissing = true)
public class LoggingSettlementLedgerClient implements SettlementLedgerClient {

    private static final Logger log = LoggerFactory.getLogger(LoggingSettlementLedgerClient.class);

    @Override
    public CompletableFuture<String> recordSettlement(long matchId, PoolOutcome outcome, String addressA, String addressB) {
        String txRef = syntheticReference("settlement|" + matchId + "|" + outcome.code() + "|" + addressA + "|" + addressB);
        log.info("Ledger (logging) settlement: match={}, outcome={}, a={}, b={}, ref={}",
                matchId, outcome, addressA, addressB, txRef);
        return CompletableFuture.completedFuture(txRef);
    }

    @Override
    public CompletableFuture<String> recordTournamentResult(long tournamentId, List<String> rankedAddresses) {
        String txRef = syntheticReference("tournament|" + tournamentId + "|" + String.join(",", rankedAddresses));
        log.info("Ledger (logging) tournament result: tournament={}, ranking={}, ref={}",
                tournamentId, rankedAddresses, txRef);
        return CompletableFuture.completedFuture(txRef);
    }

    @Override
    public LedgerStatus status() {
        return new LedgerStatus("logging", true, "settlements are recorded in the application log");
    }

    private static String syntheticReference(String seed) {
        byte[] hash = new Keccak.Digest256().digest(seed.getBytes(StandardCharsets.UTF_8));
        StringBuilder out = new StringBuilder("0x");
        for (byte value : hash) {
            out.append(Character.forDigit((value >>> 4) & 0x0f, 16));
            out.append(Character.forDigit(value & 0x0f, 16));
        }
        return out.toString();
    }
}
