package com.signals.arena.ledger;

import com.signals.arena.config.LedgerProperties;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.RetryBackoff;
import com.signals.arena.match.PoolOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Submits ledger calls off the arena core and re-enters it with the outcome. Failures are retried
 * with exponential backoff; local match state is never touched on failure.
 */
@Service
public class SettlementSubmitter {

    private static final Logger log = LoggerFactory.getLogger(SettlementSubmitter.class);

    private final SettlementLedgerClient ledgerClient;
    private final ArenaEventLoop eventLoop;
    private final RetryBackoff backoff;
    private final int maxAttempts;

    private int pending;
    private long confirmed;
    private long abandoned;

    public SettlementSubmitter(
            SettlementLedgerClient ledgerClient,
            ArenaEventLoop eventLoop,
            LedgerProperties ledgerProperties
    ) {
        this.ledgerClient = ledgerClient;
        this.eventLoop = eventLoop;
        this.backoff = new RetryBackoff(ledgerProperties.getInitialBackoff(), ledgerProperties.getMaxBackoff());
        this.maxAttempts = ledgerProperties.getMaxAttempts();
    }

    public void submitSettlement(
            long matchId,
            PoolOutcome outcome,
            String addressA,
            String addressB,
            Consumer<String> onConfirmed
    ) {
        submit(
                "match " + matchId,
                () -> ledgerClient.recordSettlement(matchId, outcome, addressA, addressB),
                onConfirmed
        );
    }

    public void submitTournamentResult(long tournamentId, List<String> rankedAddresses, Consumer<String> onConfirmed) {
        List<String> ranking = List.copyOf(rankedAddresses);
        submit(
                "tournament " + tournamentId,
                () -> ledgerClient.recordTournamentResult(tournamentId, ranking),
                onConfirmed
        );
    }

    public SubmissionStats stats() {
        return new SubmissionStats(pending, confirmed, abandoned);
    }

    private void submit(String subject, Supplier<CompletableFuture<String>> call, Consumer<String> onConfirmed) {
        pending++;
        attempt(subject, call, onConfirmed, 1);
    }

    private void attempt(String subject, Supplier<CompletableFuture<String>> call, Consumer<String> onConfirmed, int attempt) {
        CompletableFuture<String> future;
        try {
            future = call.get();
        } catch (RuntimeException ex) {
            future = CompletableFuture.failedFuture(ex);
        }

        future.whenComplete((txRef, failure) -> eventLoop.execute(() -> {
            if (failure == null) {
                pending--;
                confirmed++;
                log.info("Ledger confirmed {} on attempt {}: {}", subject, attempt, txRef);
                onConfirmed.accept(txRef);
                return;
            }

            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause()
                    : failure;
            if (attempt >= maxAttempts) {
                pending--;
                abandoned++;
                log.error("Ledger gave up on {} after {} attempts: {}", subject, attempt, cause.getMessage());
                return;
            }

            Duration delay = backoff.delayAfter(attempt);
            log.warn("Ledger call for {} failed (attempt {}/{}), retrying in {}: {}",
                    subject, attempt, maxAttempts, delay, cause.getMessage());
            eventLoop.schedule(delay, () -> attempt(subject, call, onConfirmed, attempt + 1));
        }));
    }

    public record SubmissionStats(
            int pending,
            long confirmed,
            long abandoned
    ) {
    }
}
