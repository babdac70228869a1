package com.signals.arena.config;

import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.ledger.LedgerStatus;
import com.signals.arena.ledger.SettlementLedgerClient;
import com.signals.arena.ledger.SettlementSubmitter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class LedgerHealthIndicator implements HealthIndicator {

    private final SettlementLedgerClient ledgerClient;
    private final SettlementSubmitter settlementSubmitter;
    private final ArenaEventLoop eventLoop;

    public LedgerHealthIndicator(
            SettlementLedgerClient ledgerClient,
            SettlementSubmitter settlementSubmitter,
            ArenaEventLoop eventLoop
    ) {
        this.ledgerClient = ledgerClient;
        this.settlementSubmitter = settlementSubmitter;
        this.eventLoop = eventLoop;
    }

    @Override
    public Health health() {
        try {
            LedgerStatus status = ledgerClient.status();
            SettlementSubmitter.SubmissionStats stats = eventLoop.call(settlementSubmitter::stats);

            Health.Builder builder = status.reachable() ? Health.up() : Health.down();
            return builder
                    .withDetail("mode", status.mode())
                    .withDetail("detail", status.detail())
                    .withDetail("pendingSubmissions", stats.pending())
                    .withDetail("confirmedSubmissions", stats.confirmed())
                    .withDetail("abandonedSubmissions", stats.abandoned())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withException(e)
                    .build();
        }
    }
}
