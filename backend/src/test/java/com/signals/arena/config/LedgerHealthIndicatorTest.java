package com.signals.arena.config;

import com.signals.arena.ledger.LedgerStatus;
import com.signals.arena.ledger.SettlementLedgerClient;
import com.signals.arena.ledger.SettlementSubmitter;
import com.signals.arena.support.ManualArenaEventLoop;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerHealthIndicatorTest {

    @Mock
    private SettlementLedgerClient ledgerClient;

    @Mock
    private SettlementSubmitter settlementSubmitter;

    @Test
    void health_reportsUpWithSubmissionCounters() {
        when(ledgerClient.status()).thenReturn(new LedgerStatus("logging", true, "local log"));
        when(settlementSubmitter.stats()).thenReturn(new SettlementSubmitter.SubmissionStats(2, 10L, 1L));
        LedgerHealthIndicator indicator =
                new LedgerHealthIndicator(ledgerClient, settlementSubmitter, new ManualArenaEventLoop());

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("logging", health.getDetails().get("mode"));
        assertEquals(2, health.getDetails().get("pendingSubmissions"));
        assertEquals(1L, health.getDetails().get("abandonedSubmissions"));
    }

    @Test
    void health_reportsDownWhenTheLedgerIsUnreachable() {
        when(ledgerClient.status()).thenReturn(new LedgerStatus("web3j", false, "connection refused"));
        when(settlementSubmitter.stats()).thenReturn(new SettlementSubmitter.SubmissionStats(0, 0L, 0L));
        LedgerHealthIndicator indicator =
                new LedgerHealthIndicator(ledgerClient, settlementSubmitter, new ManualArenaEventLoop());

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    void health_reportsDownWhenTheStatusCallThrows() {
        when(ledgerClient.status()).thenThrow(new IllegalStateException("rpc unavailable"));
        LedgerHealthIndicator indicator =
                new LedgerHealthIndicator(ledgerClient, settlementSubmitter, new ManualArenaEventLoop());

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("java.lang.IllegalStateException: rpc unavailable", health.getDetails().get("error"));
    }
}
