package com.signals.arena.ledger;

public record LedgerStatus(
        String mode,
        boolean reachable,
        String detail
) {
}
