package com.signals.arena.betting;

import com.signals.arena.match.PoolOutcome;

import java.math.BigInteger;
import java.time.Instant;

public record Bet(
        long matchId,
        String bettor,
        PoolOutcome outcome,
        BigInteger amount,
        Instant placedAt
) {
}
