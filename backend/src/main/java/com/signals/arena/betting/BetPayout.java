package com.signals.arena.betting;

import com.signals.arena.match.PoolOutcome;

import java.math.BigInteger;

public record BetPayout(
        String bettor,
        PoolOutcome outcome,
        BigInteger stake,
        BigInteger payout
) {
}
