package com.signals.arena.betting;

import com.signals.arena.match.PoolOutcome;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Proportional parimutuel payouts.
 *
 * Each winning bet receives {@code floor(stake * totalPool / totalWinningStake)}; the rounding
 * remainder goes to the earliest winning bet so the payouts always sum to exactly {@code totalPool}.
 * If nobody backed the winning outcome every bet is refunded.
 */
public final class PayoutCalculator {

    private PayoutCalculator() {
    }

    public static List<BetPayout> compute(List<Bet> bets, PoolOutcome winningOutcome) {
        BigInteger totalPool = BigInteger.ZERO;
        BigInteger totalWinningStake = BigInteger.ZERO;
        for (Bet bet : bets) {
            totalPool = totalPool.add(bet.amount());
            if (bet.outcome() == winningOutcome) {
                totalWinningStake = totalWinningStake.add(bet.amount());
            }
        }

        List<BetPayout> payouts = new ArrayList<>();
        if (totalWinningStake.signum() == 0) {
            for (Bet bet : bets) {
                payouts.add(new BetPayout(bet.bettor(), bet.outcome(), bet.amount(), bet.amount()));
            }
            return payouts;
        }

        BigInteger distributed = BigInteger.ZERO;
        int firstWinnerIndex = -1;
        for (Bet bet : bets) {
            if (bet.outcome() != winningOutcome) {
                payouts.add(new BetPayout(bet.bettor(), bet.outcome(), bet.amount(), BigInteger.ZERO));
                continue;
            }
            BigInteger share = bet.amount().multiply(totalPool).divide(totalWinningStake);
            distributed = distributed.add(share);
            if (firstWinnerIndex < 0) {
                firstWinnerIndex = payouts.size();
            }
            payouts.add(new BetPayout(bet.bettor(), bet.outcome(), bet.amount(), share));
        }

        BigInteger remainder = totalPool.subtract(distributed);
        if (remainder.signum() > 0) {
            BetPayout first = payouts.get(firstWinnerIndex);
            payouts.set(firstWinnerIndex, new BetPayout(
                    first.bettor(), first.outcome(), first.stake(), first.payout().add(remainder)));
        }
        return payouts;
    }

    public static boolean isRefund(List<Bet> bets, PoolOutcome winningOutcome) {
        return bets.stream().noneMatch(bet -> bet.outcome() == winningOutcome);
    }
}
