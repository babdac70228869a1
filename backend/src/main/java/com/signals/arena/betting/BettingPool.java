package com.signals.arena.betting;

import com.signals.arena.match.PoolOutcome;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parimutuel pool for one match. Stakes are integral base units.
 */
@Getter
public class BettingPool {

    static final int ODDS_SCALE = 4;

    private final long matchId;
    private PoolState state = PoolState.OPEN;
    private PoolOutcome winningOutcome;
    private boolean refunded;

    private final Map<PoolOutcome, BigInteger> stakes = new EnumMap<>(PoolOutcome.class);
    private final List<Bet> bets = new ArrayList<>();
    private final List<BetPayout> payouts = new ArrayList<>();

    public BettingPool(long matchId) {
        this.matchId = matchId;
        for (PoolOutcome outcome : PoolOutcome.values()) {
            stakes.put(outcome, BigInteger.ZERO);
        }
    }

    public BigInteger totalPool() {
        return stakes.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    public BigInteger stakeOn(PoolOutcome outcome) {
        return stakes.get(outcome);
    }

    public Map<PoolOutcome, BigInteger> getStakes() {
        return Collections.unmodifiableMap(stakes);
    }

    public List<Bet> getBets() {
        return Collections.unmodifiableList(bets);
    }

    public List<BetPayout> getPayouts() {
        return Collections.unmodifiableList(payouts);
    }

    /**
     * Decimal odds {@code totalPool / stakeOnOutcome}; zero when nothing is staked on the outcome.
     */
    public BigDecimal oddsFor(PoolOutcome outcome) {
        BigInteger stake = stakes.get(outcome);
        if (stake.signum() == 0) {
            return BigDecimal.ZERO.setScale(ODDS_SCALE, RoundingMode.DOWN);
        }
        return new BigDecimal(totalPool()).divide(new BigDecimal(stake), ODDS_SCALE, RoundingMode.DOWN);
    }

    public Map<PoolOutcome, BigDecimal> odds() {
        Map<PoolOutcome, BigDecimal> odds = new EnumMap<>(PoolOutcome.class);
        for (PoolOutcome outcome : PoolOutcome.values()) {
            odds.put(outcome, oddsFor(outcome));
        }
        return odds;
    }

    void addBet(Bet bet) {
        bets.add(bet);
        stakes.merge(bet.outcome(), bet.amount(), BigInteger::add);
    }

    void lock() {
        state = PoolState.LOCKED;
    }

    void settle(PoolOutcome outcome, List<BetPayout> computedPayouts, boolean refund) {
        state = PoolState.SETTLED;
        winningOutcome = outcome;
        refunded = refund;
        payouts.clear();
        payouts.addAll(computedPayouts);
    }
}
