package com.signals.arena.betting;

import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.ArenaStateException;
import com.signals.arena.match.PoolOutcome;
import com.signals.arena.ws.ArenaEventPayloads;
import com.signals.arena.ws.ArenaEventType;
import com.signals.arena.ws.ConnectionRegistry;
import com.signals.arena.ws.ConnectionRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spectator betting market: one parimutuel pool per match.
 *
 * Lifecycle: {@link #open} on match creation, {@link #lock} when reveals start,
 * {@link #settle} with the final outcome.
 */
@Service
public class BettingPoolService {

    private static final Logger log = LoggerFactory.getLogger(BettingPoolService.class);

    static final int HISTORY_LIMIT = 50;

    private final ArenaEventLoop eventLoop;
    private final ConnectionRegistry connectionRegistry;

    private final Map<Long, BettingPool> pools = new HashMap<>();
    private final Map<String, List<BettorBet>> betsByBettor = new HashMap<>();

    public BettingPoolService(ArenaEventLoop eventLoop, ConnectionRegistry connectionRegistry) {
        this.eventLoop = eventLoop;
        this.connectionRegistry = connectionRegistry;
    }

    public BettingPool open(long matchId) {
        BettingPool pool = pools.computeIfAbsent(matchId, BettingPool::new);
        log.debug("Betting pool opened for match {}", matchId);
        return pool;
    }

    /**
     * @param matchId match the pool belongs to
     * @param bettor normalized bettor address
     * @param outcome one of the four pool outcomes
     * @param amount stake in base units, must be positive
     * @return the accepted bet
     */
    public Bet placeBet(long matchId, String bettor, PoolOutcome outcome, BigInteger amount) {
        BettingPool pool = pools.get(matchId);
        if (pool == null) {
            throw ArenaStateException.matchNotFound(matchId);
        }
        if (pool.getState() != PoolState.OPEN) {
            throw ArenaStateException.poolNotOpen(matchId, pool.getState().name());
        }
        if (outcome == null) {
            throw new ArenaStateException("invalid_outcome", "Outcome must be one of " + List.of(PoolOutcome.values()));
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ArenaStateException("invalid_amount", "Bet amount must be positive");
        }

        Bet bet = new Bet(matchId, bettor, outcome, amount, eventLoop.now());
        pool.addBet(bet);
        List<BettorBet> history = betsByBettor.computeIfAbsent(bettor, ignored -> new ArrayList<>());
        history.add(new BettorBet(bet, null));
        while (history.size() > HISTORY_LIMIT) {
            history.remove(0);
        }

        log.info("Bet accepted: match={}, bettor={}, outcome={}, amount={}", matchId, bettor, outcome, amount);
        broadcastPoolUpdate(pool);
        return bet;
    }

    public void lock(long matchId) {
        BettingPool pool = pools.get(matchId);
        if (pool == null || pool.getState() != PoolState.OPEN) {
            return;
        }
        pool.lock();
        log.info("Betting pool locked for match {} with total {}", matchId, pool.totalPool());
        broadcastPoolUpdate(pool);
    }

    public void settle(long matchId, PoolOutcome winningOutcome) {
        BettingPool pool = pools.get(matchId);
        if (pool == null || pool.getState() == PoolState.SETTLED) {
            return;
        }

        List<BetPayout> payouts = PayoutCalculator.compute(pool.getBets(), winningOutcome);
        boolean refund = !pool.getBets().isEmpty() && PayoutCalculator.isRefund(pool.getBets(), winningOutcome);
        pool.settle(winningOutcome, payouts, refund);
        recordPayouts(pool);

        log.info(
                "Betting pool settled: match={}, outcome={}, totalPool={}, bets={}, refunded={}",
                matchId,
                winningOutcome,
                pool.totalPool(),
                pool.getBets().size(),
                refund
        );
        connectionRegistry.broadcast(ConnectionRole.SPECTATOR, ArenaEventType.POOL_SETTLED, settledPayload(pool));
        connectionRegistry.broadcast(ConnectionRole.BETTOR, ArenaEventType.POOL_SETTLED, settledPayload(pool));
    }

    public Optional<BettingPool> findPool(long matchId) {
        return Optional.ofNullable(pools.get(matchId));
    }

    /**
     * The bettor's most recent bets, oldest first, capped at {@value #HISTORY_LIMIT}.
     */
    public List<BettorBet> betsFor(String bettor) {
        return Collections.unmodifiableList(betsByBettor.getOrDefault(bettor, List.of()));
    }

    public void evict(long matchId) {
        pools.remove(matchId);
    }

    public int openPoolCount() {
        return (int) pools.values().stream().filter(pool -> pool.getState() != PoolState.SETTLED).count();
    }

    private void recordPayouts(BettingPool pool) {
        List<Bet> bets = pool.getBets();
        List<BetPayout> payouts = pool.getPayouts();
        for (int i = 0; i < bets.size(); i++) {
            Bet bet = bets.get(i);
            List<BettorBet> history = betsByBettor.get(bet.bettor());
            if (history == null) {
                continue;
            }
            for (int j = 0; j < history.size(); j++) {
                if (history.get(j).bet() == bet) {
                    history.set(j, new BettorBet(bet, payouts.get(i).payout()));
                    break;
                }
            }
        }
    }

    private void broadcastPoolUpdate(BettingPool pool) {
        ArenaEventPayloads.PoolUpdate payload = new ArenaEventPayloads.PoolUpdate(
                pool.getMatchId(),
                pool.getState(),
                pool.getStakes(),
                pool.odds(),
                pool.totalPool()
        );
        connectionRegistry.broadcast(ConnectionRole.SPECTATOR, ArenaEventType.POOL_UPDATE, payload);
        connectionRegistry.broadcast(ConnectionRole.BETTOR, ArenaEventType.POOL_UPDATE, payload);
    }

    private static ArenaEventPayloads.PoolSettled settledPayload(BettingPool pool) {
        return new ArenaEventPayloads.PoolSettled(
                pool.getMatchId(),
                pool.getWinningOutcome(),
                pool.totalPool(),
                pool.isRefunded(),
                (int) pool.getPayouts().stream().filter(payout -> payout.payout().signum() > 0).count()
        );
    }

    /**
     * A bettor's bet together with its payout once the pool has settled.
     */
    public record BettorBet(Bet bet, BigInteger payout) {
    }
}
