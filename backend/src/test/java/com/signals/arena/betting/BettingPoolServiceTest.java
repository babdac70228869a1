package com.signals.arena.betting;

import com.fasterxml.jackson.databind.JsonNode;
import com.signals.arena.core.ArenaStateException;
import com.signals.arena.match.PoolOutcome;
import com.signals.arena.support.ArenaTestFixture;
import com.signals.arena.support.RecordingConnection;
import com.signals.arena.ws.ConnectionRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BettingPoolServiceTest {

    private static final long MATCH_ID = 42L;
    private static final String CAROL = ArenaTestFixture.address(0xca401);
    private static final String DAVE = ArenaTestFixture.address(0xda7e);

    private ArenaTestFixture fixture;
    private BettingPoolService service;
    private RecordingConnection bettor;

    @BeforeEach
    void setUp() {
        fixture = new ArenaTestFixture();
        service = fixture.bettingPoolService;
        bettor = fixture.connect("bettor", ConnectionRole.BETTOR, CAROL);
        service.open(MATCH_ID);
    }

    @Test
    void placeBet_updatesStakesAndBroadcastsOdds() {
        service.placeBet(MATCH_ID, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.valueOf(100));
        service.placeBet(MATCH_ID, DAVE, PoolOutcome.BOTH_STEAL, BigInteger.valueOf(300));

        BettingPool pool = service.findPool(MATCH_ID).orElseThrow();
        assertEquals(BigInteger.valueOf(400), pool.totalPool());
        assertEquals(new BigDecimal("4.0000"), pool.oddsFor(PoolOutcome.BOTH_SPLIT));
        assertEquals(new BigDecimal("0.0000"), pool.oddsFor(PoolOutcome.AGENT_A_STEALS));

        JsonNode update = bettor.lastPayloadOf("POOL_UPDATE");
        assertEquals(MATCH_ID, update.get("matchId").asLong());
        assertEquals("OPEN", update.get("state").asText());
    }

    @Test
    void placeBet_rejectsLockedPool() {
        service.lock(MATCH_ID);

        ArenaStateException ex = assertThrows(ArenaStateException.class,
                () -> service.placeBet(MATCH_ID, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.TEN));
        assertEquals("pool_not_open", ex.getCode());
        assertEquals(BigInteger.ZERO, service.findPool(MATCH_ID).orElseThrow().totalPool());
    }

    @Test
    void placeBet_rejectsSettledPoolsAndUnknownMatches() {
        service.settle(MATCH_ID, PoolOutcome.BOTH_SPLIT);

        assertEquals("pool_not_open", assertThrows(ArenaStateException.class,
                () -> service.placeBet(MATCH_ID, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.TEN)).getCode());
        assertEquals("match_not_found", assertThrows(ArenaStateException.class,
                () -> service.placeBet(7L, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.TEN)).getCode());
    }

    @Test
    void placeBet_rejectsNonPositiveAmounts() {
        assertEquals("invalid_amount", assertThrows(ArenaStateException.class,
                () -> service.placeBet(MATCH_ID, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.ZERO)).getCode());
        assertEquals("invalid_amount", assertThrows(ArenaStateException.class,
                () -> service.placeBet(MATCH_ID, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.valueOf(-5))).getCode());
    }

    @Test
    void settle_paysWinnersAndRecordsBettorHistory() {
        service.placeBet(MATCH_ID, CAROL, PoolOutcome.AGENT_A_STEALS, BigInteger.valueOf(50));
        service.placeBet(MATCH_ID, DAVE, PoolOutcome.BOTH_SPLIT, BigInteger.valueOf(150));
        service.lock(MATCH_ID);

        service.settle(MATCH_ID, PoolOutcome.AGENT_A_STEALS);

        BettingPool pool = service.findPool(MATCH_ID).orElseThrow();
        assertEquals(PoolState.SETTLED, pool.getState());
        assertFalse(pool.isRefunded());

        List<BettingPoolService.BettorBet> carolBets = service.betsFor(CAROL);
        assertEquals(1, carolBets.size());
        assertEquals(BigInteger.valueOf(200), carolBets.get(0).payout());
        assertEquals(BigInteger.ZERO, service.betsFor(DAVE).get(0).payout());

        JsonNode settled = bettor.lastPayloadOf("POOL_SETTLED");
        assertEquals("AGENT_A_STEALS", settled.get("winningOutcome").asText());
        assertFalse(settled.get("refunded").asBoolean());
    }

    @Test
    void settle_refundsWithoutWinningStake() {
        service.placeBet(MATCH_ID, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.valueOf(80));

        service.settle(MATCH_ID, PoolOutcome.BOTH_STEAL);

        assertTrue(service.findPool(MATCH_ID).orElseThrow().isRefunded());
        assertEquals(BigInteger.valueOf(80), service.betsFor(CAROL).get(0).payout());
    }

    @Test
    void settle_isIdempotentAndPendingBetsHaveNoPayout() {
        service.placeBet(MATCH_ID, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.valueOf(80));
        assertNull(service.betsFor(CAROL).get(0).payout());

        service.settle(MATCH_ID, PoolOutcome.BOTH_SPLIT);
        service.settle(MATCH_ID, PoolOutcome.BOTH_STEAL);

        assertEquals(PoolOutcome.BOTH_SPLIT, service.findPool(MATCH_ID).orElseThrow().getWinningOutcome());
        assertEquals(1, bettor.payloadsOf("POOL_SETTLED").size());
    }

    @Test
    void betsFor_keepsOnlyTheMostRecentBets() {
        int placed = BettingPoolService.HISTORY_LIMIT + 5;
        for (int i = 1; i <= placed; i++) {
            service.placeBet(MATCH_ID, CAROL, PoolOutcome.BOTH_SPLIT, BigInteger.valueOf(i));
        }

        service.settle(MATCH_ID, PoolOutcome.BOTH_SPLIT);

        List<BettingPoolService.BettorBet> history = service.betsFor(CAROL);
        assertEquals(BettingPoolService.HISTORY_LIMIT, history.size());
        assertEquals(BigInteger.valueOf(6), history.get(0).bet().amount());
        assertEquals(BigInteger.valueOf(placed), history.get(history.size() - 1).bet().amount());
        assertEquals(BigInteger.valueOf(placed), history.get(history.size() - 1).payout());
    }
}
