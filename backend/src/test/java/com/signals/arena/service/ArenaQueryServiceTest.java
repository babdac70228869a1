package com.signals.arena.service;

import com.signals.arena.dto.ArenaAgentResponses;
import com.signals.arena.dto.ArenaMatchResponses;
import com.signals.arena.dto.ArenaStatsResponses;
import com.signals.arena.mapper.ArenaResponseMapper;
import com.signals.arena.match.Match;
import com.signals.arena.match.MatchPhase;
import com.signals.arena.support.ArenaTestFixture;
import com.signals.arena.web.ArenaNotFoundException;
import com.signals.arena.web.InvalidAddressException;
import com.signals.arena.ws.ConnectionRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArenaQueryServiceTest {

    private static final String ALICE = ArenaTestFixture.address(0xa11ce);
    private static final String BOB = ArenaTestFixture.address(0xb0b);

    private ArenaTestFixture fixture;
    private ArenaQueryService queryService;

    @BeforeEach
    void setUp() {
        fixture = new ArenaTestFixture();
        queryService = new ArenaQueryService(
                fixture.eventLoop,
                new ArenaResponseMapper(),
                fixture.registry,
                fixture.matchEngine,
                fixture.bettingPoolService,
                fixture.matchmakingQueue,
                fixture.tournamentManager,
                fixture.tournamentQueueManager,
                fixture.matchHistoryService,
                fixture.settlementSubmitter,
                fixture.ledgerProperties
        );
    }

    @Test
    void health_reportsUptimeAndConnections() {
        fixture.connectAgent(ALICE);
        fixture.connect("spectator", ConnectionRole.SPECTATOR, null);
        fixture.eventLoop.advance(Duration.ofSeconds(90));

        ArenaStatsResponses.HealthResponse health = queryService.health();

        assertEquals("signals-arena", health.service());
        assertEquals(90L, health.uptimeSeconds());
        assertEquals(2, health.connections().total());
        assertEquals(1, health.connections().authenticated());
    }

    @Test
    void match_unknownMatchesAndPoolsAreNotFound() {
        assertEquals("match_not_found", assertThrows(ArenaNotFoundException.class, () -> queryService.match(9L)).getCode());
        assertEquals("match_not_found", assertThrows(ArenaNotFoundException.class, () -> queryService.odds(9L)).getCode());
        assertEquals("tournament_not_found",
                assertThrows(ArenaNotFoundException.class, () -> queryService.standings(3L)).getCode());
    }

    @Test
    void match_reflectsTheLiveMatch() {
        Match match = fixture.matchEngine.createMatch(ALICE, BOB, Match.NO_TOURNAMENT);
        fixture.matchEngine.postMessage(ALICE, match.getId(), "split?");

        ArenaMatchResponses.MatchDetail detail = queryService.match(match.getId());

        assertEquals(MatchPhase.NEGOTIATION, detail.phase());
        assertEquals(1, detail.messages().size());
        assertNull(detail.result());
        assertEquals(1, queryService.activeMatches().size());
        assertEquals(0, queryService.pool(match.getId()).betCount());
    }

    @Test
    void agentStatus_validatesAndNormalizesTheAddress() {
        assertThrows(InvalidAddressException.class, () -> queryService.agentStatus("alice"));

        fixture.connectAgent(ALICE);
        fixture.matchmakingQueue.addToQueue(ALICE, "conn-0a11ce");

        ArenaAgentResponses.AgentStatus status = queryService.agentStatus(ALICE.toUpperCase().replace("0X", "0x"));
        assertEquals(ALICE, status.address());
        assertTrue(status.connected());
        assertTrue(status.queued());
        assertNull(status.currentMatchId());

        ArenaAgentResponses.AgentStats stats = queryService.agentStats(BOB);
        assertEquals(0, stats.matchesPlayed());
    }

    @Test
    void leaderboard_clampsTheLimit() {
        Match match = fixture.matchEngine.createMatch(ALICE, BOB, Match.NO_TOURNAMENT);
        fixture.eventLoop.advance(Duration.ofSeconds(60));
        assertTrue(match.isComplete());

        assertEquals(1, queryService.leaderboard(0).size());
        assertEquals(2, queryService.leaderboard(500).size());
        assertEquals(1L, queryService.stats().completedMatches());
    }
}
