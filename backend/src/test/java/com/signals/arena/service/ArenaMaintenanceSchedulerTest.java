package com.signals.arena.service;

import com.signals.arena.match.Match;
import com.signals.arena.support.ArenaTestFixture;
import com.signals.arena.tournament.Tournament;
import com.signals.arena.tournament.TournamentPhase;
import com.signals.arena.ws.ConnectionRole;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArenaMaintenanceSchedulerTest {

    private final ArenaTestFixture fixture = new ArenaTestFixture();
    private final ArenaMaintenanceScheduler scheduler = new ArenaMaintenanceScheduler(
            fixture.eventLoop, fixture.authManager, fixture.matchEngine, fixture.tournamentManager);

    @Test
    void runSweep_purgesExpiredChallengesAndEvictsOldMatches() {
        fixture.connect("agent-1", ConnectionRole.AGENT, null);
        fixture.authManager.generateChallenge("agent-1");
        Match match = fixture.matchEngine.createMatch(ArenaTestFixture.address(1), ArenaTestFixture.address(2),
                Match.NO_TOURNAMENT);

        ArenaMaintenanceScheduler.TickSummary idle = scheduler.runSweep();
        assertFalse(idle.hasWork());

        fixture.eventLoop.advance(Duration.ofSeconds(60).plusMinutes(5).plusSeconds(1));
        assertTrue(match.isComplete());

        ArenaMaintenanceScheduler.TickSummary summary = scheduler.runSweep();
        assertEquals(1, summary.challengesPurged());
        assertEquals(1, summary.matchesEvicted());
        assertEquals(0, summary.tournamentsEvicted());
        assertTrue(summary.hasWork());
    }

    @Test
    void runSweep_evictsFinishedTournamentsAfterRetention() {
        Tournament cancelled = fixture.tournamentManager.createTournament(2);
        fixture.tournamentManager.registerPlayer(cancelled.getId(), ArenaTestFixture.address(1));
        fixture.tournamentManager.startTournament(cancelled.getId());
        assertEquals(TournamentPhase.CANCELLED, cancelled.getPhase());
        Tournament registering = fixture.tournamentManager.createTournament(2);

        fixture.eventLoop.advance(Duration.ofMinutes(5));
        assertEquals(0, scheduler.runSweep().tournamentsEvicted());

        fixture.eventLoop.advance(Duration.ofSeconds(1));
        assertEquals(1, scheduler.runSweep().tournamentsEvicted());

        assertTrue(fixture.tournamentManager.findTournament(cancelled.getId()).isEmpty());
        assertTrue(fixture.tournamentManager.findTournament(registering.getId()).isPresent());
    }
}
