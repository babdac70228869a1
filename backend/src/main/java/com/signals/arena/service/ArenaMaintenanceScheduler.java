package com.signals.arena.service;

import com.signals.arena.auth.AuthManager;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.match.MatchEngine;
import com.signals.arena.tournament.TournamentManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic housekeeping: expired challenges, plus matches and tournaments past their retention window.
 */
@Service
public class ArenaMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(ArenaMaintenanceScheduler.class);

    private final ArenaEventLoop eventLoop;
    private final AuthManager authManager;
    private final MatchEngine matchEngine;
    private final TournamentManager tournamentManager;

    public ArenaMaintenanceScheduler(
            ArenaEventLoop eventLoop,
            AuthManager authManager,
            MatchEngine matchEngine,
            TournamentManager tournamentManager
    ) {
        this.eventLoop = eventLoop;
        this.authManager = authManager;
        this.matchEngine = matchEngine;
        this.tournamentManager = tournamentManager;
    }

    @Scheduled(
            fixedRateString = "${arena.maintenance.interval-ms:30000}",
            initialDelayString = "${arena.maintenance.initial-delay-ms:30000}"
    )
    public void sweep() {
        TickSummary summary = runSweep();
        if (summary.hasWork()) {
            log.info(
                    "Arena maintenance: challengesPurged={}, matchesEvicted={}, tournamentsEvicted={}",
                    summary.challengesPurged(),
                    summary.matchesEvicted(),
                    summary.tournamentsEvicted()
            );
        } else {
            log.debug("Arena maintenance completed with nothing to remove");
        }
    }

    TickSummary runSweep() {
        return eventLoop.call(() -> new TickSummary(
                authManager.purgeExpired(),
                matchEngine.evictExpired(),
                tournamentManager.evictExpired()
        ));
    }

    record TickSummary(
            int challengesPurged,
            int matchesEvicted,
            int tournamentsEvicted
    ) {

        boolean hasWork() {
            return challengesPurged > 0 || matchesEvicted > 0 || tournamentsEvicted > 0;
        }
    }
}
