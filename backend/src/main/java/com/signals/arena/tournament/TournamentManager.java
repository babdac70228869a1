package com.signals.arena.tournament;

import com.signals.arena.config.ArenaProperties;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.ArenaStateException;
import com.signals.arena.ledger.SettlementSubmitter;
import com.signals.arena.match.Choice;
import com.signals.arena.match.Match;
import com.signals.arena.match.MatchEngine;
import com.signals.arena.match.MatchResult;
import com.signals.arena.match.PoolOutcome;
import com.signals.arena.ws.ArenaEventPayloads;
import com.signals.arena.ws.ArenaEventType;
import com.signals.arena.ws.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Runs Swiss tournaments. A round's matches are created together, and the next round is planned only
 * once every one of them has completed.
 */
@Service
public class TournamentManager {

    private static final Logger log = LoggerFactory.getLogger(TournamentManager.class);

    private final ArenaEventLoop eventLoop;
    private final ConnectionRegistry connectionRegistry;
    private final MatchEngine matchEngine;
    private final SwissPairingPlanner pairingPlanner;
    private final SettlementSubmitter settlementSubmitter;
    private final ArenaProperties.Tournament settings;
    private final Random random;

    private final Map<Long, Tournament> tournaments = new LinkedHashMap<>();
    private long nextTournamentId = 1L;

    @Autowired
    public TournamentManager(
            ArenaEventLoop eventLoop,
            ConnectionRegistry connectionRegistry,
            MatchEngine matchEngine,
            SwissPairingPlanner pairingPlanner,
            SettlementSubmitter settlementSubmitter,
            ArenaProperties arenaProperties
    ) {
        this(eventLoop, connectionRegistry, matchEngine, pairingPlanner, settlementSubmitter, arenaProperties,
                new SecureRandom());
    }

    public TournamentManager(
            ArenaEventLoop eventLoop,
            ConnectionRegistry connectionRegistry,
            MatchEngine matchEngine,
            SwissPairingPlanner pairingPlanner,
            SettlementSubmitter settlementSubmitter,
            ArenaProperties arenaProperties,
            Random random
    ) {
        this.eventLoop = eventLoop;
        this.connectionRegistry = connectionRegistry;
        this.matchEngine = matchEngine;
        this.pairingPlanner = pairingPlanner;
        this.settlementSubmitter = settlementSubmitter;
        this.settings = arenaProperties.getTournament();
        this.random = random;
        matchEngine.onComplete(this::onMatchComplete);
    }

    public Tournament createTournament(int plannedPlayers) {
        Tournament tournament = new Tournament(nextTournamentId++, settings.getTotalRounds(), eventLoop.now());
        tournaments.put(tournament.getId(), tournament);
        log.info("Tournament {} created ({} rounds)", tournament.getId(), tournament.getTotalRounds());
        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_CREATED, new ArenaEventPayloads.TournamentCreated(
                tournament.getId(), plannedPlayers, tournament.getTotalRounds()));
        return tournament;
    }

    public boolean registerPlayer(long tournamentId, String address) {
        Tournament tournament = require(tournamentId);
        if (tournament.getPhase() != TournamentPhase.REGISTRATION) {
            throw new ArenaStateException("registration_closed", "Tournament " + tournamentId + " is " + tournament.getPhase());
        }
        if (tournament.hasPlayer(address)) {
            return false;
        }
        if (isInActiveTournament(address)) {
            throw ArenaStateException.inTournament(address);
        }
        tournament.addPlayer(address);
        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_PLAYER_JOINED, new ArenaEventPayloads.TournamentPlayerJoined(
                tournamentId, address, tournament.getPlayers().size()));
        return true;
    }

    public void startTournament(long tournamentId) {
        Tournament tournament = require(tournamentId);
        if (tournament.getPhase() != TournamentPhase.REGISTRATION) {
            throw new ArenaStateException("already_started", "Tournament " + tournamentId + " is " + tournament.getPhase());
        }
        if (tournament.getPlayers().size() < 2) {
            cancelTournament(tournamentId, "fewer than two players registered");
            return;
        }

        tournament.setPhase(TournamentPhase.ACTIVE);
        tournament.setStartedAt(eventLoop.now());
        log.info("Tournament {} started with {} players", tournamentId, tournament.getPlayers().size());
        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_STARTED, new ArenaEventPayloads.TournamentStarted(
                tournamentId, tournament.getPlayers(), tournament.getTotalRounds()));
        startRound(tournament, 1);
    }

    /**
     * Applies the payoff matrix for one finished pairing and records it for repeat avoidance.
     */
    public void updatePoints(long tournamentId, String addressA, String addressB, Choice choiceA, Choice choiceB) {
        Tournament tournament = require(tournamentId);
        Standing standingA = tournament.standingOf(addressA);
        Standing standingB = tournament.standingOf(addressB);
        if (standingA == null || standingB == null) {
            throw new IllegalArgumentException("Both players must belong to tournament " + tournamentId);
        }

        PoolOutcome outcome = PoolOutcome.of(choiceA, choiceB);
        standingA.recordMatch(addressB, outcome.pointsA());
        standingB.recordMatch(addressA, outcome.pointsB());
        tournament.recomputeBuchholz();
    }

    public boolean cancelTournament(long tournamentId, String reason) {
        Tournament tournament = require(tournamentId);
        if (tournament.getPhase().isTerminal()) {
            return false;
        }
        tournament.setPhase(TournamentPhase.CANCELLED);
        tournament.setCancelReason(reason);
        tournament.setCompletedAt(eventLoop.now());
        tournament.clearPendingMatches();
        log.warn("Tournament {} cancelled: {}", tournamentId, reason);
        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_UPDATE, new ArenaEventPayloads.TournamentUpdate(
                tournamentId, tournament.getPhase(), tournament.getCurrentRound(), 0, reason));
        return true;
    }

    public Optional<Tournament> findTournament(long tournamentId) {
        return Optional.ofNullable(tournaments.get(tournamentId));
    }

    public List<Tournament> activeTournaments() {
        List<Tournament> active = new ArrayList<>();
        for (Tournament tournament : tournaments.values()) {
            if (!tournament.getPhase().isTerminal()) {
                active.add(tournament);
            }
        }
        return active;
    }

    public Optional<Tournament> activeTournamentFor(String address) {
        for (Tournament tournament : tournaments.values()) {
            if (!tournament.getPhase().isTerminal() && tournament.hasPlayer(address)) {
                return Optional.of(tournament);
            }
        }
        return Optional.empty();
    }

    public boolean isInActiveTournament(String address) {
        return activeTournamentFor(address).isPresent();
    }

    /**
     * Drops completed or cancelled tournaments older than the retention window.
     *
     * @return number of evicted tournaments
     */
    public int evictExpired() {
        Instant cutoff = eventLoop.now().minus(settings.getRetention());
        int evicted = 0;
        Iterator<Tournament> iterator = tournaments.values().iterator();
        while (iterator.hasNext()) {
            Tournament tournament = iterator.next();
            if (tournament.getPhase().isTerminal()
                    && tournament.getCompletedAt() != null
                    && tournament.getCompletedAt().isBefore(cutoff)) {
                iterator.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} finished tournament(s)", evicted);
        }
        return evicted;
    }

    public List<Standing> rankedStandings(long tournamentId) {
        List<Standing> ranked = new ArrayList<>(require(tournamentId).getStandings());
        ranked.sort(SwissPairingPlanner.STANDINGS_ORDER);
        return ranked;
    }

    private void startRound(Tournament tournament, int round) {
        tournament.setCurrentRound(round);
        PlannedRound plan = pairingPlanner.plan(round, tournament.getStandings(), random);

        if (plan.byeAddress() != null) {
            tournament.standingOf(plan.byeAddress()).awardBye(settings.getByePoints());
            tournament.recomputeBuchholz();
        }
        if (plan.repeatPairings() > 0) {
            log.info("Tournament {} round {} needs {} rematch(es)", tournament.getId(), round, plan.repeatPairings());
        }

        List<PlannedRound.Pairing> scheduled = new ArrayList<>();
        for (PlannedRound.Pairing pairing : plan.pairings()) {
            Match match;
            try {
                match = matchEngine.createMatch(pairing.agentA(), pairing.agentB(), tournament.getId());
            } catch (ArenaStateException ex) {
                cancelTournament(tournament.getId(), "could not create round " + round + " match: " + ex.getMessage());
                return;
            }
            tournament.trackMatch(match.getId());
            scheduled.add(pairing.withMatchId(match.getId()));
        }
        tournament.recordRound(round, scheduled, plan.byeAddress());

        log.info("Tournament {} round {}/{} started: {} matches, bye={}",
                tournament.getId(), round, tournament.getTotalRounds(), scheduled.size(), plan.byeAddress());
        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_ROUND_STARTED, new ArenaEventPayloads.TournamentRoundStarted(
                tournament.getId(),
                round,
                tournament.getTotalRounds(),
                scheduled.stream()
                        .map(p -> new ArenaEventPayloads.RoundPairing(p.matchId(), p.agentA(), p.agentB()))
                        .toList(),
                plan.byeAddress()
        ));

        if (tournament.isRoundSettled()) {
            completeRound(tournament);
        }
    }

    private void onMatchComplete(long matchId, String addressA, String addressB) {
        Optional<Match> found = matchEngine.findMatch(matchId);
        if (found.isEmpty() || !found.get().isTournamentMatch()) {
            return;
        }
        Match match = found.get();
        Tournament tournament = tournaments.get(match.getTournamentId());
        if (tournament == null || tournament.getPhase() != TournamentPhase.ACTIVE) {
            return;
        }
        if (!tournament.settleMatch(matchId)) {
            return;
        }

        MatchResult result = match.getResult();
        updatePoints(tournament.getId(), addressA, addressB, result.outcome().choiceA(), result.outcome().choiceB());

        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_UPDATE, new ArenaEventPayloads.TournamentUpdate(
                tournament.getId(),
                tournament.getPhase(),
                tournament.getCurrentRound(),
                tournament.getPendingMatchIds().size(),
                "match " + matchId + " settled: " + result.outcome()
        ));

        if (tournament.isRoundSettled()) {
            completeRound(tournament);
        }
    }

    private void completeRound(Tournament tournament) {
        int round = tournament.getCurrentRound();
        List<ArenaEventPayloads.StandingLine> lines = standingLines(tournament.getId());
        log.info("Tournament {} round {} complete", tournament.getId(), round);
        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_ROUND_COMPLETE,
                new ArenaEventPayloads.TournamentRoundComplete(tournament.getId(), round, lines));

        if (round >= tournament.getTotalRounds()) {
            finish(tournament);
            return;
        }

        long tournamentId = tournament.getId();
        eventLoop.schedule(settings.getRoundPause(), () -> {
            Tournament current = tournaments.get(tournamentId);
            if (current != null && current.getPhase() == TournamentPhase.ACTIVE && current.getCurrentRound() == round) {
                startRound(current, round + 1);
            }
        });
    }

    private void finish(Tournament tournament) {
        tournament.setPhase(TournamentPhase.COMPLETE);
        tournament.setCompletedAt(eventLoop.now());

        List<Standing> ranked = rankedStandings(tournament.getId());
        List<String> ranking = ranked.stream().map(Standing::getAddress).toList();
        String winner = ranking.isEmpty() ? null : ranking.get(0);
        log.info("Tournament {} complete: winner={}", tournament.getId(), winner);

        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_COMPLETE, new ArenaEventPayloads.TournamentComplete(
                tournament.getId(), winner, standingLines(tournament.getId())));

        long tournamentId = tournament.getId();
        settlementSubmitter.submitTournamentResult(tournamentId, ranking,
                txRef -> log.info("Tournament {} result recorded: {}", tournamentId, txRef));
    }

    public List<ArenaEventPayloads.StandingLine> standingLines(long tournamentId) {
        List<Standing> ranked = rankedStandings(tournamentId);
        List<ArenaEventPayloads.StandingLine> lines = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            Standing standing = ranked.get(i);
            lines.add(new ArenaEventPayloads.StandingLine(
                    i + 1,
                    standing.getAddress(),
                    standing.getPoints(),
                    standing.getBuchholz(),
                    standing.getMatchesPlayed()
            ));
        }
        return lines;
    }

    private Tournament require(long tournamentId) {
        Tournament tournament = tournaments.get(tournamentId);
        if (tournament == null) {
            throw new ArenaStateException("tournament_not_found", "Unknown tournament " + tournamentId);
        }
        return tournament;
    }
}
