package com.signals.arena.tournament;

import com.signals.arena.config.ArenaProperties;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.ArenaStateException;
import com.signals.arena.core.ArenaTimer;
import com.signals.arena.match.MatchEngine;
import com.signals.arena.queue.MatchmakingQueue;
import com.signals.arena.queue.QueueEntry;
import com.signals.arena.ws.ArenaEventPayloads;
import com.signals.arena.ws.ArenaEventType;
import com.signals.arena.ws.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers registrants into a cohort and turns it into a tournament.
 *
 * A cohort opens with its first registrant. It starts shortly after it fills; otherwise it starts
 * when the registration window closes, provided the minimum size is met. Below the minimum the
 * window is extended by another full period and registrants keep their places.
 */
@Service
public class TournamentQueueManager {

    private static final Logger log = LoggerFactory.getLogger(TournamentQueueManager.class);

    private final ArenaEventLoop eventLoop;
    private final ConnectionRegistry connectionRegistry;
    private final MatchmakingQueue matchmakingQueue;
    private final MatchEngine matchEngine;
    private final TournamentManager tournamentManager;
    private final ArenaProperties.Tournament settings;

    private final Map<String, QueueEntry> cohort = new LinkedHashMap<>();
    private Instant registrationDeadline;
    private ArenaTimer deadlineTimer;
    private ArenaTimer startTimer;

    public TournamentQueueManager(
            ArenaEventLoop eventLoop,
            ConnectionRegistry connectionRegistry,
            MatchmakingQueue matchmakingQueue,
            MatchEngine matchEngine,
            TournamentManager tournamentManager,
            ArenaProperties arenaProperties
    ) {
        this.eventLoop = eventLoop;
        this.connectionRegistry = connectionRegistry;
        this.matchmakingQueue = matchmakingQueue;
        this.matchEngine = matchEngine;
        this.tournamentManager = tournamentManager;
        this.settings = arenaProperties.getTournament();
    }

    public boolean join(String address, String connectionId) {
        if (cohort.containsKey(address)) {
            return false;
        }
        if (matchmakingQueue.contains(address)) {
            throw ArenaStateException.alreadyQueuedElsewhere(address, "quick-match queue");
        }
        if (matchEngine.isInActiveMatch(address)) {
            throw ArenaStateException.alreadyInMatch(address);
        }
        if (tournamentManager.isInActiveTournament(address)) {
            throw ArenaStateException.inTournament(address);
        }

        cohort.put(address, new QueueEntry(address, connectionId, eventLoop.now()));
        if (deadlineTimer == null) {
            openRegistrationWindow();
        }
        log.info("Agent {} joined the tournament queue ({}/{})", address, cohort.size(), settings.getCapacity());

        connectionRegistry.send(connectionId, ArenaEventType.TOURNAMENT_QUEUE_JOINED,
                new ArenaEventPayloads.TournamentQueueJoined(address, cohort.size(), cohort.size(), registrationDeadline));
        broadcastQueueUpdate();

        if (cohort.size() >= settings.getCapacity() && startTimer == null) {
            startTimer = eventLoop.schedule(settings.getStartDelay(), this::onCohortFull);
        }
        return true;
    }

    public boolean leave(String address) {
        QueueEntry removed = cohort.remove(address);
        if (removed == null) {
            return false;
        }
        log.info("Agent {} left the tournament queue ({}/{})", address, cohort.size(), settings.getCapacity());
        connectionRegistry.send(removed.connectionId(), ArenaEventType.TOURNAMENT_QUEUE_LEFT,
                new ArenaEventPayloads.TournamentQueueLeft(address));
        if (cohort.isEmpty()) {
            closeRegistrationWindow();
        }
        broadcastQueueUpdate();
        return true;
    }

    public boolean contains(String address) {
        return cohort.containsKey(address);
    }

    public List<QueueEntry> snapshot() {
        return List.copyOf(cohort.values());
    }

    public Instant getRegistrationDeadline() {
        return registrationDeadline;
    }

    public int capacity() {
        return settings.getCapacity();
    }

    public int minPlayers() {
        return settings.getMinPlayers();
    }

    private void onCohortFull() {
        startTimer = null;
        if (cohort.size() >= settings.getMinPlayers()) {
            startCohort();
        }
    }

    private void onRegistrationDeadline() {
        deadlineTimer = null;
        if (cohort.isEmpty()) {
            registrationDeadline = null;
            return;
        }
        if (cohort.size() >= settings.getMinPlayers()) {
            startCohort();
            return;
        }

        openRegistrationWindow();
        log.info("Tournament registration extended to {}: {}/{} registrants, minimum {}",
                registrationDeadline, cohort.size(), settings.getCapacity(), settings.getMinPlayers());
        broadcastQueueUpdate();
    }

    private void startCohort() {
        if (startTimer != null) {
            startTimer.cancel();
            startTimer = null;
        }
        closeRegistrationWindow();

        List<QueueEntry> members = new ArrayList<>();
        Iterator<QueueEntry> iterator = cohort.values().iterator();
        while (iterator.hasNext() && members.size() < settings.getCapacity()) {
            QueueEntry entry = iterator.next();
            iterator.remove();
            if (connectionRegistry.isConnected(entry.address())) {
                members.add(entry);
            }
        }

        Tournament tournament = tournamentManager.createTournament(members.size());
        List<String> players = members.stream().map(QueueEntry::address).toList();
        for (QueueEntry member : members) {
            connectionRegistry.send(member.connectionId(), ArenaEventType.TOURNAMENT_INVITE,
                    new ArenaEventPayloads.TournamentInvite(tournament.getId(), member.address(), players,
                            tournament.getTotalRounds()));
            tournamentManager.registerPlayer(tournament.getId(), member.address());
        }

        if (members.size() < 2) {
            tournamentManager.cancelTournament(tournament.getId(), "not enough connected players at start");
            for (QueueEntry member : members) {
                join(member.address(), member.connectionId());
            }
        } else {
            tournamentManager.startTournament(tournament.getId());
        }

        if (!cohort.isEmpty() && deadlineTimer == null) {
            openRegistrationWindow();
        }
        broadcastQueueUpdate();
    }

    private void openRegistrationWindow() {
        if (deadlineTimer != null) {
            deadlineTimer.cancel();
        }
        registrationDeadline = eventLoop.now().plus(settings.getRegistrationWindow());
        deadlineTimer = eventLoop.schedule(settings.getRegistrationWindow(), this::onRegistrationDeadline);
    }

    private void closeRegistrationWindow() {
        if (deadlineTimer != null) {
            deadlineTimer.cancel();
            deadlineTimer = null;
        }
        registrationDeadline = null;
    }

    private void broadcastQueueUpdate() {
        connectionRegistry.broadcastAll(ArenaEventType.TOURNAMENT_QUEUE_UPDATE, new ArenaEventPayloads.TournamentQueueUpdate(
                cohort.size(), settings.getCapacity(), settings.getMinPlayers(), registrationDeadline));
    }
}
