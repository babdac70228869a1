package com.signals.arena.queue;

import com.signals.arena.config.ArenaProperties;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.ArenaStateException;
import com.signals.arena.core.ArenaTimer;
import com.signals.arena.match.Match;
import com.signals.arena.match.MatchEngine;
import com.signals.arena.ws.ArenaEventPayloads;
import com.signals.arena.ws.ArenaEventType;
import com.signals.arena.ws.ConnectionRegistry;
import com.signals.arena.ws.ConnectionSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * FIFO queue for quick matches. Pairs the two longest-waiting eligible agents, and puts agents that
 * are still connected back in line once their quick match settles.
 */
@Service
public class MatchmakingQueue {

    private static final Logger log = LoggerFactory.getLogger(MatchmakingQueue.class);

    private final ArenaEventLoop eventLoop;
    private final ConnectionRegistry connectionRegistry;
    private final MatchEngine matchEngine;
    private final Duration pairingDelay;

    private final Map<String, QueueEntry> entries = new LinkedHashMap<>();
    private ArenaTimer pairingTimer;

    public MatchmakingQueue(
            ArenaEventLoop eventLoop,
            ConnectionRegistry connectionRegistry,
            MatchEngine matchEngine,
            ArenaProperties arenaProperties
    ) {
        this.eventLoop = eventLoop;
        this.connectionRegistry = connectionRegistry;
        this.matchEngine = matchEngine;
        this.pairingDelay = arenaProperties.getQueue().getPairingDelay();
        matchEngine.onComplete(this::onMatchComplete);
    }

    /**
     * Appends the address unless it is already queued.
     *
     * @return true when a new entry was added
     */
    public boolean addToQueue(String address, String connectionId) {
        if (entries.containsKey(address)) {
            return false;
        }
        if (matchEngine.isInActiveMatch(address)) {
            throw ArenaStateException.alreadyInMatch(address);
        }

        entries.put(address, new QueueEntry(address, connectionId, eventLoop.now()));
        log.info("Agent {} joined the queue ({} waiting)", address, entries.size());

        connectionRegistry.send(connectionId, ArenaEventType.QUEUE_JOINED,
                new ArenaEventPayloads.QueueJoined(address, entries.size(), entries.size()));
        broadcastQueueUpdate();
        schedulePairing();
        return true;
    }

    public boolean removeFromQueue(String address) {
        QueueEntry removed = entries.remove(address);
        if (removed == null) {
            return false;
        }
        log.info("Agent {} left the queue ({} waiting)", address, entries.size());
        connectionRegistry.send(removed.connectionId(), ArenaEventType.QUEUE_LEFT, new ArenaEventPayloads.QueueLeft(address));
        broadcastQueueUpdate();
        return true;
    }

    /**
     * Pairs waiting agents in arrival order. Entries whose connection is gone are dropped; entries
     * whose address is still in an unsettled match keep their place for a later pass.
     *
     * @return matches created in this pass
     */
    public List<Match> tryPair() {
        pairingTimer = null;
        List<Match> created = new ArrayList<>();
        boolean changed = false;

        List<QueueEntry> eligible = new ArrayList<>();
        Iterator<QueueEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            QueueEntry entry = iterator.next();
            if (!isStillConnected(entry)) {
                iterator.remove();
                changed = true;
                log.debug("Dropped stale queue entry for {}", entry.address());
                continue;
            }
            if (!matchEngine.isInActiveMatch(entry.address())) {
                eligible.add(entry);
            }
        }

        for (int i = 0; i + 1 < eligible.size(); i += 2) {
            QueueEntry first = eligible.get(i);
            QueueEntry second = eligible.get(i + 1);
            entries.remove(first.address());
            entries.remove(second.address());
            changed = true;
            created.add(matchEngine.createMatch(first.address(), second.address(), Match.NO_TOURNAMENT));
        }

        if (changed) {
            broadcastQueueUpdate();
        }
        return created;
    }

    public boolean contains(String address) {
        return entries.containsKey(address);
    }

    public int size() {
        return entries.size();
    }

    public List<QueueEntry> snapshot() {
        return List.copyOf(entries.values());
    }

    private void onMatchComplete(long matchId, String addressA, String addressB) {
        Optional<Match> match = matchEngine.findMatch(matchId);
        if (match.isEmpty() || match.get().isTournamentMatch()) {
            return;
        }
        for (String address : List.of(addressA, addressB)) {
            connectionRegistry.getConnectionByAddress(address)
                    .filter(session -> session.getConnection().isOpen())
                    .ifPresent(session -> addToQueue(address, session.getConnectionId()));
        }
    }

    private void schedulePairing() {
        if (pairingTimer == null && entries.size() >= 2) {
            pairingTimer = eventLoop.schedule(pairingDelay, this::tryPair);
        }
    }

    private boolean isStillConnected(QueueEntry entry) {
        return connectionRegistry.find(entry.connectionId())
                .map(ConnectionSession::getConnection)
                .map(connection -> connection.isOpen())
                .orElse(false);
    }

    private void broadcastQueueUpdate() {
        connectionRegistry.broadcastAll(ArenaEventType.QUEUE_UPDATE, new ArenaEventPayloads.QueueUpdate(entries.size()));
    }
}
