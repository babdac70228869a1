package com.signals.arena.match;

import com.signals.arena.betting.BettingPoolService;
import com.signals.arena.config.ArenaProperties;
import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.ArenaStateException;
import com.signals.arena.ledger.SettlementSubmitter;
import com.signals.arena.ws.ArenaEventPayloads;
import com.signals.arena.ws.ArenaEventType;
import com.signals.arena.ws.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every match through {@code NEGOTIATION → AWAITING_CHOICES → SETTLING → COMPLETE}.
 *
 * All methods must be called on the arena core thread. Phase deadlines are loop timers tagged with
 * the phase they were armed for; a firing whose phase no longer matches is stale and ignored.
 * The engine knows nothing about queues or tournaments: owners learn about completion through
 * {@link #onComplete(MatchCompletionListener)}.
 */
@Service
public class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final ArenaEventLoop eventLoop;
    private final ConnectionRegistry connectionRegistry;
    private final BettingPoolService bettingPoolService;
    private final SettlementSubmitter settlementSubmitter;
    private final ArenaProperties.Match settings;

    private final Map<Long, Match> matches = new LinkedHashMap<>();
    private final List<MatchCompletionListener> completionListeners = new CopyOnWriteArrayList<>();
    private long nextMatchId = 1L;

    public MatchEngine(
            ArenaEventLoop eventLoop,
            ConnectionRegistry connectionRegistry,
            BettingPoolService bettingPoolService,
            SettlementSubmitter settlementSubmitter,
            ArenaProperties arenaProperties
    ) {
        this.eventLoop = eventLoop;
        this.connectionRegistry = connectionRegistry;
        this.bettingPoolService = bettingPoolService;
        this.settlementSubmitter = settlementSubmitter;
        this.settings = arenaProperties.getMatch();
    }

    public void onComplete(MatchCompletionListener listener) {
        completionListeners.add(listener);
    }

    public Match createMatch(String agentA, String agentB, long tournamentId) {
        if (agentA.equals(agentB)) {
            throw new IllegalArgumentException("An agent cannot be matched against itself: " + agentA);
        }
        if (isInActiveMatch(agentA)) {
            throw ArenaStateException.alreadyInMatch(agentA);
        }
        if (isInActiveMatch(agentB)) {
            throw ArenaStateException.alreadyInMatch(agentB);
        }

        Instant now = eventLoop.now();
        Match match = new Match(nextMatchId++, tournamentId, agentA, agentB, now);
        matches.put(match.getId(), match);
        bettingPoolService.open(match.getId());

        enterPhase(match, MatchPhase.NEGOTIATION, settings.getNegotiationWindow());
        log.info("Match {} created: {} vs {} (tournament={})", match.getId(), agentA, agentB, tournamentId);

        connectionRegistry.broadcastMatch(agentA, agentB, ArenaEventType.MATCH_STARTED, new ArenaEventPayloads.MatchStarted(
                match.getId(),
                tournamentId,
                agentA,
                connectionRegistry.displayName(agentA),
                agentB,
                connectionRegistry.displayName(agentB),
                match.getPhase(),
                match.getPhaseDeadline()
        ));
        return match;
    }

    public void postMessage(String address, long matchId, String text) {
        Match match = requireParticipant(address, matchId);
        requirePhase(match, MatchPhase.NEGOTIATION);
        if (text == null || text.isBlank()) {
            throw new ArenaStateException("empty_message", "Negotiation message is empty");
        }

        String trimmed = text.strip();
        if (trimmed.length() > settings.getMaxMessageLength()) {
            trimmed = trimmed.substring(0, settings.getMaxMessageLength());
        }
        NegotiationMessage message = new NegotiationMessage(address, trimmed, eventLoop.now());
        match.appendMessage(message);

        connectionRegistry.broadcastMatch(match.getAgentA(), match.getAgentB(), ArenaEventType.NEGOTIATION_MESSAGE,
                new ArenaEventPayloads.NegotiationLine(
                        matchId,
                        address,
                        connectionRegistry.displayName(address),
                        trimmed,
                        message.sentAt()
                ));
    }

    /**
     * Ends negotiation early once both agents have signalled they are ready.
     */
    public void markReady(String address, long matchId) {
        Match match = requireParticipant(address, matchId);
        requirePhase(match, MatchPhase.NEGOTIATION);
        if (match.markReady(address)) {
            log.info("Match {} negotiation ended early: both agents ready", matchId);
            startChoicePhase(match);
        }
    }

    public void submitCommitment(String address, long matchId, String commitHash) {
        Match match = requireParticipant(address, matchId);
        requirePhase(match, MatchPhase.AWAITING_CHOICES);
        if (match.commitHashFor(address) != null) {
            throw ArenaStateException.alreadyCommitted(matchId);
        }

        String normalized;
        try {
            normalized = CommitmentCodec.normalizeCommitmentHash(commitHash);
        } catch (IllegalArgumentException ex) {
            throw new ArenaStateException("invalid_commitment", ex.getMessage());
        }

        if (match.isAgentA(address)) {
            match.setCommitHashA(normalized);
        } else {
            match.setCommitHashB(normalized);
        }
        log.debug("Match {} commitment recorded for {}", matchId, address);

        connectionRegistry.sendToAddress(address, ArenaEventType.CHOICE_ACCEPTED,
                new ArenaEventPayloads.ChoiceAccepted(matchId, "COMMIT", normalized));
        connectionRegistry.broadcastMatch(match.getAgentA(), match.getAgentB(), ArenaEventType.CHOICE_LOCKED,
                new ArenaEventPayloads.ChoiceLocked(
                        matchId,
                        address,
                        match.getCommitHashA() != null,
                        match.getCommitHashB() != null
                ));

        if (match.getCommitHashA() != null && match.getCommitHashB() != null) {
            startRevealPhase(match);
        }
    }

    /**
     * Checks a reveal against the stored commitment. A mismatch is recorded as a forfeit, not rejected.
     */
    public void submitReveal(String address, long matchId, Choice choice, String nonceHex) {
        Match match = requireParticipant(address, matchId);
        requirePhase(match, MatchPhase.SETTLING);
        String commitHash = match.commitHashFor(address);
        if (commitHash == null) {
            throw ArenaStateException.noCommitment(matchId);
        }
        if (match.hasRevealed(address)) {
            throw ArenaStateException.alreadyRevealed(matchId);
        }

        boolean valid;
        try {
            byte[] nonce = CommitmentCodec.decodeNonce(nonceHex);
            valid = CommitmentCodec.matches(commitHash, matchId, address, choice, nonce);
        } catch (IllegalArgumentException ex) {
            valid = false;
        }

        boolean agentA = match.isAgentA(address);
        if (agentA) {
            match.setRevealSubmittedA(true);
            match.setRevealedChoiceA(valid ? choice : null);
            match.setForfeitA(!valid);
        } else {
            match.setRevealSubmittedB(true);
            match.setRevealedChoiceB(valid ? choice : null);
            match.setForfeitB(!valid);
        }

        if (valid) {
            connectionRegistry.sendToAddress(address, ArenaEventType.CHOICE_ACCEPTED,
                    new ArenaEventPayloads.ChoiceAccepted(matchId, "REVEAL", commitHash));
        } else {
            log.info("Match {} reveal from {} does not match its commitment; recorded as forfeit", matchId, address);
        }

        if (match.revealsSettled()) {
            complete(match);
        }
    }

    /**
     * Disconnects do not abort a match; the absent agent simply runs into the phase deadlines.
     */
    public void handleDisconnect(String address) {
        activeMatchFor(address).ifPresent(match ->
                log.info("Agent {} disconnected during match {} ({})", address, match.getId(), match.getPhase()));
    }

    public Optional<Match> findMatch(long matchId) {
        return Optional.ofNullable(matches.get(matchId));
    }

    public List<Match> activeMatches() {
        List<Match> active = new ArrayList<>();
        for (Match match : matches.values()) {
            if (!match.isComplete()) {
                active.add(match);
            }
        }
        active.sort(Comparator.comparingLong(Match::getId));
        return active;
    }

    public Optional<Match> activeMatchFor(String address) {
        for (Match match : matches.values()) {
            if (!match.isComplete() && match.isParticipant(address)) {
                return Optional.of(match);
            }
        }
        return Optional.empty();
    }

    public boolean isInActiveMatch(String address) {
        return activeMatchFor(address).isPresent();
    }

    /**
     * Drops completed matches older than the retention window, together with their betting pools.
     *
     * @return number of evicted matches
     */
    public int evictExpired() {
        Instant cutoff = eventLoop.now().minus(settings.getRetention());
        int evicted = 0;
        Iterator<Match> iterator = matches.values().iterator();
        while (iterator.hasNext()) {
            Match match = iterator.next();
            if (match.isComplete() && match.getCompletedAt() != null && match.getCompletedAt().isBefore(cutoff)) {
                iterator.remove();
                bettingPoolService.evict(match.getId());
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} completed matches", evicted);
        }
        return evicted;
    }

    private void startChoicePhase(Match match) {
        enterPhase(match, MatchPhase.AWAITING_CHOICES, settings.getChoiceWindow());
        connectionRegistry.broadcastMatch(match.getAgentA(), match.getAgentB(), ArenaEventType.CHOICE_PHASE_STARTED,
                new ArenaEventPayloads.ChoicePhaseStarted(match.getId(), match.getPhase(), match.getPhaseDeadline()));
        for (String agent : List.of(match.getAgentA(), match.getAgentB())) {
            connectionRegistry.sendToAddress(agent, ArenaEventType.SIGN_CHOICE, new ArenaEventPayloads.SignChoice(
                    match.getId(),
                    agent,
                    CommitmentCodec.SCHEME,
                    Choice.SPLIT.code(),
                    Choice.STEAL.code(),
                    match.getPhaseDeadline()
            ));
        }
    }

    private void startRevealPhase(Match match) {
        if (match.getCommitHashA() == null) {
            match.setForfeitA(true);
        }
        if (match.getCommitHashB() == null) {
            match.setForfeitB(true);
        }

        enterPhase(match, MatchPhase.SETTLING, settings.getRevealWindow());
        bettingPoolService.lock(match.getId());
        connectionRegistry.broadcastMatch(match.getAgentA(), match.getAgentB(), ArenaEventType.CHOICE_PHASE_STARTED,
                new ArenaEventPayloads.ChoicePhaseStarted(match.getId(), match.getPhase(), match.getPhaseDeadline()));

        if (match.revealsSettled()) {
            complete(match);
        }
    }

    private void onDeadline(long matchId, MatchPhase armedFor) {
        Match match = matches.get(matchId);
        if (match == null || match.getPhase() != armedFor) {
            log.debug("Ignoring stale {} deadline for match {}", armedFor, matchId);
            return;
        }
        match.setPhaseTimer(null);

        switch (armedFor) {
            case NEGOTIATION -> startChoicePhase(match);
            case AWAITING_CHOICES -> {
                List<String> missing = new ArrayList<>();
                if (match.getCommitHashA() == null) {
                    missing.add(match.getAgentA());
                }
                if (match.getCommitHashB() == null) {
                    missing.add(match.getAgentB());
                }
                log.info("Match {} commit deadline elapsed; missing={}", matchId, missing);
                broadcastTimeout(match, missing);
                startRevealPhase(match);
            }
            case SETTLING -> {
                List<String> missing = new ArrayList<>();
                if (match.getCommitHashA() != null && !match.isRevealSubmittedA()) {
                    match.setForfeitA(true);
                    missing.add(match.getAgentA());
                }
                if (match.getCommitHashB() != null && !match.isRevealSubmittedB()) {
                    match.setForfeitB(true);
                    missing.add(match.getAgentB());
                }
                log.info("Match {} reveal deadline elapsed; missing={}", matchId, missing);
                broadcastTimeout(match, missing);
                complete(match);
            }
            case COMPLETE -> log.debug("No deadline applies to completed match {}", matchId);
        }
    }

    private void complete(Match match) {
        cancelTimer(match);
        MatchResult result = MatchResult.of(
                match.getRevealedChoiceA(), match.isForfeitA(),
                match.getRevealedChoiceB(), match.isForfeitB()
        );
        match.setResult(result);
        match.setPhase(MatchPhase.COMPLETE);
        match.setPhaseDeadline(null);
        match.setCompletedAt(eventLoop.now());

        log.info("Match {} complete: outcome={}, points={}/{}, forfeits={}/{}",
                match.getId(), result.outcome(), result.pointsA(), result.pointsB(),
                result.forfeitA(), result.forfeitB());

        connectionRegistry.broadcastMatch(match.getAgentA(), match.getAgentB(), ArenaEventType.CHOICES_REVEALED,
                new ArenaEventPayloads.ChoicesRevealed(
                        match.getId(),
                        match.getTournamentId(),
                        match.getAgentA(),
                        match.getAgentB(),
                        result.revealedChoiceA(),
                        result.revealedChoiceB(),
                        result.pointsA(),
                        result.pointsB(),
                        result.outcome(),
                        result.forfeitA(),
                        result.forfeitB()
                ));

        bettingPoolService.settle(match.getId(), result.outcome());

        for (MatchCompletionListener listener : completionListeners) {
            try {
                listener.onMatchComplete(match.getId(), match.getAgentA(), match.getAgentB());
            } catch (RuntimeException ex) {
                log.error("Completion listener failed for match {}", match.getId(), ex);
            }
        }

        long matchId = match.getId();
        settlementSubmitter.submitSettlement(matchId, result.outcome(), match.getAgentA(), match.getAgentB(),
                txRef -> confirmSettlement(matchId, txRef));
    }

    private void confirmSettlement(long matchId, String txRef) {
        Match match = matches.get(matchId);
        if (match == null) {
            return;
        }
        match.setSettlementTxRef(txRef);
        connectionRegistry.broadcastMatch(match.getAgentA(), match.getAgentB(), ArenaEventType.MATCH_CONFIRMED,
                new ArenaEventPayloads.MatchConfirmed(matchId, match.getResult().outcome(), txRef));
    }

    private void enterPhase(Match match, MatchPhase phase, Duration window) {
        cancelTimer(match);
        match.setPhase(phase);
        match.setPhaseDeadline(eventLoop.now().plus(window));
        long matchId = match.getId();
        match.setPhaseTimer(eventLoop.schedule(window, () -> onDeadline(matchId, phase)));
    }

    private void broadcastTimeout(Match match, List<String> missing) {
        if (missing.isEmpty()) {
            return;
        }
        connectionRegistry.broadcastMatch(match.getAgentA(), match.getAgentB(), ArenaEventType.CHOICE_TIMEOUT,
                new ArenaEventPayloads.ChoiceTimeout(match.getId(), match.getPhase(), List.copyOf(missing)));
    }

    private static void cancelTimer(Match match) {
        if (match.getPhaseTimer() != null) {
            match.getPhaseTimer().cancel();
            match.setPhaseTimer(null);
        }
    }

    private Match requireParticipant(String address, long matchId) {
        Match match = matches.get(matchId);
        if (match == null) {
            throw ArenaStateException.matchNotFound(matchId);
        }
        if (address == null || !match.isParticipant(address)) {
            throw ArenaStateException.notInMatch(matchId);
        }
        return match;
    }

    private static void requirePhase(Match match, MatchPhase expected) {
        if (match.getPhase() != expected) {
            throw ArenaStateException.wrongPhase(match.getId(), expected.name(), match.getPhase().name());
        }
    }
}
