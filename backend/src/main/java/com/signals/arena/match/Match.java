package com.signals.arena.match;

import com.signals.arena.core.ArenaTimer;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Live state of one match. Owned by {@link MatchEngine}; other components hold only its id.
 */
@Getter
@Setter
public class Match {

    public static final long NO_TOURNAMENT = 0L;

    private final long id;
    private final long tournamentId;
    private final String agentA;
    private final String agentB;
    private final Instant createdAt;

    private MatchPhase phase = MatchPhase.NEGOTIATION;
    private Instant phaseDeadline;
    private String commitHashA;
    private String commitHashB;
    private Choice revealedChoiceA;
    private Choice revealedChoiceB;
    private boolean revealSubmittedA;
    private boolean revealSubmittedB;
    private boolean forfeitA;
    private boolean forfeitB;
    private MatchResult result;
    private Instant completedAt;
    private String settlementTxRef;

    @Getter(lombok.AccessLevel.NONE)
    private final List<NegotiationMessage> messages = new ArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> readyAgents = new HashSet<>();
    @Getter(lombok.AccessLevel.PACKAGE)
    @Setter(lombok.AccessLevel.PACKAGE)
    private ArenaTimer phaseTimer;

    public Match(long id, long tournamentId, String agentA, String agentB, Instant createdAt) {
        this.id = id;
        this.tournamentId = tournamentId;
        this.agentA = agentA;
        this.agentB = agentB;
        this.createdAt = createdAt;
    }

    public boolean isParticipant(String address) {
        return agentA.equals(address) || agentB.equals(address);
    }

    public boolean isAgentA(String address) {
        return agentA.equals(address);
    }

    public boolean isTournamentMatch() {
        return tournamentId != NO_TOURNAMENT;
    }

    public boolean isComplete() {
        return phase == MatchPhase.COMPLETE;
    }

    public List<NegotiationMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    void appendMessage(NegotiationMessage message) {
        messages.add(message);
    }

    boolean markReady(String address) {
        readyAgents.add(address);
        return readyAgents.contains(agentA) && readyAgents.contains(agentB);
    }

    public String commitHashFor(String address) {
        return isAgentA(address) ? commitHashA : commitHashB;
    }

    public boolean hasRevealed(String address) {
        return isAgentA(address) ? revealSubmittedA : revealSubmittedB;
    }

    /**
     * True once every side has either revealed or is already forfeited for lack of a commitment.
     */
    boolean revealsSettled() {
        boolean sideA = revealSubmittedA || commitHashA == null;
        boolean sideB = revealSubmittedB || commitHashB == null;
        return sideA && sideB;
    }
}
