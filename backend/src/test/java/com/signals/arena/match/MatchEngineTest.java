package com.signals.arena.match;

import com.fasterxml.jackson.databind.JsonNode;
import com.signals.arena.betting.PoolState;
import com.signals.arena.core.ArenaStateException;
import com.signals.arena.support.ArenaTestFixture;
import com.signals.arena.support.RecordingConnection;
import com.signals.arena.ws.ConnectionRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.StreamSupport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchEngineTest {

    private static final String ALICE = ArenaTestFixture.address(0xa11ce);
    private static final String BOB = ArenaTestFixture.address(0xb0b);
    private static final String NONCE_A = "0x" + "0a".repeat(32);
    private static final String NONCE_B = "0x" + "0b".repeat(32);

    private ArenaTestFixture fixture;
    private RecordingConnection alice;
    private RecordingConnection bob;
    private RecordingConnection spectator;

    @BeforeEach
    void setUp() {
        fixture = new ArenaTestFixture();
        alice = fixture.connectAgent(ALICE);
        bob = fixture.connectAgent(BOB);
        spectator = fixture.connect("spectator", ConnectionRole.SPECTATOR, null);
    }

    @Test
    void fullFlow_bothSplitAndRequeue() {
        fixture.matchmakingQueue.addToQueue(ALICE, alice.id());
        fixture.matchmakingQueue.addToQueue(BOB, bob.id());
        fixture.eventLoop.advance(Duration.ofMillis(200));

        Match match = fixture.matchEngine.activeMatchFor(ALICE).orElseThrow();
        assertEquals(MatchPhase.NEGOTIATION, match.getPhase());
        assertEquals(fixture.eventLoop.now().plusSeconds(45), match.getPhaseDeadline());
        assertTrue(spectator.received("MATCH_STARTED"));

        fixture.eventLoop.advance(Duration.ofSeconds(45));
        assertEquals(MatchPhase.AWAITING_CHOICES, match.getPhase());
        assertEquals(fixture.eventLoop.now().plusSeconds(15), match.getPhaseDeadline());
        assertTrue(alice.received("SIGN_CHOICE"));

        commit(match, ALICE, Choice.SPLIT, NONCE_A);
        commit(match, BOB, Choice.SPLIT, NONCE_B);
        assertEquals(MatchPhase.SETTLING, match.getPhase());
        assertEquals(PoolState.LOCKED, fixture.bettingPoolService.findPool(match.getId()).orElseThrow().getState());

        fixture.matchEngine.submitReveal(ALICE, match.getId(), Choice.SPLIT, NONCE_A);
        fixture.matchEngine.submitReveal(BOB, match.getId(), Choice.SPLIT, NONCE_B);

        assertEquals(MatchPhase.COMPLETE, match.getPhase());
        assertEquals(PoolOutcome.BOTH_SPLIT, match.getResult().outcome());
        assertEquals(3, match.getResult().pointsA());
        assertEquals(3, match.getResult().pointsB());

        JsonNode revealed = spectator.lastPayloadOf("CHOICES_REVEALED");
        assertEquals("BOTH_SPLIT", revealed.get("outcome").asText());

        assertTrue(fixture.matchmakingQueue.contains(ALICE));
        assertTrue(fixture.matchmakingQueue.contains(BOB));

        fixture.eventLoop.runPending();
        assertNotNull(match.getSettlementTxRef());
        assertTrue(alice.received("MATCH_CONFIRMED"));
    }

    @Test
    void fullFlow_missingCommitmentForfeitsToTheCommitter() {
        Match match = fixture.matchEngine.createMatch(ALICE, BOB, Match.NO_TOURNAMENT);
        fixture.eventLoop.advance(Duration.ofSeconds(45));

        commit(match, ALICE, Choice.SPLIT, NONCE_A);
        fixture.eventLoop.advance(Duration.ofSeconds(15));

        assertEquals(MatchPhase.SETTLING, match.getPhase());
        assertTrue(match.isForfeitB());
        assertEquals(List.of(BOB), jsonList(spectator.lastPayloadOf("CHOICE_TIMEOUT").get("missingAgents")));

        fixture.matchEngine.submitReveal(ALICE, match.getId(), Choice.SPLIT, NONCE_A);

        assertEquals(MatchPhase.COMPLETE, match.getPhase());
        assertEquals(PoolOutcome.AGENT_A_STEALS, match.getResult().outcome());
        assertEquals(5, match.getResult().pointsA());
        assertEquals(0, match.getResult().pointsB());
        assertNull(match.getResult().revealedChoiceB());
    }

    @Test
    void submitReveal_mismatchedRevealIsAForfeit() {
        Match match = startChoices();
        commit(match, ALICE, Choice.SPLIT, NONCE_A);
        commit(match, BOB, Choice.SPLIT, NONCE_B);

        fixture.matchEngine.submitReveal(ALICE, match.getId(), Choice.STEAL, NONCE_A);
        fixture.matchEngine.submitReveal(BOB, match.getId(), Choice.SPLIT, NONCE_B);

        assertTrue(match.getResult().forfeitA());
        assertEquals(PoolOutcome.AGENT_B_STEALS, match.getResult().outcome());
        assertEquals(0, match.getResult().pointsA());
        assertEquals(5, match.getResult().pointsB());
    }

    @Test
    void fullFlow_nonRevealForfeitsBothSides() {
        Match match = startChoices();
        commit(match, ALICE, Choice.STEAL, NONCE_A);
        commit(match, BOB, Choice.SPLIT, NONCE_B);

        fixture.eventLoop.advance(Duration.ofSeconds(15));

        assertEquals(MatchPhase.COMPLETE, match.getPhase());
        assertEquals(PoolOutcome.BOTH_STEAL, match.getResult().outcome());
        assertEquals(0, match.getResult().pointsA());
        assertEquals(0, match.getResult().pointsB());
    }

    @Test
    void fullFlow_neitherCommittingCompletesAtTheCommitDeadline() {
        Match match = startChoices();

        fixture.eventLoop.advance(Duration.ofSeconds(15));

        assertEquals(MatchPhase.COMPLETE, match.getPhase());
        assertEquals(PoolOutcome.BOTH_STEAL, match.getResult().outcome());
    }

    @Test
    void markReady_bothReadyEndsNegotiationEarly() {
        Match match = fixture.matchEngine.createMatch(ALICE, BOB, Match.NO_TOURNAMENT);
        fixture.matchEngine.postMessage(ALICE, match.getId(), "  let's both split  ");
        fixture.matchEngine.markReady(ALICE, match.getId());
        assertEquals(MatchPhase.NEGOTIATION, match.getPhase());

        fixture.matchEngine.markReady(BOB, match.getId());
        assertEquals(MatchPhase.AWAITING_CHOICES, match.getPhase());
        assertEquals("let's both split", match.getMessages().get(0).text());

        fixture.eventLoop.advance(Duration.ofSeconds(14));
        assertEquals(MatchPhase.AWAITING_CHOICES, match.getPhase());
    }

    @Test
    void submitCommitment_rejectsOutOfPhaseAndDuplicateActions() {
        Match match = fixture.matchEngine.createMatch(ALICE, BOB, Match.NO_TOURNAMENT);

        assertEquals("wrong_phase", assertThrows(ArenaStateException.class,
                () -> commit(match, ALICE, Choice.SPLIT, NONCE_A)).getCode());
        assertEquals("not_in_match", assertThrows(ArenaStateException.class,
                () -> fixture.matchEngine.postMessage(ArenaTestFixture.address(0xc), match.getId(), "hi")).getCode());
        assertThrows(ArenaStateException.class, () -> fixture.matchEngine.createMatch(ALICE, ArenaTestFixture.address(0xd), 0L));

        fixture.eventLoop.advance(Duration.ofSeconds(45));
        commit(match, ALICE, Choice.SPLIT, NONCE_A);
        assertEquals("already_committed", assertThrows(ArenaStateException.class,
                () -> commit(match, ALICE, Choice.STEAL, NONCE_A)).getCode());
        assertFalse(match.isComplete());
    }

    @Test
    void evictExpired_dropsCompletedMatchesAfterRetention() {
        Match match = startChoices();
        fixture.eventLoop.advance(Duration.ofSeconds(15));
        assertTrue(match.isComplete());

        assertEquals(0, fixture.matchEngine.evictExpired());
        fixture.eventLoop.advance(Duration.ofMinutes(5).plusSeconds(1));

        assertEquals(1, fixture.matchEngine.evictExpired());
        assertTrue(fixture.matchEngine.findMatch(match.getId()).isEmpty());
        assertTrue(fixture.bettingPoolService.findPool(match.getId()).isEmpty());
    }

    private Match startChoices() {
        Match match = fixture.matchEngine.createMatch(ALICE, BOB, Match.NO_TOURNAMENT);
        fixture.eventLoop.advance(Duration.ofSeconds(45));
        return match;
    }

    private void commit(Match match, String agent, Choice choice, String nonceHex) {
        String hash = CommitmentCodec.computeCommitmentHash(match.getId(), agent, choice, CommitmentCodec.decodeNonce(nonceHex));
        fixture.matchEngine.submitCommitment(agent, match.getId(), hash);
    }

    private static List<String> jsonList(JsonNode array) {
        return StreamSupport.stream(array.spliterator(), false).map(JsonNode::asText).toList();
    }
}
