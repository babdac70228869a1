package com.signals.arena.match;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PoolOutcomeTest {

    @Test
    void of_coversAllFourCombinations() {
        assertPoints(PoolOutcome.of(Choice.SPLIT, Choice.SPLIT), PoolOutcome.BOTH_SPLIT, 3, 3);
        assertPoints(PoolOutcome.of(Choice.STEAL, Choice.SPLIT), PoolOutcome.AGENT_A_STEALS, 5, 0);
        assertPoints(PoolOutcome.of(Choice.SPLIT, Choice.STEAL), PoolOutcome.AGENT_B_STEALS, 0, 5);
        assertPoints(PoolOutcome.of(Choice.STEAL, Choice.STEAL), PoolOutcome.BOTH_STEAL, 0, 0);
    }

    @Test
    void forfeit_complierStealsFromTheForfeiter() {
        assertEquals(PoolOutcome.AGENT_A_STEALS, PoolOutcome.resolve(Choice.SPLIT, false, null, true));
        assertEquals(PoolOutcome.AGENT_B_STEALS, PoolOutcome.resolve(null, true, Choice.STEAL, false));
        assertEquals(PoolOutcome.BOTH_STEAL, PoolOutcome.resolve(null, true, null, true));
    }

    @Test
    void matchResult_hidesForfeitedChoices() {
        MatchResult result = MatchResult.of(Choice.SPLIT, false, Choice.SPLIT, true);

        assertEquals(PoolOutcome.AGENT_A_STEALS, result.outcome());
        assertEquals(Choice.SPLIT, result.revealedChoiceA());
        assertNull(result.revealedChoiceB());
        assertEquals(5, result.pointsA());
        assertEquals(0, result.pointsB());
        assertTrue(result.forfeitB());
    }

    @Test
    void parse_acceptsNamesAndCodes() {
        assertEquals(PoolOutcome.BOTH_STEAL, PoolOutcome.parse("3"));
        assertEquals(PoolOutcome.AGENT_A_STEALS, PoolOutcome.parse("agent_a_steals"));
        assertEquals(Choice.SPLIT, Choice.parse("1"));
        assertEquals(Choice.STEAL, Choice.parse("steal"));
        assertThrows(IllegalArgumentException.class, () -> Choice.parse("cooperate"));
        assertThrows(IllegalArgumentException.class, () -> PoolOutcome.parse("9"));
    }

    private static void assertPoints(PoolOutcome actual, PoolOutcome expected, int pointsA, int pointsB) {
        assertEquals(expected, actual);
        assertEquals(pointsA, actual.pointsA());
        assertEquals(pointsB, actual.pointsB());
    }
}
