package com.signals.arena.tournament;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SwissPairingPlannerTest {

    private final SwissPairingPlanner planner = new SwissPairingPlanner();

    @Test
    void plan_firstRoundPairsEveryPlayerExactlyOnce() {
        List<Standing> field = field("0xa", "0xb", "0xc", "0xd", "0xe", "0xf");

        PlannedRound round = planner.plan(1, field, new Random(11));

        assertEquals(3, round.pairings().size());
        assertNull(round.byeAddress());
        assertEquals(6, playersIn(round).size());
    }

    @Test
    void plan_laterRoundsPairByPointsAndAvoidRematches() {
        Standing a = new Standing("0xa");
        Standing b = new Standing("0xb");
        Standing c = new Standing("0xc");
        Standing d = new Standing("0xd");
        a.recordMatch("0xb", 5);
        b.recordMatch("0xa", 0);
        c.recordMatch("0xd", 3);
        d.recordMatch("0xc", 3);

        PlannedRound round = planner.plan(2, List.of(a, b, c, d), new Random(1));

        assertEquals(0, round.repeatPairings());
        for (PlannedRound.Pairing pairing : round.pairings()) {
            Standing first = "0xa".equals(pairing.agentA()) ? a
                    : "0xb".equals(pairing.agentA()) ? b
                    : "0xc".equals(pairing.agentA()) ? c : d;
            assertFalse(first.hasFaced(pairing.agentB()));
        }
        assertEquals("0xa", round.pairings().get(0).agentA());
    }

    @Test
    void plan_byeGoesToTheLowestRankedPlayerWithoutOne() {
        Standing a = new Standing("0xa");
        Standing b = new Standing("0xb");
        Standing c = new Standing("0xc");
        a.recordMatch("0xb", 5);
        b.recordMatch("0xa", 0);
        c.awardBye(3);

        PlannedRound round = planner.plan(2, List.of(a, b, c), new Random(1));

        assertEquals("0xb", round.byeAddress());
        assertEquals(1, round.pairings().size());
        PlannedRound.Pairing pairing = round.pairings().get(0);
        assertEquals(Set.of("0xa", "0xc"), Set.of(pairing.agentA(), pairing.agentB()));
    }

    @Test
    void plan_fallsBackToARepeatWhenNoFreshOpponentRemains() {
        Standing a = new Standing("0xa");
        Standing b = new Standing("0xb");
        a.recordMatch("0xb", 3);
        b.recordMatch("0xa", 3);

        PlannedRound round = planner.plan(2, List.of(a, b), new Random(1));

        assertEquals(1, round.repeatPairings());
        assertEquals(1, round.pairings().size());
    }

    @Test
    void plan_rejectsFieldsSmallerThanTwo() {
        assertThrows(IllegalArgumentException.class, () -> planner.plan(1, field("0xa"), new Random(1)));
    }

    @Test
    void plan_sameSeedGivesTheSameFirstRound() {
        PlannedRound first = planner.plan(1, field("0xa", "0xb", "0xc", "0xd"), new Random(3));
        PlannedRound second = planner.plan(1, field("0xd", "0xc", "0xb", "0xa"), new Random(3));

        assertEquals(first.pairings(), second.pairings());
        assertTrue(playersIn(first).containsAll(List.of("0xa", "0xb", "0xc", "0xd")));
    }

    private static List<Standing> field(String... addresses) {
        return Arrays.stream(addresses).map(Standing::new).toList();
    }

    private static Set<String> playersIn(PlannedRound round) {
        Set<String> players = new HashSet<>();
        for (PlannedRound.Pairing pairing : round.pairings()) {
            players.add(pairing.agentA());
            players.add(pairing.agentB());
        }
        return players;
    }
}
