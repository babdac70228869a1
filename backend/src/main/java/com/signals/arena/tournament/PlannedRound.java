package com.signals.arena.tournament;

import java.util.List;

/**
 * Output of {@link SwissPairingPlanner}: who plays whom this round and who sits out.
 */
public record PlannedRound(
        int round,
        List<Pairing> pairings,
        String byeAddress,
        int repeatPairings
) {

    public record Pairing(
            String agentA,
            String agentB,
            long matchId
    ) {

        public Pairing withMatchId(long id) {
            return new Pairing(agentA, agentB, id);
        }
    }
}
