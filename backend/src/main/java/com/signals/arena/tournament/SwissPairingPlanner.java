package com.signals.arena.tournament;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Swiss-system pairing.
 *
 * Round 1 pairs a random shuffle. Later rounds sort by points, then Buchholz, then address, and
 * pair each top unpaired player with the highest-ranked opponent they have not met yet. If no
 * repeat-free pairing of the whole field exists (or the search budget runs out) it falls back to a
 * greedy pass that takes the next player in order when every remaining candidate is a rematch.
 * This is a heuristic; it does not minimise score differences globally.
 */
@Component
public class SwissPairingPlanner {

    static final Comparator<Standing> STANDINGS_ORDER =
            Comparator.comparingInt(Standing::getPoints).reversed()
                    .thenComparing(Comparator.comparingInt(Standing::getBuchholz).reversed())
                    .thenComparing(Standing::getAddress);

    private static final int SEARCH_BUDGET = 20_000;

    public PlannedRound plan(int round, List<Standing> standings, Random random) {
        if (standings == null || standings.size() < 2) {
            throw new IllegalArgumentException("Swiss pairing needs at least two players");
        }

        List<Standing> ordered = new ArrayList<>(standings);
        if (round == 1) {
            ordered.sort(Comparator.comparing(Standing::getAddress));
            Collections.shuffle(ordered, random);
        } else {
            ordered.sort(STANDINGS_ORDER);
        }

        String bye = null;
        if (ordered.size() % 2 == 1) {
            int byeIndex = ordered.size() - 1;
            for (int i = ordered.size() - 1; i >= 0; i--) {
                if (!ordered.get(i).isHadBye()) {
                    byeIndex = i;
                    break;
                }
            }
            bye = ordered.remove(byeIndex).getAddress();
        }

        List<PlannedRound.Pairing> pairings = new ArrayList<>();
        int[] budget = {SEARCH_BUDGET};
        if (pairWithoutRepeats(ordered, pairings, budget)) {
            return new PlannedRound(round, List.copyOf(pairings), bye, 0);
        }

        pairings.clear();
        int repeats = pairGreedily(ordered, pairings);
        return new PlannedRound(round, List.copyOf(pairings), bye, repeats);
    }

    private static boolean pairWithoutRepeats(List<Standing> remaining, List<PlannedRound.Pairing> out, int[] budget) {
        if (remaining.isEmpty()) {
            return true;
        }
        if (--budget[0] < 0) {
            return false;
        }

        Standing top = remaining.get(0);
        for (int i = 1; i < remaining.size(); i++) {
            Standing candidate = remaining.get(i);
            if (top.hasFaced(candidate.getAddress())) {
                continue;
            }
            List<Standing> rest = new ArrayList<>(remaining);
            rest.remove(i);
            rest.remove(0);
            out.add(new PlannedRound.Pairing(top.getAddress(), candidate.getAddress(), 0L));
            if (pairWithoutRepeats(rest, out, budget)) {
                return true;
            }
            out.remove(out.size() - 1);
        }
        return false;
    }

    private static int pairGreedily(List<Standing> ordered, List<PlannedRound.Pairing> out) {
        List<Standing> remaining = new ArrayList<>(ordered);
        int repeats = 0;
        while (remaining.size() >= 2) {
            Standing top = remaining.remove(0);
            int pick = 0;
            for (int i = 0; i < remaining.size(); i++) {
                if (!top.hasFaced(remaining.get(i).getAddress())) {
                    pick = i;
                    break;
                }
            }
            Standing opponent = remaining.remove(pick);
            if (top.hasFaced(opponent.getAddress())) {
                repeats++;
            }
            out.add(new PlannedRound.Pairing(top.getAddress(), opponent.getAddress(), 0L));
        }
        return repeats;
    }
}
