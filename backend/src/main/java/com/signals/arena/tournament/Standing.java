package com.signals.arena.tournament;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One player's running score inside a tournament. Points only ever increase.
 */
@Getter
public class Standing {

    private final String address;
    private int points;
    private int buchholz;
    private int matchesPlayed;
    private boolean hadBye;
    private final List<String> opponentsFaced = new ArrayList<>();

    public Standing(String address) {
        this.address = address;
    }

    public List<String> getOpponentsFaced() {
        return Collections.unmodifiableList(opponentsFaced);
    }

    public boolean hasFaced(String opponent) {
        return opponentsFaced.contains(opponent);
    }

    void recordMatch(String opponent, int earned) {
        if (earned < 0) {
            throw new IllegalArgumentException("Points earned must be non-negative");
        }
        opponentsFaced.add(opponent);
        points += earned;
        matchesPlayed++;
    }

    void awardBye(int byePoints) {
        hadBye = true;
        points += byePoints;
    }

    void setBuchholz(int buchholz) {
        this.buchholz = buchholz;
    }
}
