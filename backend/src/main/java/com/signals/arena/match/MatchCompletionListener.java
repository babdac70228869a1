package com.signals.arena.match;

/**
 * Callback fired once per match after it reaches {@link MatchPhase#COMPLETE}.
 */
@FunctionalInterface
public interface MatchCompletionListener {

    void onMatchComplete(long matchId, String addressA, String addressB);
}
