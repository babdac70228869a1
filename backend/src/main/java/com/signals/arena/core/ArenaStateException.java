package com.signals.arena.core;

import lombok.Getter;

/**
 * An action that is well-formed but not allowed in the current phase or for the caller's identity.
 * Rejecting it never changes state.
 */
@Getter
public class ArenaStateException extends RuntimeException {

    private final String code;

    public ArenaStateException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static ArenaStateException notAuthenticated() {
        return new ArenaStateException("not_authenticated", "Connection has no bound wallet address");
    }

    public static ArenaStateException wrongRole(String action) {
        return new ArenaStateException("wrong_role", "Connection role may not " + action);
    }

    public static ArenaStateException matchNotFound(long matchId) {
        return new ArenaStateException("match_not_found", "Unknown match " + matchId);
    }

    public static ArenaStateException notInMatch(long matchId) {
        return new ArenaStateException("not_in_match", "Caller is not a participant of match " + matchId);
    }

    public static ArenaStateException wrongPhase(long matchId, String expected, String actual) {
        return new ArenaStateException(
                "wrong_phase",
                "Match " + matchId + " is in " + actual + ", expected " + expected
        );
    }

    public static ArenaStateException alreadyCommitted(long matchId) {
        return new ArenaStateException("already_committed", "Commitment already recorded for match " + matchId);
    }

    public static ArenaStateException noCommitment(long matchId) {
        return new ArenaStateException("no_commitment", "No commitment recorded for match " + matchId);
    }

    public static ArenaStateException alreadyRevealed(long matchId) {
        return new ArenaStateException("already_revealed", "Reveal already recorded for match " + matchId);
    }

    public static ArenaStateException alreadyInMatch(String address) {
        return new ArenaStateException("already_in_match", address + " has an unsettled match");
    }

    public static ArenaStateException alreadyQueuedElsewhere(String address, String queue) {
        return new ArenaStateException("already_queued_elsewhere", address + " is already waiting in the " + queue);
    }

    public static ArenaStateException inTournament(String address) {
        return new ArenaStateException("in_tournament", address + " is playing in an active tournament");
    }

    public static ArenaStateException poolNotOpen(long matchId, String state) {
        return new ArenaStateException("pool_not_open", "Betting pool for match " + matchId + " is " + state);
    }

    public static ArenaStateException ownMatchBet(long matchId) {
        return new ArenaStateException("own_match_bet", "Participants may not bet on match " + matchId);
    }
}
