package com.signals.arena.tournament;

public enum TournamentPhase {
    REGISTRATION,
    ACTIVE,
    COMPLETE,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED;
    }
}
