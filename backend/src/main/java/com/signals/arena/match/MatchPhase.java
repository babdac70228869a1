package com.signals.arena.match;

public enum MatchPhase {
    NEGOTIATION,
    AWAITING_CHOICES,
    SETTLING,
    COMPLETE
}
