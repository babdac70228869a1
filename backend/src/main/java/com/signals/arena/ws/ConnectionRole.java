package com.signals.arena.ws;

public enum ConnectionRole {
    AGENT,
    SPECTATOR,
    BETTOR
}
