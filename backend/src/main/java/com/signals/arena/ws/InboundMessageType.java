package com.signals.arena.ws;

public enum InboundMessageType {
    AUTH_RESPONSE,
    REQUEST_AUTH,
    JOIN_QUEUE,
    LEAVE_QUEUE,
    MATCH_MESSAGE,
    READY,
    COMMIT_CHOICE,
    REVEAL_CHOICE,
    JOIN_TOURNAMENT_QUEUE,
    LEAVE_TOURNAMENT_QUEUE,
    PLACE_BET,
    PING,
    DISCONNECT
}
