package com.signals.arena.ws;

/**
 * Every outbound event type the arena emits.
 */
public enum ArenaEventType {
    AUTH_CHALLENGE,
    AUTH_SUCCESS,
    AUTH_FAILED,

    QUEUE_JOINED,
    QUEUE_UPDATE,
    QUEUE_LEFT,

    MATCH_STARTED,
    NEGOTIATION_MESSAGE,
    CHOICE_PHASE_STARTED,
    SIGN_CHOICE,
    CHOICE_LOCKED,
    CHOICE_ACCEPTED,
    CHOICES_REVEALED,
    CHOICE_TIMEOUT,
    MATCH_CONFIRMED,

    TOURNAMENT_CREATED,
    TOURNAMENT_STARTED,
    TOURNAMENT_ROUND_STARTED,
    TOURNAMENT_UPDATE,
    TOURNAMENT_ROUND_COMPLETE,
    TOURNAMENT_COMPLETE,
    TOURNAMENT_PLAYER_JOINED,
    TOURNAMENT_QUEUE_UPDATE,
    TOURNAMENT_QUEUE_JOINED,
    TOURNAMENT_QUEUE_LEFT,
    TOURNAMENT_INVITE,

    BET_PLACED,
    POOL_UPDATE,
    POOL_SETTLED,

    PONG,
    ERROR
}
