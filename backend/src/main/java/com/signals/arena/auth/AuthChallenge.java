package com.signals.arena.auth;

import java.time.Instant;

public record AuthChallenge(
        String challengeId,
        String nonce,
        String connectionId,
        String message,
        Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
