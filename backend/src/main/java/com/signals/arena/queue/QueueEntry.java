package com.signals.arena.queue;

import java.time.Instant;

public record QueueEntry(
        String address,
        String connectionId,
        Instant joinedAt
) {
}
