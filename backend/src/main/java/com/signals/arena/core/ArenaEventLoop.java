package com.signals.arena.core;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * The single logical thread that owns all queue, match, tournament and pool state.
 * Inbound messages, timer expirations and ledger continuations are all funnelled through it,
 * so components never synchronise against each other.
 */
public interface ArenaEventLoop {

    /**
     * Enqueues a task behind everything already submitted.
     */
    void execute(Runnable task);

    /**
     * Runs {@code task} on the loop once {@code delay} has elapsed. Firing a timer is just another
     * loop task, so it never interleaves with a message handler.
     */
    ArenaTimer schedule(Duration delay, Runnable task);

    /**
     * Runs a read query on the loop and waits for its result. Callers already on the loop thread
     * run inline.
     */
    <T> T call(Callable<T> query);

    Instant now();
}
