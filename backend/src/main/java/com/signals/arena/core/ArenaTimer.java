package com.signals.arena.core;

/**
 * Handle to a deadline scheduled on the {@link ArenaEventLoop}.
 */
public interface ArenaTimer {

    void cancel();

    boolean isCancelled();
}
