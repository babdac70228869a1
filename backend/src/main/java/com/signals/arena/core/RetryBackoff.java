package com.signals.arena.core;

import java.time.Duration;

/**
 * Exponential backoff: the delay doubles each attempt and is clamped to {@code maxDelay}.
 */
public final class RetryBackoff {

    private final Duration initialDelay;
    private final Duration maxDelay;

    public RetryBackoff(Duration initialDelay, Duration maxDelay) {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        Duration delay = initialDelay;
        for (int i = 1; i < attempt; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxDelay) >= 0) {
                return maxDelay;
            }
        }
        return delay;
    }
}
