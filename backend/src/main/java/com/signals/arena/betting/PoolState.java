package com.signals.arena.betting;

public enum PoolState {
    OPEN,
    LOCKED,
    SETTLED
}
