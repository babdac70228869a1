package com.signals.arena.config;

public enum LedgerMode {
    LOGGING,
    WEB3J
}
