package com.signals.arena.ledger;

/**
 * A settlement call that did not go through. Always retried; never reverses local match state.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
