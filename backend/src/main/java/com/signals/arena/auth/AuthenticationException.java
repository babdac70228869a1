package com.signals.arena.auth;

/**
 * A challenge response that did not bind the connection. The connection stays open, unauthenticated.
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
