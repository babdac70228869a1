package com.signals.arena.ws;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Registry-side state of one connection. Only the arena core thread mutates it.
 */
@Getter
@Setter
public class ConnectionSession {

    private final ArenaConnection connection;
    private final ConnectionRole role;
    private final Instant connectedAt;

    private String address;
    private String displayName;
    private String pendingChallengeId;

    public ConnectionSession(ArenaConnection connection, ConnectionRole role, Instant connectedAt) {
        this.connection = connection;
        this.role = role;
        this.connectedAt = connectedAt;
    }

    public String getConnectionId() {
        return connection.id();
    }

    public boolean isAuthenticated() {
        return address != null;
    }
}
