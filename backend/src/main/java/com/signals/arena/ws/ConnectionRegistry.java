package com.signals.arena.ws;

import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.WalletAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks every live connection and is the only fan-out point for outbound events.
 * All emission happens on the arena core thread, and each connection buffers its frames in order,
 * so a subscriber sees events in exactly the order they were issued.
 *
 * <p>Verified addresses are indexed per role. An agent identity can only be taken over by another agent
 * connection, and address lookups used for match traffic resolve agent sessions only.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ArenaMessageCodec codec;
    private final ArenaEventLoop eventLoop;

    private final Map<String, ConnectionSession> sessionsById = new LinkedHashMap<>();
    private final Map<ConnectionRole, Map<String, String>> connectionIdByAddress = new EnumMap<>(ConnectionRole.class);

    public ConnectionRegistry(ArenaMessageCodec codec, ArenaEventLoop eventLoop) {
        this.codec = codec;
        this.eventLoop = eventLoop;
        for (ConnectionRole role : ConnectionRole.values()) {
            connectionIdByAddress.put(role, new HashMap<>());
        }
    }

    public ConnectionSession addConnection(ArenaConnection connection, ConnectionRole role) {
        ConnectionSession session = new ConnectionSession(connection, role, eventLoop.now());
        sessionsById.put(connection.id(), session);
        log.debug("Connection {} registered as {}", connection.id(), role);
        return session;
    }

    /**
     * Drops the connection and every association it held. Returns the removed session so the caller
     * can route the disconnect to whichever components reference its address.
     */
    public Optional<ConnectionSession> removeConnection(String connectionId) {
        ConnectionSession session = sessionsById.remove(connectionId);
        if (session == null) {
            return Optional.empty();
        }
        String address = session.getAddress();
        if (address != null) {
            connectionIdByAddress.get(session.getRole()).remove(address, connectionId);
        }
        log.debug("Connection {} removed (role={}, address={})", connectionId, session.getRole(), address);
        return Optional.of(session);
    }

    /**
     * Binds a verified address to a connection. A newer connection with the same role and address takes
     * it over; connections with other roles are untouched.
     */
    public void bindAddress(String connectionId, String address, String displayName) {
        ConnectionSession session = sessionsById.get(connectionId);
        if (session == null) {
            return;
        }
        String normalized = WalletAddresses.normalize(address);

        String previousId = connectionIdByAddress.get(session.getRole()).put(normalized, connectionId);
        if (previousId != null && !previousId.equals(connectionId)) {
            ConnectionSession previous = sessionsById.get(previousId);
            if (previous != null) {
                previous.setAddress(null);
                log.info("{} address {} moved from connection {} to {}",
                        session.getRole(), normalized, previousId, connectionId);
            }
        }

        session.setAddress(normalized);
        session.setDisplayName(displayName != null ? displayName : WalletAddresses.shorten(normalized));
        session.setPendingChallengeId(null);
    }

    public Optional<ConnectionSession> find(String connectionId) {
        return Optional.ofNullable(sessionsById.get(connectionId));
    }

    /**
     * Resolves the agent connection bound to {@code address}.
     */
    public Optional<ConnectionSession> getConnectionByAddress(String address) {
        return getConnectionByAddress(ConnectionRole.AGENT, address);
    }

    Optional<ConnectionSession> getConnectionByAddress(ConnectionRole role, String address) {
        if (!WalletAddresses.isValid(address)) {
            return Optional.empty();
        }
        String connectionId = connectionIdByAddress.get(role).get(WalletAddresses.normalize(address));
        return connectionId == null ? Optional.empty() : Optional.ofNullable(sessionsById.get(connectionId));
    }

    public boolean isConnected(String address) {
        return getConnectionByAddress(address)
                .map(session -> session.getConnection().isOpen())
                .orElse(false);
    }

    public String displayName(String address) {
        return getConnectionByAddress(address)
                .map(ConnectionSession::getDisplayName)
                .orElse(WalletAddresses.shorten(address));
    }

    public void send(String connectionId, ArenaEventType type, Object payload) {
        ConnectionSession session = sessionsById.get(connectionId);
        if (session == null) {
            return;
        }
        deliver(session, codec.encode(type, payload, eventLoop.now()));
    }

    public void sendToAddress(String address, ArenaEventType type, Object payload) {
        getConnectionByAddress(address)
                .ifPresent(session -> deliver(session, codec.encode(type, payload, eventLoop.now())));
    }

    /**
     * Fans out to every connection with {@code role}, or to every connection when {@code role} is null.
     */
    public void broadcast(ConnectionRole role, ArenaEventType type, Object payload) {
        String text = codec.encode(type, payload, eventLoop.now());
        for (ConnectionSession session : sessionsById.values()) {
            if (role == null || session.getRole() == role) {
                deliver(session, text);
            }
        }
    }

    public void broadcastAll(ArenaEventType type, Object payload) {
        broadcast(null, type, payload);
    }

    /**
     * Delivers a match event to both participants and to every spectator and bettor.
     */
    public void broadcastMatch(String addressA, String addressB, ArenaEventType type, Object payload) {
        String text = codec.encode(type, payload, eventLoop.now());
        for (ConnectionSession session : sessionsById.values()) {
            boolean observer = session.getRole() != ConnectionRole.AGENT;
            boolean participant = session.getAddress() != null
                    && (session.getAddress().equals(addressA) || session.getAddress().equals(addressB));
            if (observer || participant) {
                deliver(session, text);
            }
        }
    }

    public ConnectionStats stats() {
        Map<ConnectionRole, Integer> byRole = new EnumMap<>(ConnectionRole.class);
        for (ConnectionRole role : ConnectionRole.values()) {
            byRole.put(role, 0);
        }
        int authenticated = 0;
        for (ConnectionSession session : sessionsById.values()) {
            byRole.merge(session.getRole(), 1, Integer::sum);
            if (session.isAuthenticated()) {
                authenticated++;
            }
        }
        return new ConnectionStats(
                sessionsById.size(),
                byRole.get(ConnectionRole.AGENT),
                byRole.get(ConnectionRole.SPECTATOR),
                byRole.get(ConnectionRole.BETTOR),
                authenticated
        );
    }

    private void deliver(ConnectionSession session, String text) {
        ArenaConnection connection = session.getConnection();
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.send(text);
        } catch (IOException | IllegalStateException ex) {
            log.debug("Dropping frame for connection {}: {}", connection.id(), ex.getMessage());
        }
    }

    public record ConnectionStats(
            int total,
            int agents,
            int spectators,
            int bettors,
            int authenticated
    ) {
    }
}
