package com.signals.arena.ws;

import com.signals.arena.config.ArenaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.Executor;

/**
 * Transport adapter for one endpoint. The role is fixed by the path the client connected to.
 */
public class ArenaWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ArenaWebSocketHandler.class);

    private final ConnectionRole role;
    private final ArenaConnectionGateway gateway;
    private final ArenaProperties.Transport transport;
    private final Executor transportExecutor;

    public ArenaWebSocketHandler(
            ConnectionRole role,
            ArenaConnectionGateway gateway,
            ArenaProperties.Transport transport,
            Executor transportExecutor
    ) {
        this.role = role;
        this.gateway = gateway;
        this.transport = transport;
        this.transportExecutor = transportExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        gateway.opened(new WebSocketArenaConnection(
                session, transportExecutor, transport.getSendTimeLimitMs(), transport.getSendBufferSizeLimitBytes()), role);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        gateway.received(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on {} connection {}: {}", role, session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        gateway.closed(session.getId());
    }

    public ConnectionRole getRole() {
        return role;
    }
}
