package com.signals.arena.ws;

import com.signals.arena.core.ArenaEventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point from transport threads into the arena core. Every connection event is handed to the
 * loop as one task, so frames from one connection are processed in arrival order.
 */
@Component
public class ArenaConnectionGateway {

    private static final Logger log = LoggerFactory.getLogger(ArenaConnectionGateway.class);

    private final ArenaEventLoop eventLoop;
    private final ConnectionRegistry connectionRegistry;
    private final ArenaMessageCodec codec;
    private final InboundMessageRouter router;

    public ArenaConnectionGateway(
            ArenaEventLoop eventLoop,
            ConnectionRegistry connectionRegistry,
            ArenaMessageCodec codec,
            InboundMessageRouter router
    ) {
        this.eventLoop = eventLoop;
        this.connectionRegistry = connectionRegistry;
        this.codec = codec;
        this.router = router;
    }

    public void opened(ArenaConnection connection, ConnectionRole role) {
        eventLoop.execute(() -> {
            ConnectionSession session = connectionRegistry.addConnection(connection, role);
            log.info("{} connection {} opened", role, connection.id());
            if (role == ConnectionRole.AGENT) {
                router.issueChallenge(session);
            }
        });
    }

    public void received(String connectionId, String text) {
        eventLoop.execute(() -> connectionRegistry.find(connectionId).ifPresent(session -> {
            InboundMessage message;
            try {
                message = codec.decode(text);
            } catch (ProtocolException ex) {
                log.debug("Undecodable frame on {}: {}", connectionId, ex.getMessage());
                router.sendError(connectionId, ex.getCode(), ex.getMessage());
                return;
            }
            log.debug("{} from {}", message.type(), connectionId);
            router.route(session, message);
        }));
    }

    public void closed(String connectionId) {
        eventLoop.execute(() -> connectionRegistry.removeConnection(connectionId).ifPresent(session -> {
            log.info("{} connection {} closed (address={})", session.getRole(), connectionId, session.getAddress());
            router.route(session, new InboundMessage(InboundMessageType.DISCONNECT, null));
        }));
    }
}
