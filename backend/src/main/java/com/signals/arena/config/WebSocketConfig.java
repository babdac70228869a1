package com.signals.arena.config;

import com.signals.arena.ws.ArenaConnectionGateway;
import com.signals.arena.ws.ArenaWebSocketHandler;
import com.signals.arena.ws.ConnectionRole;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.concurrent.Executor;

/**
 * One endpoint per connection role.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String AGENT_PATH = "/ws/agent";
    static final String SPECTATOR_PATH = "/ws/spectator";
    static final String BETTOR_PATH = "/ws/bettor";

    private final ArenaConnectionGateway gateway;
    private final ArenaProperties arenaProperties;
    private final Executor transportExecutor;

    public WebSocketConfig(
            ArenaConnectionGateway gateway,
            ArenaProperties arenaProperties,
            @Qualifier("transportExecutor") Executor transportExecutor
    ) {
        this.gateway = gateway;
        this.arenaProperties = arenaProperties;
        this.transportExecutor = transportExecutor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        ArenaProperties.Transport transport = arenaProperties.getTransport();
        registry.addHandler(handler(ConnectionRole.AGENT, transport), AGENT_PATH)
                .setAllowedOrigins("*");
        registry.addHandler(handler(ConnectionRole.SPECTATOR, transport), SPECTATOR_PATH)
                .setAllowedOrigins("*");
        registry.addHandler(handler(ConnectionRole.BETTOR, transport), BETTOR_PATH)
                .setAllowedOrigins("*");
    }

    private ArenaWebSocketHandler handler(ConnectionRole role, ArenaProperties.Transport transport) {
        return new ArenaWebSocketHandler(role, gateway, transport, transportExecutor);
    }
}
