package com.signals.arena.config;

import com.signals.arena.core.ArenaEventLoop;
import com.signals.arena.core.SingleThreadArenaEventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ArenaCoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ArenaCoreConfig.class);

    @Bean
    public Clock arenaClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ArenaEventLoop arenaEventLoop(Clock arenaClock, ArenaProperties arenaProperties) {
        log.info("Starting arena core loop (query timeout {})", arenaProperties.getTransport().getQueryTimeout());
        return new SingleThreadArenaEventLoop(arenaClock, arenaProperties.getTransport().getQueryTimeout());
    }

    /**
     * Writes outbound WebSocket frames so the arena core never waits on a client socket.
     */
    @Bean
    public ThreadPoolTaskExecutor transportExecutor(ArenaProperties arenaProperties) {
        int threads = arenaProperties.getTransport().getWriterThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("ws-writer-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Single thread so ledger transactions leave in submission order with sequential nonces.
     */
    @Bean
    public ThreadPoolTaskExecutor ledgerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("ledger-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
