package com.signals.arena.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Game timing, queue and tournament sizing defaults.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "arena")
public class ArenaProperties {

    private Match match = new Match();
    private Queue queue = new Queue();
    private Tournament tournament = new Tournament();
    private Auth auth = new Auth();
    private Transport transport = new Transport();

    @Getter
    @Setter
    public static class Match {
        private Duration negotiationWindow = Duration.ofSeconds(45);
        private Duration choiceWindow = Duration.ofSeconds(15);
        private Duration revealWindow = Duration.ofSeconds(15);

        /**
         * How long a completed match stays queryable before eviction.
         */
        private Duration retention = Duration.ofMinutes(5);
        private int maxMessageLength = 500;
    }

    @Getter
    @Setter
    public static class Queue {
        /**
         * Delay that lets simultaneous joins be paired in one pass.
         */
        private Duration pairingDelay = Duration.ofMillis(200);
    }

    @Getter
    @Setter
    public static class Tournament {
        private int capacity = 8;
        private int minPlayers = 4;
        private int totalRounds = 3;
        private int byePoints = 1;
        private Duration registrationWindow = Duration.ofSeconds(60);
        private Duration startDelay = Duration.ofSeconds(3);
        private Duration roundPause = Duration.ofSeconds(3);
        private Duration retention = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Auth {
        private Duration challengeExpiry = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Transport {
        private int sendTimeLimitMs = 10_000;
        private int sendBufferSizeLimitBytes = 512 * 1024;
        private int writerThreads = 4;
        private Duration queryTimeout = Duration.ofSeconds(2);
    }
}
