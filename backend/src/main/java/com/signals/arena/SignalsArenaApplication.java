package com.signals.arena;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SignalsArenaApplication {
    public static void main(String[] args) {
        SpringApplication.run(SignalsArenaApplication.class, args);
    }
}
