package com.signals.arena.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ArenaNotFoundException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ArenaNotFoundException(String code, String message) {
        super(message);
        this.status = HttpStatus.NOT_FOUND;
        this.code = code;
    }

    public static ArenaNotFoundException match(long matchId) {
        return new ArenaNotFoundException("match_not_found", "Unknown match " + matchId);
    }

    public static ArenaNotFoundException pool(long matchId) {
        return new ArenaNotFoundException("pool_not_found", "No betting pool for match " + matchId);
    }

    public static ArenaNotFoundException tournament(long tournamentId) {
        return new ArenaNotFoundException("tournament_not_found", "Unknown tournament " + tournamentId);
    }
}
