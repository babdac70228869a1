package com.signals.arena.controller;

import com.signals.arena.dto.ArenaMatchResponses;
import com.signals.arena.service.ArenaQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/matches")
public class ArenaMatchController {

    private final ArenaQueryService arenaQueryService;

    public ArenaMatchController(ArenaQueryService arenaQueryService) {
        this.arenaQueryService = arenaQueryService;
    }

    @GetMapping("/active")
    public ResponseEntity<List<ArenaMatchResponses.MatchSummary>> activeMatches() {
        return ResponseEntity.ok(arenaQueryService.activeMatches());
    }

    @GetMapping("/{matchId}")
    public ResponseEntity<ArenaMatchResponses.MatchDetail> getMatch(@PathVariable long matchId) {
        return ResponseEntity.ok(arenaQueryService.match(matchId));
    }

    @GetMapping("/{matchId}/odds")
    public ResponseEntity<ArenaMatchResponses.PoolOdds> getOdds(@PathVariable long matchId) {
        return ResponseEntity.ok(arenaQueryService.odds(matchId));
    }

    @GetMapping("/{matchId}/pool")
    public ResponseEntity<ArenaMatchResponses.PoolDetail> getPool(@PathVariable long matchId) {
        return ResponseEntity.ok(arenaQueryService.pool(matchId));
    }
}
