package com.signals.arena.controller;

import com.signals.arena.dto.ArenaAgentResponses;
import com.signals.arena.dto.ArenaStatsResponses;
import com.signals.arena.service.ArenaQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ArenaStatsController {

    private final ArenaQueryService arenaQueryService;

    public ArenaStatsController(ArenaQueryService arenaQueryService) {
        this.arenaQueryService = arenaQueryService;
    }

    @GetMapping("/stats")
    public ResponseEntity<ArenaStatsResponses.ArenaStats> stats() {
        return ResponseEntity.ok(arenaQueryService.stats());
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<ArenaAgentResponses.LeaderboardEntry>> leaderboard(
            @RequestParam(defaultValue = "20") int limit
    ) {
        return ResponseEntity.ok(arenaQueryService.leaderboard(limit));
    }
}
