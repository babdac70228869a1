package com.signals.arena.controller;

import com.signals.arena.dto.ArenaStatsResponses;
import com.signals.arena.service.ArenaQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/health")
public class ArenaHealthController {

    private final ArenaQueryService arenaQueryService;

    public ArenaHealthController(ArenaQueryService arenaQueryService) {
        this.arenaQueryService = arenaQueryService;
    }

    @GetMapping
    public ResponseEntity<ArenaStatsResponses.HealthResponse> health() {
        return ResponseEntity.ok(arenaQueryService.health());
    }
}
