package com.signals.arena.controller;

import com.signals.arena.dto.ArenaTournamentResponses;
import com.signals.arena.service.ArenaQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ArenaQueueController {

    private final ArenaQueryService arenaQueryService;

    public ArenaQueueController(ArenaQueryService arenaQueryService) {
        this.arenaQueryService = arenaQueryService;
    }

    @GetMapping("/queue")
    public ResponseEntity<List<ArenaTournamentResponses.QueueEntryView>> queue() {
        return ResponseEntity.ok(arenaQueryService.queue());
    }

    @GetMapping("/tournament-queue")
    public ResponseEntity<ArenaTournamentResponses.TournamentQueueView> tournamentQueue() {
        return ResponseEntity.ok(arenaQueryService.tournamentQueue());
    }
}
