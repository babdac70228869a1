package com.signals.arena.controller;

import com.signals.arena.dto.ArenaTournamentResponses;
import com.signals.arena.service.ArenaQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tournaments")
public class ArenaTournamentController {

    private final ArenaQueryService arenaQueryService;

    public ArenaTournamentController(ArenaQueryService arenaQueryService) {
        this.arenaQueryService = arenaQueryService;
    }

    @GetMapping("/active")
    public ResponseEntity<List<ArenaTournamentResponses.TournamentSummary>> activeTournaments() {
        return ResponseEntity.ok(arenaQueryService.activeTournaments());
    }

    @GetMapping("/{tournamentId}")
    public ResponseEntity<ArenaTournamentResponses.TournamentDetail> getTournament(@PathVariable long tournamentId) {
        return ResponseEntity.ok(arenaQueryService.tournament(tournamentId));
    }

    @GetMapping("/{tournamentId}/standings")
    public ResponseEntity<List<ArenaTournamentResponses.StandingView>> getStandings(@PathVariable long tournamentId) {
        return ResponseEntity.ok(arenaQueryService.standings(tournamentId));
    }
}
