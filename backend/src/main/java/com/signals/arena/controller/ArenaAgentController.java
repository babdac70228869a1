package com.signals.arena.controller;

import com.signals.arena.dto.ArenaAgentResponses;
import com.signals.arena.service.ArenaQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ArenaAgentController {

    private final ArenaQueryService arenaQueryService;

    public ArenaAgentController(ArenaQueryService arenaQueryService) {
        this.arenaQueryService = arenaQueryService;
    }

    @GetMapping("/agents/{address}/status")
    public ResponseEntity<ArenaAgentResponses.AgentStatus> getStatus(@PathVariable String address) {
        return ResponseEntity.ok(arenaQueryService.agentStatus(address));
    }

    @GetMapping("/agents/{address}/stats")
    public ResponseEntity<ArenaAgentResponses.AgentStats> getStats(@PathVariable String address) {
        return ResponseEntity.ok(arenaQueryService.agentStats(address));
    }

    @GetMapping("/agents/{address}/matches")
    public ResponseEntity<List<ArenaAgentResponses.AgentMatch>> getMatches(@PathVariable String address) {
        return ResponseEntity.ok(arenaQueryService.agentMatches(address));
    }

    @GetMapping("/bettors/{address}/bets")
    public ResponseEntity<List<ArenaAgentResponses.BettorBet>> getBets(@PathVariable String address) {
        return ResponseEntity.ok(arenaQueryService.bettorBets(address));
    }
}
