package com.signals.arena.controller;

import com.signals.arena.dto.ArenaAgentResponses;
import com.signals.arena.match.MatchPhase;
import com.signals.arena.match.PoolOutcome;
import com.signals.arena.service.ArenaQueryService;
import com.signals.arena.web.InvalidAddressException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ArenaAgentController.class)
class ArenaAgentControllerTest {

    private static final String ALICE = "0x00000000000000000000000000000000000a11ce";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ArenaQueryService arenaQueryService;

    @Test
    void getStatus_reportsCurrentMatch() throws Exception {
        when(arenaQueryService.agentStatus(ALICE)).thenReturn(new ArenaAgentResponses.AgentStatus(
                ALICE, true, "alpha", false, false, 12L, MatchPhase.AWAITING_CHOICES, null));

        mockMvc.perform(get("/api/agents/{address}/status", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(true))
                .andExpect(jsonPath("$.currentMatchId").value(12))
                .andExpect(jsonPath("$.currentMatchPhase").value("AWAITING_CHOICES"));
    }

    @Test
    void getStats_invalidAddressReturnsBadRequest() throws Exception {
        when(arenaQueryService.agentStats("alice")).thenThrow(new InvalidAddressException("alice"));

        mockMvc.perform(get("/api/agents/alice/stats"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_address"))
                .andExpect(jsonPath("$.message").value("Not a wallet address: alice"));
    }

    @Test
    void getMatches_returnsHistoryFromTheAgentsSide() throws Exception {
        when(arenaQueryService.agentMatches(ALICE)).thenReturn(List.of(new ArenaAgentResponses.AgentMatch(
                3L, 0L, "0x0000000000000000000000000000000000000b0b", null, null, PoolOutcome.BOTH_STEAL,
                0, 0, true, Instant.parse("2026-03-01T12:01:15Z"))));

        mockMvc.perform(get("/api/agents/{address}/matches", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].outcome").value("BOTH_STEAL"))
                .andExpect(jsonPath("$[0].forfeited").value(true))
                .andExpect(jsonPath("$[0].completedAt").value("2026-03-01T12:01:15Z"));
    }

    @Test
    void getBets_returnsPendingAndSettledBets() throws Exception {
        when(arenaQueryService.bettorBets(ALICE)).thenReturn(List.of(
                new ArenaAgentResponses.BettorBet(3L, PoolOutcome.BOTH_SPLIT, BigInteger.valueOf(100),
                        Instant.parse("2026-03-01T12:00:10Z"), BigInteger.valueOf(180), true),
                new ArenaAgentResponses.BettorBet(4L, PoolOutcome.AGENT_A_STEALS, BigInteger.TEN,
                        Instant.parse("2026-03-01T12:02:00Z"), null, false)
        ));

        mockMvc.perform(get("/api/bettors/{address}/bets", ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].payout").value(180))
                .andExpect(jsonPath("$[1].settled").value(false));
    }
}
