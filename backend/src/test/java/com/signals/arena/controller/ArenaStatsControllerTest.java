package com.signals.arena.controller;

import com.signals.arena.config.LedgerMode;
import com.signals.arena.dto.ArenaAgentResponses;
import com.signals.arena.dto.ArenaStatsResponses;
import com.signals.arena.service.ArenaQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({ArenaStatsController.class, ArenaHealthController.class})
class ArenaStatsControllerTest {

    private static final ArenaStatsResponses.ConnectionCounts CONNECTIONS =
            new ArenaStatsResponses.ConnectionCounts(5, 2, 2, 1, 3);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ArenaQueryService arenaQueryService;

    @Test
    void health_reportsServiceAndLedgerMode() throws Exception {
        when(arenaQueryService.health()).thenReturn(new ArenaStatsResponses.HealthResponse(
                "signals-arena", "ok", Instant.parse("2026-03-01T12:00:00Z"), 90L, LedgerMode.LOGGING, CONNECTIONS));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("signals-arena"))
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.ledgerMode").value("LOGGING"))
                .andExpect(jsonPath("$.connections.agents").value(2));
    }

    @Test
    void stats_returnsCounters() throws Exception {
        when(arenaQueryService.stats()).thenReturn(new ArenaStatsResponses.ArenaStats(
                CONNECTIONS, 1, 3, 2, 0, 2, 17L, 1, 16L, 0L));

        mockMvc.perform(get("/api/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tournamentQueueSize").value(3))
                .andExpect(jsonPath("$.completedMatches").value(17))
                .andExpect(jsonPath("$.pendingSettlements").value(1));
    }

    @Test
    void leaderboard_defaultsToTwentyEntries() throws Exception {
        when(arenaQueryService.leaderboard(20)).thenReturn(List.of(new ArenaAgentResponses.LeaderboardEntry(
                1, "0x00000000000000000000000000000000000a11ce", 14, 4, 3, 1, 0)));

        mockMvc.perform(get("/api/leaderboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].rank").value(1))
                .andExpect(jsonPath("$[0].totalPoints").value(14));

        verify(arenaQueryService).leaderboard(20);
    }

    @Test
    void leaderboard_rejectsNonNumericLimit() throws Exception {
        mockMvc.perform(get("/api/leaderboard").param("limit", "many"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_parameter"));
    }
}
