package com.projecthub.xp.controller;

import com.projecthub.xp.dto.XpEventResponses;
import com.projecthub.xp.service.LeaderboardRankingService;
import com.projecthub.xp.service.XpAggregateRepairService;
import com.projecthub.xp.service.XpBackfillService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(XpAdminController.class)
class XpAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LeaderboardRankingService leaderboardRankingService;

    @MockitoBean
    private XpAggregateRepairService xpAggregateRepairService;

    @MockitoBean
    private XpBackfillService xpBackfillService;

    @Test
    void recomputeReturnsRankedCount() throws Exception {
        when(leaderboardRankingService.recompute()).thenReturn(new LeaderboardRankingService.RecomputeOutcome(
                true, 42, OffsetDateTime.parse("2025-03-01T12:00:00Z")
        ));

        mockMvc.perform(post("/api/xp/admin/leaderboard/recompute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completed").value(true))
                .andExpect(jsonPath("$.rankedActors").value(42));
    }

    @Test
    void failedRecomputeIsServiceUnavailable() throws Exception {
        when(leaderboardRankingService.recompute()).thenReturn(new LeaderboardRankingService.RecomputeOutcome(
                false, 0, null
        ));

        mockMvc.perform(post("/api/xp/admin/leaderboard/recompute"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.completed").value(false));
    }

    @Test
    void repairReportsRepairedActors() throws Exception {
        when(xpAggregateRepairService.repairAll()).thenReturn(3);

        mockMvc.perform(post("/api/xp/admin/repair"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.actorsRepaired").value(3));
    }

    @Test
    void backfillReturnsTally() throws Exception {
        when(xpBackfillService.backfill(any())).thenReturn(new XpEventResponses.BackfillResult(2, 2, 0, 1));

        mockMvc.perform(post("/api/xp/admin/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "events": [
                                    {
                                      "eventType": "project_published",
                                      "actorId": "00000000-0000-0000-0000-000000000531",
                                      "targetRefs": {"projectId": "00000000-0000-0000-0000-000000000631"},
                                      "occurredAt": "2024-11-01T09:00:00Z"
                                    },
                                    {
                                      "eventType": "idea_submitted",
                                      "actorId": "00000000-0000-0000-0000-000000000531",
                                      "targetRefs": {"ideaId": "00000000-0000-0000-0000-000000000731"},
                                      "occurredAt": "2024-11-02T09:00:00Z"
                                    }
                                  ]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eventsReplayed").value(2))
                .andExpect(jsonPath("$.transactionsApplied").value(2))
                .andExpect(jsonPath("$.duplicatesSkipped").value(0));
    }

    @Test
    void emptyBackfillFailsValidation() throws Exception {
        mockMvc.perform(post("/api/xp/admin/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": []}"))
                .andExpect(status().isBadRequest());

        verify(xpBackfillService, never()).backfill(any());
    }
}
