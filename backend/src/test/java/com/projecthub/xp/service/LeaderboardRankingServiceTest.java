package com.projecthub.xp.service;

import com.projecthub.xp.config.XpEngineProperties;
import com.projecthub.xp.repository.LeaderboardRankRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeaderboardRankingServiceTest {

    @Mock
    private LeaderboardRankRepository leaderboardRankRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private XpEngineProperties xpEngineProperties;
    private LeaderboardRankingService leaderboardRankingService;

    @BeforeEach
    void setUp() {
        xpEngineProperties = new XpEngineProperties();
        leaderboardRankingService = new LeaderboardRankingService(
                leaderboardRankRepository, xpEngineProperties, transactionManager
        );
    }

    @Test
    void recomputeReplacesSnapshotAndReportsRankedCount() {
        when(leaderboardRankRepository.deleteSnapshot()).thenReturn(3);
        when(leaderboardRankRepository.insertSnapshot(eq(false), eq(100), any(OffsetDateTime.class))).thenReturn(4);

        LeaderboardRankingService.RecomputeOutcome outcome = leaderboardRankingService.recompute();

        assertTrue(outcome.completed());
        assertEquals(4, outcome.rankedActors());
        assertNotNull(outcome.computedAt());
        var order = inOrder(leaderboardRankRepository);
        order.verify(leaderboardRankRepository).deleteSnapshot();
        order.verify(leaderboardRankRepository).insertSnapshot(eq(false), eq(100), any(OffsetDateTime.class));

        LeaderboardRankingService.RecomputeStatus status = leaderboardRankingService.status();
        assertTrue(status.healthy());
        assertEquals(4, status.lastRankedCount());
        assertEquals(outcome.computedAt(), status.lastCompletedAt());
    }

    @Test
    void recomputeHonoursZeroXpExclusion() {
        xpEngineProperties.getLeaderboard().setExcludeZeroXp(true);
        when(leaderboardRankRepository.insertSnapshot(eq(true), eq(100), any(OffsetDateTime.class))).thenReturn(2);

        LeaderboardRankingService.RecomputeOutcome outcome = leaderboardRankingService.recompute();

        assertTrue(outcome.completed());
        assertEquals(2, outcome.rankedActors());
    }

    @Test
    void failedRecomputeKeepsPreviousSnapshotAndTurnsUnhealthy() {
        when(leaderboardRankRepository.insertSnapshot(anyBoolean(), anyInt(), any(OffsetDateTime.class)))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        LeaderboardRankingService.RecomputeOutcome outcome = leaderboardRankingService.recompute();

        assertFalse(outcome.completed());
        assertNull(outcome.computedAt());
        LeaderboardRankingService.RecomputeStatus status = leaderboardRankingService.status();
        assertFalse(status.healthy());
        assertEquals("statement timeout", status.lastFailureMessage());
    }

    @Test
    void laterSuccessRestoresHealth() {
        when(leaderboardRankRepository.insertSnapshot(anyBoolean(), anyInt(), any(OffsetDateTime.class)))
                .thenThrow(new QueryTimeoutException("statement timeout"))
                .thenReturn(1);

        leaderboardRankingService.recompute();
        LeaderboardRankingService.RecomputeOutcome outcome = leaderboardRankingService.recompute();

        assertTrue(outcome.completed());
        assertTrue(leaderboardRankingService.status().healthy());
    }

    @Test
    void statusIsHealthyBeforeFirstPass() {
        LeaderboardRankingService.RecomputeStatus status = leaderboardRankingService.status();

        assertTrue(status.healthy());
        assertNull(status.lastCompletedAt());
    }
}
