package com.projecthub.xp.config;

import com.projecthub.xp.service.LeaderboardRankingService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LeaderboardHealthIndicatorTest {

    private final LeaderboardRankingService leaderboardRankingService = mock(LeaderboardRankingService.class);
    private final LeaderboardHealthIndicator indicator = new LeaderboardHealthIndicator(leaderboardRankingService);

    @Test
    void upAfterCompletedPass() {
        OffsetDateTime completedAt = OffsetDateTime.parse("2025-03-01T12:00:00Z");
        when(leaderboardRankingService.status()).thenReturn(
                new LeaderboardRankingService.RecomputeStatus(completedAt, 12, null, null)
        );

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(12, health.getDetails().get("lastRankedCount"));
        assertEquals(completedAt.toString(), health.getDetails().get("lastCompletedAt"));
        assertFalse(health.getDetails().containsKey("lastFailure"));
    }

    @Test
    void downWhenLastPassFailed() {
        when(leaderboardRankingService.status()).thenReturn(new LeaderboardRankingService.RecomputeStatus(
                OffsetDateTime.parse("2025-03-01T12:00:00Z"),
                12,
                OffsetDateTime.parse("2025-03-01T12:05:00Z"),
                "statement timeout"
        ));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("statement timeout", health.getDetails().get("lastFailure"));
    }
}
