package com.projecthub.xp.config;

import com.projecthub.xp.service.LeaderboardRankingService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class LeaderboardHealthIndicator implements HealthIndicator {

    private final LeaderboardRankingService leaderboardRankingService;

    public LeaderboardHealthIndicator(LeaderboardRankingService leaderboardRankingService) {
        this.leaderboardRankingService = leaderboardRankingService;
    }

    @Override
    public Health health() {
        LeaderboardRankingService.RecomputeStatus status = leaderboardRankingService.status();
        Health.Builder builder = status.healthy() ? Health.up() : Health.down();
        builder.withDetail("lastRankedCount", status.lastRankedCount());
        if (status.lastCompletedAt() != null) {
            builder.withDetail("lastCompletedAt", status.lastCompletedAt().toString());
        }
        if (status.lastFailedAt() != null) {
            builder.withDetail("lastFailedAt", status.lastFailedAt().toString());
            builder.withDetail("lastFailure", String.valueOf(status.lastFailureMessage()));
        }
        return builder.build();
    }
}
