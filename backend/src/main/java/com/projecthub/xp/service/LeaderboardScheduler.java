package com.projecthub.xp.service;

import com.projecthub.xp.config.XpEngineProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LeaderboardScheduler {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardScheduler.class);

    private final XpEngineProperties xpEngineProperties;
    private final LeaderboardRankingService leaderboardRankingService;
    private final EventProcessingGate eventProcessingGate;

    @Scheduled(
            fixedRateString = "${xp.leaderboard.recompute-interval-ms:300000}",
            initialDelayString = "${xp.leaderboard.initial-delay-ms:30000}"
    )
    public void recomputeTick() {
        if (!xpEngineProperties.getLeaderboard().isEnabled()) {
            return;
        }
        if (eventProcessingGate.exclusiveRunInProgress()) {
            log.debug("Leaderboard tick skipped: backfill in progress");
            return;
        }

        LeaderboardRankingService.RecomputeOutcome outcome = leaderboardRankingService.recompute();
        if (!outcome.completed()) {
            log.debug("Leaderboard tick finished without a new snapshot");
        }
    }
}
