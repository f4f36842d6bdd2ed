package com.projecthub.xp.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Operational settings for the XP engine.
 * Award amounts, bot thresholds and badge cut-offs are fixed policy and live in code, not here.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "xp")
public class XpEngineProperties {

    private Leaderboard leaderboard = new Leaderboard();
    private FirstCohort firstCohort = new FirstCohort();
    private Ledger ledger = new Ledger();

    @Getter
    @Setter
    public static class Leaderboard {
        /**
         * Scheduled recompute on/off. Manual recompute stays available either way.
         */
        private boolean enabled = true;
        private long initialDelayMs = 30_000;
        private long recomputeIntervalMs = 300_000;

        /**
         * Leave actors with zero XP unranked.
         */
        private boolean excludeZeroXp = false;
        private int maxPageSize = 100;
    }

    @Getter
    @Setter
    public static class FirstCohort {
        private boolean bootstrapOnStartup = true;
    }

    @Getter
    @Setter
    public static class Ledger {
        private int maxAttempts = 4;
        private long initialBackoffMs = 50;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 1_000;
    }
}
