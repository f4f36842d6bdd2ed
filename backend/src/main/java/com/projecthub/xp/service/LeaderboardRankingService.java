package com.projecthub.xp.service;

import com.projecthub.xp.config.XpEngineProperties;
import com.projecthub.xp.repository.LeaderboardRankRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rebuilds the leaderboard snapshot from scratch. A pass replaces the whole snapshot in one repeatable-read
 * transaction; if it fails, the previous snapshot stays authoritative.
 */
@Service
public class LeaderboardRankingService {

    public static final int TOP_CUTOFF = 100;

    private static final Logger log = LoggerFactory.getLogger(LeaderboardRankingService.class);

    private final LeaderboardRankRepository leaderboardRankRepository;
    private final XpEngineProperties xpEngineProperties;
    private final TransactionTemplate snapshotTransactionTemplate;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile OffsetDateTime lastCompletedAt;
    private volatile int lastRankedCount;
    private volatile OffsetDateTime lastFailedAt;
    private volatile String lastFailureMessage;

    public LeaderboardRankingService(
            LeaderboardRankRepository leaderboardRankRepository,
            XpEngineProperties xpEngineProperties,
            PlatformTransactionManager transactionManager
    ) {
        this.leaderboardRankRepository = leaderboardRankRepository;
        this.xpEngineProperties = xpEngineProperties;
        this.snapshotTransactionTemplate = new TransactionTemplate(transactionManager);
        this.snapshotTransactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
    }

    public RecomputeOutcome recompute() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Leaderboard recompute skipped: another pass is running");
            return RecomputeOutcome.skipped();
        }
        try {
            OffsetDateTime computedAt = OffsetDateTime.now();
            boolean excludeZeroXp = xpEngineProperties.getLeaderboard().isExcludeZeroXp();
            Integer ranked = snapshotTransactionTemplate.execute(status -> {
                int removed = leaderboardRankRepository.deleteSnapshot();
                int inserted = leaderboardRankRepository.insertSnapshot(excludeZeroXp, TOP_CUTOFF, computedAt);
                log.debug("Leaderboard snapshot replaced: removed={}, inserted={}", removed, inserted);
                return inserted;
            });
            int rankedCount = ranked == null ? 0 : ranked;
            lastCompletedAt = computedAt;
            lastRankedCount = rankedCount;
            log.info("Leaderboard recompute completed: rankedActors={}, computedAt={}", rankedCount, computedAt);
            return new RecomputeOutcome(true, rankedCount, computedAt);
        } catch (RuntimeException ex) {
            lastFailedAt = OffsetDateTime.now();
            lastFailureMessage = ex.getMessage();
            log.error("Leaderboard recompute failed; keeping the previous snapshot", ex);
            return new RecomputeOutcome(false, 0, null);
        } finally {
            running.set(false);
        }
    }

    public RecomputeStatus status() {
        return new RecomputeStatus(lastCompletedAt, lastRankedCount, lastFailedAt, lastFailureMessage);
    }

    public record RecomputeOutcome(
            boolean completed,
            int rankedActors,
            OffsetDateTime computedAt
    ) {
        static RecomputeOutcome skipped() {
            return new RecomputeOutcome(false, 0, null);
        }
    }

    /**
     * Healthy when no pass has failed since the last completed one.
     */
    public record RecomputeStatus(
            OffsetDateTime lastCompletedAt,
            int lastRankedCount,
            OffsetDateTime lastFailedAt,
            String lastFailureMessage
    ) {
        public boolean healthy() {
            if (lastFailedAt == null) {
                return true;
            }
            return lastCompletedAt != null && !lastCompletedAt.isBefore(lastFailedAt);
        }
    }
}
