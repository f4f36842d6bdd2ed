package com.projecthub.xp.repository;

import com.projecthub.xp.model.LeaderboardRank;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface LeaderboardRankRepository extends JpaRepository<LeaderboardRank, UUID> {

    @Modifying
    @Query(value = "DELETE FROM xp_leaderboard_ranks", nativeQuery = true)
    int deleteSnapshot();

    /**
     * Ranks every non-flagged actor by total XP, earlier joiners first on ties. Reads actor rows without locking them.
     */
    @Modifying
    @Query(value = """
            INSERT INTO xp_leaderboard_ranks (actor_id, leaderboard_rank, is_top_100, computed_at)
            SELECT ranked.actor_id, ranked.position, ranked.position <= :topCutoff, :computedAt
            FROM (
                SELECT
                    actor.actor_id,
                    ROW_NUMBER() OVER (
                        ORDER BY actor.total_xp DESC, actor.joined_at ASC, actor.actor_id ASC
                    ) AS position
                FROM xp_actors actor
                WHERE actor.is_flagged_bot = FALSE
                  AND (:excludeZeroXp = FALSE OR actor.total_xp > 0)
            ) ranked
            """, nativeQuery = true)
    int insertSnapshot(
            @Param("excludeZeroXp") boolean excludeZeroXp,
            @Param("topCutoff") int topCutoff,
            @Param("computedAt") OffsetDateTime computedAt
    );

    @Query(value = """
            SELECT
                snapshot.actor_id AS actorId,
                snapshot.leaderboard_rank AS leaderboardRank,
                snapshot.is_top_100 AS topHundred,
                actor.total_xp AS totalXp,
                actor.xp_level AS xpLevel,
                actor.is_first_100 AS firstHundred
            FROM xp_leaderboard_ranks snapshot
            JOIN xp_actors actor ON actor.actor_id = snapshot.actor_id
            ORDER BY snapshot.leaderboard_rank ASC
            LIMIT :limit
            """, nativeQuery = true)
    List<LeaderboardRow> findTopRows(@Param("limit") int limit);
}
