package com.projecthub.xp.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One row of the last completed leaderboard snapshot. Actors without a row are unranked.
 */
@Getter
@Setter
@Entity
@Table(name = "xp_leaderboard_ranks")
public class LeaderboardRank {

    @Id
    @Column(name = "actor_id", nullable = false, updatable = false)
    private UUID actorId;

    @Column(name = "leaderboard_rank", nullable = false)
    private Integer leaderboardRank;

    @Column(name = "is_top_100", nullable = false)
    private Boolean topHundred = false;

    @Column(name = "computed_at", nullable = false)
    private OffsetDateTime computedAt;
}
