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
 * Per-profile XP aggregate. {@code totalXp} and {@code xpLevel} are a cache of the ledger;
 * rank and top-100 live in {@link LeaderboardRank}.
 */
@Getter
@Setter
@Entity
@Table(name = "xp_actors")
public class Actor {

    @Id
    @Column(name = "actor_id", nullable = false, updatable = false)
    private UUID actorId;

    @Column(name = "total_xp", nullable = false)
    private Integer totalXp = 0;

    @Column(name = "xp_level", nullable = false)
    private Integer xpLevel = 1;

    @Column(name = "is_first_100", nullable = false)
    private Boolean firstHundred = false;

    @Column(name = "bot_score", nullable = false)
    private Integer botScore = 0;

    @Column(name = "is_flagged_bot", nullable = false)
    private Boolean flaggedBot = false;

    @Column(name = "bot_alert_count", nullable = false)
    private Integer botAlertCount = 0;

    @Column(name = "review_identity_public", nullable = false)
    private Boolean reviewIdentityPublic = false;

    @Column(name = "last_award_at")
    private OffsetDateTime lastAwardAt;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private OffsetDateTime joinedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
