package com.projecthub.xp.dto;

import com.projecthub.xp.model.XpReason;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class ActorResponses {

    private ActorResponses() {
    }

    public record ActorStanding(
            UUID actorId,
            int totalXp,
            int xpLevel,
            Integer leaderboardRank,
            boolean top100,
            boolean first100,
            int botScore,
            boolean flaggedBot,
            int botAlertCount,
            boolean reviewIdentityPublic,
            OffsetDateTime lastAwardAt,
            OffsetDateTime joinedAt
    ) {
    }

    public record XpTransactionEntry(
            UUID transactionId,
            int amount,
            XpReason reason,
            UUID projectId,
            UUID ideaId,
            UUID reviewId,
            String dedupKey,
            boolean retroactive,
            OffsetDateTime occurredAt,
            OffsetDateTime createdAt
    ) {
    }

    public record LeaderboardEntry(
            int rank,
            UUID actorId,
            int totalXp,
            int xpLevel,
            boolean top100,
            boolean first100
    ) {
    }
}
