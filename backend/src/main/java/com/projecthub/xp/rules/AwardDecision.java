package com.projecthub.xp.rules;

import com.projecthub.xp.model.XpReason;

import java.util.Objects;
import java.util.UUID;

/**
 * One eligible award (or revocation when {@code amount} is negative) produced by the rules engine.
 * The ledger applies it at most once per {@code (reason, dedupKey)}.
 */
public record AwardDecision(
        UUID recipientId,
        XpReason reason,
        int amount,
        String dedupKey,
        UUID projectId,
        UUID ideaId,
        UUID reviewId
) {

    public AwardDecision {
        Objects.requireNonNull(recipientId, "recipientId");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(dedupKey, "dedupKey");
        if (amount == 0) {
            throw new IllegalArgumentException("amount must be non-zero");
        }
    }

    public boolean revocation() {
        return amount < 0;
    }
}
