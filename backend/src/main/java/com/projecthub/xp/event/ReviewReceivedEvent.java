package com.projecthub.xp.event;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * @param reviewerId authenticated author of the review, {@code null} for anonymous reviews
 */
public record ReviewReceivedEvent(
        UUID reviewId,
        UUID projectId,
        UUID projectOwnerId,
        UUID reviewerId,
        OffsetDateTime occurredAt
) implements XpEvent {

    public ReviewReceivedEvent {
        Objects.requireNonNull(reviewId, "reviewId");
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(projectOwnerId, "projectOwnerId");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public Optional<UUID> authenticatedReviewer() {
        return Optional.ofNullable(reviewerId);
    }

    @Override
    public XpEventType type() {
        return XpEventType.REVIEW_RECEIVED;
    }
}
