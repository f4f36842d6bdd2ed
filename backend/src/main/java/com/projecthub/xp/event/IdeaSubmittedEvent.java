package com.projecthub.xp.event;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * @param projectId optional project the idea was filed against
 */
public record IdeaSubmittedEvent(
        UUID submitterId,
        UUID ideaId,
        UUID projectId,
        OffsetDateTime occurredAt
) implements XpEvent {

    public IdeaSubmittedEvent {
        Objects.requireNonNull(submitterId, "submitterId");
        Objects.requireNonNull(ideaId, "ideaId");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public XpEventType type() {
        return XpEventType.IDEA_SUBMITTED;
    }
}
