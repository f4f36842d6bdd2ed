package com.projecthub.xp.event;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

public record ProjectPublishedEvent(
        UUID publisherId,
        UUID projectId,
        OffsetDateTime occurredAt
) implements XpEvent {

    public ProjectPublishedEvent {
        Objects.requireNonNull(publisherId, "publisherId");
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public XpEventType type() {
        return XpEventType.PROJECT_PUBLISHED;
    }
}
