package com.projecthub.xp.event;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

public record DemoViewedEvent(
        UUID projectId,
        UUID projectOwnerId,
        ParticipantIdentity viewer,
        OffsetDateTime occurredAt
) implements XpEvent {

    public DemoViewedEvent {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(projectOwnerId, "projectOwnerId");
        Objects.requireNonNull(viewer, "viewer");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public XpEventType type() {
        return XpEventType.DEMO_VIEWED;
    }
}
