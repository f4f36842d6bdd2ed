package com.projecthub.xp.event;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

public record IdentityVisibilityToggledEvent(
        UUID actorId,
        boolean identityPublic,
        OffsetDateTime occurredAt
) implements XpEvent {

    public IdentityVisibilityToggledEvent {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public XpEventType type() {
        return XpEventType.IDENTITY_VISIBILITY_TOGGLED;
    }
}
