package com.projecthub.xp.event;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

public record IdeaReactionReceivedEvent(
        UUID ideaId,
        UUID ideaOwnerId,
        ParticipantIdentity reactor,
        OffsetDateTime occurredAt
) implements XpEvent {

    public IdeaReactionReceivedEvent {
        Objects.requireNonNull(ideaId, "ideaId");
        Objects.requireNonNull(ideaOwnerId, "ideaOwnerId");
        Objects.requireNonNull(reactor, "reactor");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    @Override
    public XpEventType type() {
        return XpEventType.IDEA_REACTION_RECEIVED;
    }
}
