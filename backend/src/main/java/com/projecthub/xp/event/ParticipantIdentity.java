package com.projecthub.xp.event;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Who performed a view or reaction: an authenticated actor or an anonymous session.
 */
public record ParticipantIdentity(UUID actorId, String sessionToken) {

    public ParticipantIdentity {
        if (actorId == null && (sessionToken == null || sessionToken.isBlank())) {
            throw new IllegalArgumentException("actorId or sessionToken is required");
        }
        if (actorId != null) {
            sessionToken = null;
        }
    }

    public static ParticipantIdentity actor(UUID actorId) {
        return new ParticipantIdentity(Objects.requireNonNull(actorId, "actorId"), null);
    }

    public static ParticipantIdentity session(String sessionToken) {
        return new ParticipantIdentity(null, sessionToken);
    }

    public boolean authenticated() {
        return actorId != null;
    }

    public Optional<UUID> authenticatedActorId() {
        return Optional.ofNullable(actorId);
    }

    public String dedupToken() {
        return authenticated() ? "actor:" + actorId : "session:" + sessionToken;
    }
}
