package com.projecthub.xp.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class ActorRequests {

    private ActorRequests() {
    }

    public record ProvisionActorRequest(
            @NotNull(message = "actorId is required")
            UUID actorId,

            @PastOrPresent(message = "joinedAt must not be in the future")
            OffsetDateTime joinedAt
    ) {
    }
}
