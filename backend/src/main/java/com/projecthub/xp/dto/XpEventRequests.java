package com.projecthub.xp.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class XpEventRequests {

    private XpEventRequests() {
    }

    /**
     * Wire form of a domain event. Which fields are required depends on {@code eventType};
     * that check happens in {@code XpEventParser}.
     */
    public record RecordEventRequest(
            @NotBlank(message = "eventType is required")
            @Size(max = 64, message = "eventType must be at most 64 characters")
            String eventType,

            UUID actorId,

            @Valid
            TargetRefs targetRefs,

            @Valid
            DedupContext dedupContext,

            Boolean identityPublic,

            OffsetDateTime occurredAt
    ) {
    }

    public record TargetRefs(
            UUID projectId,
            UUID projectOwnerId,
            UUID ideaId,
            UUID ideaOwnerId,
            UUID reviewId
    ) {
    }

    public record DedupContext(
            @Size(max = 128, message = "sessionToken must be at most 128 characters")
            String sessionToken
    ) {
    }

    public record BackfillRequest(
            @NotEmpty(message = "events must not be empty")
            @Size(max = 10_000, message = "events must contain at most 10000 entries")
            List<@Valid RecordEventRequest> events
    ) {
    }
}
