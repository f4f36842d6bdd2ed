package com.projecthub.xp.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public final class BotAlertRequests {

    private BotAlertRequests() {
    }

    public record ReviewAlertRequest(
            @NotNull(message = "reviewerId is required")
            UUID reviewerId,

            @Size(max = 4000, message = "adminNotes must be at most 4000 characters")
            String adminNotes
    ) {
    }

    public record DisputeAlertRequest(
            @NotNull(message = "actorId is required")
            UUID actorId,

            @NotBlank(message = "message is required")
            @Size(max = 2000, message = "message must be at most 2000 characters")
            String message
    ) {
    }
}
