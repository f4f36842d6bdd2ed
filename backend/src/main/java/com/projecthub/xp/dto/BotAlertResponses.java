package com.projecthub.xp.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.projecthub.xp.model.BotAlertSeverity;

import java.time.OffsetDateTime;
import java.util.UUID;

public final class BotAlertResponses {

    private BotAlertResponses() {
    }

    public record BotAlertDetail(
            UUID alertId,
            UUID actorId,
            String alertType,
            BotAlertSeverity severity,
            JsonNode evidence,
            int scoreIncrease,
            boolean reviewed,
            UUID reviewedBy,
            OffsetDateTime reviewedAt,
            String adminNotes,
            String disputeMessage,
            OffsetDateTime disputedAt,
            OffsetDateTime createdAt
    ) {
    }
}
