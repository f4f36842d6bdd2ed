package com.projecthub.xp.dto;

import com.projecthub.xp.model.XpReason;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class XpEventResponses {

    private XpEventResponses() {
    }

    public record RecordEventResult(
            String eventType,
            List<AwardOutcome> awards,
            List<BotAlertResponses.BotAlertDetail> botAlerts
    ) {
    }

    public record AwardOutcome(
            UUID recipientId,
            XpReason reason,
            int amount,
            String dedupKey,
            boolean applied
    ) {
    }

    public record BackfillResult(
            int eventsReplayed,
            int transactionsApplied,
            int duplicatesSkipped,
            int rankedActors
    ) {
    }

    public record RepairResult(
            int actorsRepaired
    ) {
    }

    public record RecomputeResult(
            boolean completed,
            int rankedActors,
            OffsetDateTime computedAt
    ) {
    }
}
