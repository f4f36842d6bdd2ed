package com.projecthub.xp.mapper;

import com.projecthub.xp.dto.ActorResponses;
import com.projecthub.xp.dto.BotAlertResponses;
import com.projecthub.xp.dto.XpEventResponses;
import com.projecthub.xp.event.XpEvent;
import com.projecthub.xp.model.Actor;
import com.projecthub.xp.model.BotAlert;
import com.projecthub.xp.model.LeaderboardRank;
import com.projecthub.xp.model.XpTransaction;
import com.projecthub.xp.repository.LeaderboardRow;
import com.projecthub.xp.service.XpLedgerService;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class XpResponseMapper {

    public XpEventResponses.RecordEventResult toRecordEventResult(
            XpEvent event,
            List<XpLedgerService.AppendResult> appendResults,
            List<BotAlert> alerts
    ) {
        return new XpEventResponses.RecordEventResult(
                event.type().name(),
                appendResults.stream().map(this::toAwardOutcome).toList(),
                alerts.stream().map(this::toBotAlertDetail).toList()
        );
    }

    public XpEventResponses.AwardOutcome toAwardOutcome(XpLedgerService.AppendResult appendResult) {
        return new XpEventResponses.AwardOutcome(
                appendResult.decision().recipientId(),
                appendResult.decision().reason(),
                appendResult.decision().amount(),
                appendResult.decision().dedupKey(),
                appendResult.applied()
        );
    }

    public BotAlertResponses.BotAlertDetail toBotAlertDetail(BotAlert alert) {
        return new BotAlertResponses.BotAlertDetail(
                alert.getAlertId(),
                alert.getActorId(),
                alert.getAlertType().code(),
                alert.getSeverity(),
                alert.getEvidence(),
                alert.getScoreIncrease(),
                Boolean.TRUE.equals(alert.getReviewed()),
                alert.getReviewedBy(),
                alert.getReviewedAt(),
                alert.getAdminNotes(),
                alert.getDisputeMessage(),
                alert.getDisputedAt(),
                alert.getCreatedAt()
        );
    }

    /**
     * @param rank the actor's row in the last leaderboard snapshot, or {@code null} when unranked
     */
    public ActorResponses.ActorStanding toActorStanding(Actor actor, LeaderboardRank rank) {
        return new ActorResponses.ActorStanding(
                actor.getActorId(),
                actor.getTotalXp(),
                actor.getXpLevel(),
                rank == null ? null : rank.getLeaderboardRank(),
                rank != null && Boolean.TRUE.equals(rank.getTopHundred()),
                Boolean.TRUE.equals(actor.getFirstHundred()),
                actor.getBotScore(),
                Boolean.TRUE.equals(actor.getFlaggedBot()),
                actor.getBotAlertCount(),
                Boolean.TRUE.equals(actor.getReviewIdentityPublic()),
                actor.getLastAwardAt(),
                actor.getJoinedAt()
        );
    }

    public ActorResponses.XpTransactionEntry toTransactionEntry(XpTransaction transaction) {
        return new ActorResponses.XpTransactionEntry(
                transaction.getTransactionId(),
                transaction.getAmount(),
                transaction.getReason(),
                transaction.getProjectId(),
                transaction.getIdeaId(),
                transaction.getReviewId(),
                transaction.getDedupKey(),
                Boolean.TRUE.equals(transaction.getRetroactive()),
                transaction.getOccurredAt(),
                transaction.getCreatedAt()
        );
    }

    public ActorResponses.LeaderboardEntry toLeaderboardEntry(LeaderboardRow row) {
        return new ActorResponses.LeaderboardEntry(
                row.getLeaderboardRank(),
                row.getActorId(),
                row.getTotalXp(),
                row.getXpLevel(),
                Boolean.TRUE.equals(row.getTopHundred()),
                Boolean.TRUE.equals(row.getFirstHundred())
        );
    }
}
