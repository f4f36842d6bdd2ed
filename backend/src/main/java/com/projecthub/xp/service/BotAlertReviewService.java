package com.projecthub.xp.service;

import com.projecthub.xp.dto.ActorResponses;
import com.projecthub.xp.dto.BotAlertRequests;
import com.projecthub.xp.dto.BotAlertResponses;
import com.projecthub.xp.mapper.XpResponseMapper;
import com.projecthub.xp.model.Actor;
import com.projecthub.xp.model.BotAlert;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.repository.BotAlertRepository;
import com.projecthub.xp.repository.LeaderboardRankRepository;
import com.projecthub.xp.web.XpEventRejectedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Hooks for the administrative review surface. Clearing the flag is the only way an actor leaves the flagged state;
 * the accumulated score is kept.
 */
@Service
@RequiredArgsConstructor
public class BotAlertReviewService {

    private static final Logger log = LoggerFactory.getLogger(BotAlertReviewService.class);

    private final BotAlertRepository botAlertRepository;
    private final ActorRepository actorRepository;
    private final LeaderboardRankRepository leaderboardRankRepository;
    private final XpResponseMapper xpResponseMapper;

    @Transactional(readOnly = true)
    public List<BotAlertResponses.BotAlertDetail> listUnreviewed() {
        return botAlertRepository.findByReviewedFalseOrderByCreatedAtAsc().stream()
                .map(xpResponseMapper::toBotAlertDetail)
                .toList();
    }

    @Transactional
    public BotAlertResponses.BotAlertDetail markReviewed(UUID alertId, BotAlertRequests.ReviewAlertRequest request) {
        BotAlert alert = findAlert(alertId);
        alert.setReviewed(true);
        alert.setReviewedBy(request.reviewerId());
        alert.setReviewedAt(OffsetDateTime.now());
        alert.setAdminNotes(request.adminNotes());
        return xpResponseMapper.toBotAlertDetail(botAlertRepository.save(alert));
    }

    @Transactional
    public BotAlertResponses.BotAlertDetail dispute(UUID alertId, BotAlertRequests.DisputeAlertRequest request) {
        BotAlert alert = findAlert(alertId);
        if (!alert.getActorId().equals(request.actorId())) {
            throw XpEventRejectedException.disputeNotAllowed(
                    "Only the alerted actor may dispute bot alert " + alertId
            );
        }
        if (Boolean.TRUE.equals(alert.getReviewed())) {
            throw XpEventRejectedException.alertAlreadyReviewed(
                    "Bot alert " + alertId + " has already been reviewed"
            );
        }
        alert.setDisputeMessage(request.message().trim());
        alert.setDisputedAt(OffsetDateTime.now());
        return xpResponseMapper.toBotAlertDetail(botAlertRepository.save(alert));
    }

    @Transactional
    public ActorResponses.ActorStanding clearBotFlag(UUID actorId) {
        Actor actor = actorRepository.findByActorIdForUpdate(actorId)
                .orElseThrow(() -> XpEventRejectedException.unknownActor("XP actor not found: " + actorId));
        if (Boolean.TRUE.equals(actor.getFlaggedBot())) {
            actor.setFlaggedBot(false);
            actor.setUpdatedAt(OffsetDateTime.now());
            actorRepository.save(actor);
            log.info("Bot flag cleared for actor {} (botScore kept at {})", actorId, actor.getBotScore());
        }
        return xpResponseMapper.toActorStanding(actor, leaderboardRankRepository.findById(actorId).orElse(null));
    }

    private BotAlert findAlert(UUID alertId) {
        return botAlertRepository.findById(alertId)
                .orElseThrow(() -> XpEventRejectedException.botAlertNotFound("Bot alert not found: " + alertId));
    }
}
