package com.projecthub.xp.service;

import com.projecthub.xp.bot.ActorHistory;
import com.projecthub.xp.bot.BotAlertDraft;
import com.projecthub.xp.bot.BotDetector;
import com.projecthub.xp.event.IdeaSubmittedEvent;
import com.projecthub.xp.event.ProjectPublishedEvent;
import com.projecthub.xp.event.ReviewReceivedEvent;
import com.projecthub.xp.event.XpEvent;
import com.projecthub.xp.model.Actor;
import com.projecthub.xp.model.ActorActivity;
import com.projecthub.xp.model.ActorActivityType;
import com.projecthub.xp.model.BotAlert;
import com.projecthub.xp.repository.ActorActivityRepository;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.repository.BotAlertRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Records the actor activity an event represents and runs the bot heuristics against the actor's prior activity.
 * Alerts, the score increase and the flag are written in one transaction under the actor's row lock.
 *
 * <p>The activity log is not only bot input. Authenticated reviews are recorded as {@code REVIEW_AUTHORED} under
 * the reviewer, and {@link PublicReviewBonusReconciler} reads those rows back to find every review whose bonus
 * follows the reviewer's identity-visibility flag. An event that skips this service never earns that bonus on a
 * later toggle.
 */
@Service
@RequiredArgsConstructor
public class BotDetectionService {

    private static final Logger log = LoggerFactory.getLogger(BotDetectionService.class);
    private static final Duration IDEA_HISTORY_WINDOW = Duration.ofHours(1);

    private final BotDetector botDetector;
    private final ActorRepository actorRepository;
    private final ActorActivityRepository actorActivityRepository;
    private final BotAlertRepository botAlertRepository;
    private final XpLedgerService xpLedgerService;
    private final LedgerTransactionExecutor ledgerTransactionExecutor;

    /**
     * @param detectBots {@code false} records the activity only, as retroactive replays do
     */
    public InspectionResult inspect(XpEvent event, boolean detectBots) {
        ActivityKey activityKey = activityKeyFor(event);
        if (activityKey == null) {
            return InspectionResult.NOT_TRACKED;
        }

        return ledgerTransactionExecutor.execute("activity " + activityKey.type() + " " + activityKey.subjectId(), status -> {
            Actor actor = xpLedgerService.lockActor(activityKey.actorId());
            if (actorActivityRepository.existsByActorIdAndActivityTypeAndSubjectId(
                    activityKey.actorId(), activityKey.type(), activityKey.subjectId())) {
                log.debug("Activity {} {} for actor {} already recorded; skipping bot inspection",
                        activityKey.type(), activityKey.subjectId(), activityKey.actorId());
                return InspectionResult.ALREADY_SEEN;
            }

            ActorHistory history = loadHistory(activityKey, event.occurredAt());
            recordActivity(activityKey, event.occurredAt());
            if (!detectBots) {
                return new InspectionResult(true, List.of());
            }

            List<BotAlertDraft> drafts = botDetector.inspect(event, history);
            if (drafts.isEmpty()) {
                return new InspectionResult(true, List.of());
            }
            return new InspectionResult(true, raiseAlerts(actor, drafts));
        });
    }

    private List<BotAlert> raiseAlerts(Actor actor, List<BotAlertDraft> drafts) {
        OffsetDateTime now = OffsetDateTime.now();
        List<BotAlert> alerts = new ArrayList<>();
        for (BotAlertDraft draft : drafts) {
            BotAlert alert = new BotAlert();
            alert.setAlertId(UUID.randomUUID());
            alert.setActorId(actor.getActorId());
            alert.setAlertType(draft.alertType());
            alert.setSeverity(draft.severity());
            alert.setEvidence(draft.evidence());
            alert.setScoreIncrease(draft.scoreIncrease());
            alert.setCreatedAt(now);
            alerts.add(botAlertRepository.save(alert));

            actor.setBotScore(BotDetector.accumulateScore(actor.getBotScore(), draft.scoreIncrease()));
            actor.setBotAlertCount(actor.getBotAlertCount() + 1);
            log.info(
                    "Bot alert {} raised for actor {}: severity={}, scoreIncrease={}, botScore={}",
                    draft.alertType().code(),
                    actor.getActorId(),
                    draft.severity(),
                    draft.scoreIncrease(),
                    actor.getBotScore()
            );
        }

        if (!Boolean.TRUE.equals(actor.getFlaggedBot()) && BotDetector.crossesFlagThreshold(actor.getBotScore())) {
            actor.setFlaggedBot(true);
            log.info("Actor {} flagged as bot with score {}", actor.getActorId(), actor.getBotScore());
        }
        actor.setUpdatedAt(now);
        actorRepository.save(actor);
        return alerts;
    }

    private ActorHistory loadHistory(ActivityKey activityKey, OffsetDateTime occurredAt) {
        return switch (activityKey.type()) {
            case PROJECT_PUBLISHED -> loadPublicationHistory(activityKey.actorId(), occurredAt);
            case IDEA_SUBMITTED -> new ActorHistory(
                    activityKey.actorId(),
                    List.of(),
                    toPastActivities(actorActivityRepository.findByActorIdAndActivityTypeAndOccurredAtAfterOrderByOccurredAtAsc(
                            activityKey.actorId(), ActorActivityType.IDEA_SUBMITTED, occurredAt.minus(IDEA_HISTORY_WINDOW)))
            );
            case REVIEW_AUTHORED -> ActorHistory.empty(activityKey.actorId());
        };
    }

    // Loads only the latest earlier publication; the others are counted.
    private ActorHistory loadPublicationHistory(UUID actorId, OffsetDateTime occurredAt) {
        List<ActorHistory.PastActivity> previous = actorActivityRepository
                .findFirstByActorIdAndActivityTypeAndOccurredAtLessThanEqualOrderByOccurredAtDesc(
                        actorId, ActorActivityType.PROJECT_PUBLISHED, occurredAt)
                .map(activity -> List.of(new ActorHistory.PastActivity(activity.getSubjectId(), activity.getOccurredAt())))
                .orElse(List.of());
        if (previous.isEmpty()) {
            return ActorHistory.empty(actorId);
        }
        long count = actorActivityRepository.countByActorIdAndActivityTypeAndOccurredAtLessThanEqual(
                actorId, ActorActivityType.PROJECT_PUBLISHED, occurredAt);
        return new ActorHistory(actorId, previous, List.of(), count);
    }

    private static List<ActorHistory.PastActivity> toPastActivities(List<ActorActivity> activities) {
        return activities.stream()
                .map(activity -> new ActorHistory.PastActivity(activity.getSubjectId(), activity.getOccurredAt()))
                .toList();
    }

    private void recordActivity(ActivityKey activityKey, OffsetDateTime occurredAt) {
        ActorActivity activity = new ActorActivity();
        activity.setActivityId(UUID.randomUUID());
        activity.setActorId(activityKey.actorId());
        activity.setActivityType(activityKey.type());
        activity.setSubjectId(activityKey.subjectId());
        activity.setOccurredAt(occurredAt);
        activity.setCreatedAt(OffsetDateTime.now());
        actorActivityRepository.saveAndFlush(activity);
    }

    private static ActivityKey activityKeyFor(XpEvent event) {
        switch (event.type()) {
            case PROJECT_PUBLISHED -> {
                ProjectPublishedEvent published = (ProjectPublishedEvent) event;
                return new ActivityKey(published.publisherId(), ActorActivityType.PROJECT_PUBLISHED, published.projectId());
            }
            case IDEA_SUBMITTED -> {
                IdeaSubmittedEvent submitted = (IdeaSubmittedEvent) event;
                return new ActivityKey(submitted.submitterId(), ActorActivityType.IDEA_SUBMITTED, submitted.ideaId());
            }
            case REVIEW_RECEIVED -> {
                // Recorded under the reviewer; PublicReviewBonusReconciler reconciles bonuses from these rows.
                ReviewReceivedEvent review = (ReviewReceivedEvent) event;
                return review.authenticatedReviewer()
                        .map(reviewerId -> new ActivityKey(reviewerId, ActorActivityType.REVIEW_AUTHORED, review.reviewId()))
                        .orElse(null);
            }
            default -> {
                return null;
            }
        }
    }

    private record ActivityKey(UUID actorId, ActorActivityType type, UUID subjectId) {
    }

    /**
     * @param firstSighting whether this call recorded the activity (false for redeliveries and untracked events)
     */
    public record InspectionResult(boolean firstSighting, List<BotAlert> alerts) {

        static final InspectionResult NOT_TRACKED = new InspectionResult(false, List.of());
        static final InspectionResult ALREADY_SEEN = new InspectionResult(false, List.of());
    }
}
