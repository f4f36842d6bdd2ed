package com.projecthub.xp.service;

import com.projecthub.xp.dto.XpEventRequests;
import com.projecthub.xp.dto.XpEventResponses;
import com.projecthub.xp.event.DemoViewedEvent;
import com.projecthub.xp.event.IdeaReactionReceivedEvent;
import com.projecthub.xp.event.IdeaSubmittedEvent;
import com.projecthub.xp.event.IdentityVisibilityToggledEvent;
import com.projecthub.xp.event.ProjectPublishedEvent;
import com.projecthub.xp.event.ReviewReceivedEvent;
import com.projecthub.xp.event.XpEvent;
import com.projecthub.xp.event.XpEventParser;
import com.projecthub.xp.mapper.XpResponseMapper;
import com.projecthub.xp.model.BotAlert;
import com.projecthub.xp.model.XpReason;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.rules.AwardDecision;
import com.projecthub.xp.rules.AwardRulesEngine;
import com.projecthub.xp.web.XpEventRejectedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Single entry point for domain events: parse, resolve actors, inspect for bots, evaluate the award table,
 * append each award, then reconcile the public-review bonus where the event can move it.
 */
@Service
@RequiredArgsConstructor
public class XpEventService {

    private static final Logger log = LoggerFactory.getLogger(XpEventService.class);

    private final XpEventParser xpEventParser;
    private final AwardRulesEngine awardRulesEngine;
    private final LedgerAwardContext ledgerAwardContext;
    private final XpLedgerService xpLedgerService;
    private final BotDetectionService botDetectionService;
    private final PublicReviewBonusReconciler publicReviewBonusReconciler;
    private final ActorRepository actorRepository;
    private final EventProcessingGate eventProcessingGate;
    private final XpResponseMapper xpResponseMapper;

    public XpEventResponses.RecordEventResult recordEvent(XpEventRequests.RecordEventRequest request) {
        XpEvent event = xpEventParser.parse(request, OffsetDateTime.now());
        ProcessedEvent processed = eventProcessingGate.runLive(() -> process(event, false));
        return xpResponseMapper.toRecordEventResult(event, processed.appendResults(), processed.alerts());
    }

    /**
     * Runs one parsed event through the pipeline. Callers are responsible for holding the processing gate.
     */
    ProcessedEvent process(XpEvent event, boolean retroactive) {
        requireKnownActors(event);

        BotDetectionService.InspectionResult inspection = botDetectionService.inspect(event, !retroactive);

        List<XpLedgerService.AppendResult> results = new ArrayList<>();
        for (AwardDecision decision : awardRulesEngine.evaluate(event, ledgerAwardContext)) {
            XpLedgerService.AppendResult result = xpLedgerService.append(decision, event.occurredAt(), retroactive);
            results.add(result);
            if (!result.applied() && decision.reason() == XpReason.FIRST_PROJECT) {
                retryAsAdditionalProject(event, retroactive).ifPresent(results::add);
            }
        }

        switch (event.type()) {
            case REVIEW_RECEIVED -> {
                ReviewReceivedEvent review = (ReviewReceivedEvent) event;
                review.authenticatedReviewer().ifPresent(reviewerId -> results.addAll(
                        publicReviewBonusReconciler.reconcileReview(
                                reviewerId, review.reviewId(), event.occurredAt(), retroactive)
                ));
            }
            case IDENTITY_VISIBILITY_TOGGLED -> {
                IdentityVisibilityToggledEvent toggle = (IdentityVisibilityToggledEvent) event;
                results.addAll(publicReviewBonusReconciler.applyVisibility(
                        toggle.actorId(), toggle.identityPublic(), event.occurredAt(), retroactive));
            }
            default -> {
            }
        }

        long applied = results.stream().filter(XpLedgerService.AppendResult::applied).count();
        if (applied == 0 && !results.isEmpty()) {
            log.debug("Event {} produced no new XP (all {} awards already applied)", event.type(), results.size());
        }
        return new ProcessedEvent(results, inspection.alerts());
    }

    /**
     * A first-project award that lost the dedup race belongs to another project; re-evaluate once so this project
     * earns the additional-project award instead of nothing.
     */
    private Optional<XpLedgerService.AppendResult> retryAsAdditionalProject(XpEvent event, boolean retroactive) {
        for (AwardDecision decision : awardRulesEngine.evaluate(event, ledgerAwardContext)) {
            if (decision.reason() == XpReason.ADDITIONAL_PROJECT) {
                return Optional.of(xpLedgerService.append(decision, event.occurredAt(), retroactive));
            }
        }
        return Optional.empty();
    }

    private void requireKnownActors(XpEvent event) {
        Set<UUID> required = new LinkedHashSet<>();
        switch (event.type()) {
            case PROJECT_PUBLISHED -> required.add(((ProjectPublishedEvent) event).publisherId());
            case DEMO_VIEWED -> required.add(((DemoViewedEvent) event).projectOwnerId());
            case IDEA_SUBMITTED -> required.add(((IdeaSubmittedEvent) event).submitterId());
            case IDEA_REACTION_RECEIVED -> required.add(((IdeaReactionReceivedEvent) event).ideaOwnerId());
            case REVIEW_RECEIVED -> {
                ReviewReceivedEvent review = (ReviewReceivedEvent) event;
                required.add(review.projectOwnerId());
                review.authenticatedReviewer().ifPresent(required::add);
            }
            case IDENTITY_VISIBILITY_TOGGLED -> required.add(((IdentityVisibilityToggledEvent) event).actorId());
        }
        for (UUID actorId : required) {
            if (!actorRepository.existsById(actorId)) {
                throw XpEventRejectedException.unknownActor(
                        event.type() + " references unknown XP actor " + actorId
                );
            }
        }
    }

    record ProcessedEvent(
            List<XpLedgerService.AppendResult> appendResults,
            List<BotAlert> alerts
    ) {
    }
}
