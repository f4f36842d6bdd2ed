package com.projecthub.xp.rules;

import com.projecthub.xp.event.DemoViewedEvent;
import com.projecthub.xp.event.IdeaReactionReceivedEvent;
import com.projecthub.xp.event.IdeaSubmittedEvent;
import com.projecthub.xp.event.ProjectPublishedEvent;
import com.projecthub.xp.event.ReviewReceivedEvent;
import com.projecthub.xp.event.XpEvent;
import com.projecthub.xp.model.XpReason;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Fixed award table. Holds no state: every decision is derived from the event and the supplied ledger facts,
 * and persistence is left to the ledger.
 */
@Component
public class AwardRulesEngine {

    public static final int FIRST_PROJECT_XP = 50;
    public static final int ADDITIONAL_PROJECT_XP = 10;
    public static final int DEMO_VIEW_XP = 1;
    public static final int IDEA_SUBMITTED_XP = 5;
    public static final int IDEA_REACTION_XP = 2;
    public static final int REVIEW_RECEIVED_XP = 5;
    public static final int PUBLIC_REVIEW_BONUS_XP = 2;

    public List<AwardDecision> evaluate(XpEvent event, AwardContext context) {
        return switch (event.type()) {
            case PROJECT_PUBLISHED -> List.of(projectPublished((ProjectPublishedEvent) event, context));
            case DEMO_VIEWED -> List.of(demoViewed((DemoViewedEvent) event));
            case IDEA_SUBMITTED -> List.of(ideaSubmitted((IdeaSubmittedEvent) event));
            case IDEA_REACTION_RECEIVED -> List.of(ideaReaction((IdeaReactionReceivedEvent) event));
            case REVIEW_RECEIVED -> reviewReceived((ReviewReceivedEvent) event);
            // Visibility changes only move the public-review bonus, see reconcilePublicReviewBonus.
            case IDENTITY_VISIBILITY_TOGGLED -> List.of();
        };
    }

    /**
     * Decides the single ledger step that brings one reviewer's bonus for one review in line with the
     * reviewer's current visibility flag. Grants are numbered so every on/off cycle gets fresh keys while
     * each individual grant and revoke can still only apply once.
     */
    public Optional<AwardDecision> reconcilePublicReviewBonus(
            UUID reviewerId,
            UUID reviewId,
            boolean identityPublic,
            PublicReviewBonusState state
    ) {
        if (identityPublic && !state.currentlyGranted()) {
            String grantKey = DedupKeys.publicReviewBonusGrant(reviewId, reviewerId, state.grants() + 1);
            return Optional.of(new AwardDecision(
                    reviewerId, XpReason.PUBLIC_REVIEW_BONUS, PUBLIC_REVIEW_BONUS_XP, grantKey, null, null, reviewId
            ));
        }
        if (!identityPublic && state.currentlyGranted()) {
            String grantKey = DedupKeys.publicReviewBonusGrant(reviewId, reviewerId, state.grants());
            return Optional.of(new AwardDecision(
                    reviewerId, XpReason.PUBLIC_REVIEW_BONUS, -PUBLIC_REVIEW_BONUS_XP, DedupKeys.revokeOf(grantKey),
                    null, null, reviewId
            ));
        }
        return Optional.empty();
    }

    private AwardDecision projectPublished(ProjectPublishedEvent event, AwardContext context) {
        Optional<UUID> firstAwardedProject = context.firstProjectAwardedFor(event.publisherId());
        if (firstAwardedProject.isEmpty() || firstAwardedProject.get().equals(event.projectId())) {
            return new AwardDecision(
                    event.publisherId(), XpReason.FIRST_PROJECT, FIRST_PROJECT_XP,
                    DedupKeys.firstProject(event.publisherId()), event.projectId(), null, null
            );
        }
        return new AwardDecision(
                event.publisherId(), XpReason.ADDITIONAL_PROJECT, ADDITIONAL_PROJECT_XP,
                DedupKeys.additionalProject(event.projectId()), event.projectId(), null, null
        );
    }

    private AwardDecision demoViewed(DemoViewedEvent event) {
        return new AwardDecision(
                event.projectOwnerId(), XpReason.DEMO_VIEW, DEMO_VIEW_XP,
                DedupKeys.demoView(event.projectId(), event.viewer()), event.projectId(), null, null
        );
    }

    private AwardDecision ideaSubmitted(IdeaSubmittedEvent event) {
        return new AwardDecision(
                event.submitterId(), XpReason.IDEA_SUBMITTED, IDEA_SUBMITTED_XP,
                DedupKeys.ideaSubmitted(event.ideaId()), event.projectId(), event.ideaId(), null
        );
    }

    private AwardDecision ideaReaction(IdeaReactionReceivedEvent event) {
        return new AwardDecision(
                event.ideaOwnerId(), XpReason.IDEA_REACTION, IDEA_REACTION_XP,
                DedupKeys.ideaReaction(event.ideaId(), event.reactor()), null, event.ideaId(), null
        );
    }

    private List<AwardDecision> reviewReceived(ReviewReceivedEvent event) {
        if (event.authenticatedReviewer().isEmpty()) {
            return List.of();
        }
        return List.of(new AwardDecision(
                event.projectOwnerId(), XpReason.REVIEW_RECEIVED, REVIEW_RECEIVED_XP,
                DedupKeys.reviewReceived(event.reviewId()), event.projectId(), null, event.reviewId()
        ));
    }
}
