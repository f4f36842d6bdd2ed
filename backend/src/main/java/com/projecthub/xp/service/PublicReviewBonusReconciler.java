package com.projecthub.xp.service;

import com.projecthub.xp.model.Actor;
import com.projecthub.xp.model.ActorActivityType;
import com.projecthub.xp.model.XpReason;
import com.projecthub.xp.repository.ActorActivityRepository;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.repository.XpTransactionRepository;
import com.projecthub.xp.rules.AwardDecision;
import com.projecthub.xp.rules.AwardRulesEngine;
import com.projecthub.xp.rules.PublicReviewBonusState;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps each reviewer's public-review bonus in line with their identity-visibility flag. The flag is read and
 * the ledger is compared under the reviewer's row lock, so concurrent toggles and reviews cannot double-grant.
 */
@Service
@RequiredArgsConstructor
public class PublicReviewBonusReconciler {

    private static final Logger log = LoggerFactory.getLogger(PublicReviewBonusReconciler.class);

    private final AwardRulesEngine awardRulesEngine;
    private final XpLedgerService xpLedgerService;
    private final XpTransactionRepository xpTransactionRepository;
    private final ActorActivityRepository actorActivityRepository;
    private final ActorRepository actorRepository;
    private final LedgerTransactionExecutor ledgerTransactionExecutor;

    public List<XpLedgerService.AppendResult> reconcileReview(
            UUID reviewerId,
            UUID reviewId,
            OffsetDateTime occurredAt,
            boolean retroactive
    ) {
        return ledgerTransactionExecutor.execute("public-review bonus for review " + reviewId, status -> {
            Actor reviewer = xpLedgerService.lockActor(reviewerId);
            List<XpLedgerService.AppendResult> results = new ArrayList<>();
            reconcileLocked(reviewer, reviewId, occurredAt, retroactive).ifPresent(results::add);
            return results;
        });
    }

    public List<XpLedgerService.AppendResult> applyVisibility(
            UUID actorId,
            boolean identityPublic,
            OffsetDateTime occurredAt,
            boolean retroactive
    ) {
        return ledgerTransactionExecutor.execute("identity visibility for actor " + actorId, status -> {
            Actor actor = xpLedgerService.lockActor(actorId);
            if (actor.getReviewIdentityPublic() != identityPublic) {
                actor.setReviewIdentityPublic(identityPublic);
                actor.setUpdatedAt(OffsetDateTime.now());
                actorRepository.save(actor);
            }

            List<XpLedgerService.AppendResult> results = new ArrayList<>();
            List<UUID> reviewIds = actorActivityRepository.findSubjectIds(actorId, ActorActivityType.REVIEW_AUTHORED);
            for (UUID reviewId : reviewIds) {
                reconcileLocked(actor, reviewId, occurredAt, retroactive).ifPresent(results::add);
            }
            if (!results.isEmpty()) {
                log.info(
                        "Reconciled {} public-review bonus entries for actor {} (identityPublic={})",
                        results.size(),
                        actorId,
                        identityPublic
                );
            }
            return results;
        });
    }

    private Optional<XpLedgerService.AppendResult> reconcileLocked(
            Actor reviewer,
            UUID reviewId,
            OffsetDateTime occurredAt,
            boolean retroactive
    ) {
        PublicReviewBonusState state = loadState(reviewer.getActorId(), reviewId);
        Optional<AwardDecision> decision = awardRulesEngine.reconcilePublicReviewBonus(
                reviewer.getActorId(),
                reviewId,
                Boolean.TRUE.equals(reviewer.getReviewIdentityPublic()),
                state
        );
        return decision.map(award -> xpLedgerService.appendLocked(reviewer, award, occurredAt, retroactive));
    }

    private PublicReviewBonusState loadState(UUID reviewerId, UUID reviewId) {
        long grants = xpTransactionRepository.countGrantsForReview(reviewerId, reviewId, XpReason.PUBLIC_REVIEW_BONUS);
        Long net = xpTransactionRepository.sumForReview(reviewerId, reviewId, XpReason.PUBLIC_REVIEW_BONUS);
        return new PublicReviewBonusState((int) grants, net == null ? 0 : net.intValue());
    }
}
