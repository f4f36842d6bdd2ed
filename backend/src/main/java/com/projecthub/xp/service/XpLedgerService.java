package com.projecthub.xp.service;

import com.projecthub.xp.model.Actor;
import com.projecthub.xp.model.XpTransaction;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.repository.XpTransactionRepository;
import com.projecthub.xp.rules.AwardDecision;
import com.projecthub.xp.web.XpEventRejectedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only XP ledger. Every applied transaction updates the recipient's cached total and level in the same
 * database transaction, under the recipient's row lock, so awards to one actor serialize while different
 * actors proceed in parallel.
 */
@Service
@RequiredArgsConstructor
public class XpLedgerService {

    private static final Logger log = LoggerFactory.getLogger(XpLedgerService.class);

    private final ActorRepository actorRepository;
    private final XpTransactionRepository xpTransactionRepository;
    private final LedgerTransactionExecutor ledgerTransactionExecutor;

    public AppendResult append(AwardDecision decision, OffsetDateTime occurredAt, boolean retroactive) {
        return ledgerTransactionExecutor.execute(
                "XP append " + decision.dedupKey(),
                status -> {
                    Actor recipient = lockActor(decision.recipientId());
                    return appendLocked(recipient, decision, occurredAt, retroactive);
                }
        );
    }

    /**
     * Locks the actor row for the current transaction.
     *
     * @throws XpEventRejectedException when no such actor was provisioned
     */
    public Actor lockActor(UUID actorId) {
        return actorRepository.findByActorIdForUpdate(actorId)
                .orElseThrow(() -> XpEventRejectedException.unknownActor("XP actor not found: " + actorId));
    }

    /**
     * Appends within the caller's transaction. The caller must already hold {@code recipient}'s row lock.
     */
    public AppendResult appendLocked(
            Actor recipient,
            AwardDecision decision,
            OffsetDateTime occurredAt,
            boolean retroactive
    ) {
        if (!recipient.getActorId().equals(decision.recipientId())) {
            throw new IllegalArgumentException("Locked actor " + recipient.getActorId()
                    + " does not match recipient " + decision.recipientId());
        }
        if (xpTransactionRepository.existsByReasonAndDedupKey(decision.reason(), decision.dedupKey())) {
            log.debug("Duplicate XP award ignored: reason={}, dedupKey={}", decision.reason(), decision.dedupKey());
            return new AppendResult(decision, false, recipient.getTotalXp());
        }

        OffsetDateTime now = OffsetDateTime.now();
        XpTransaction transaction = new XpTransaction();
        transaction.setTransactionId(UUID.randomUUID());
        transaction.setActorId(recipient.getActorId());
        transaction.setAmount(decision.amount());
        transaction.setReason(decision.reason());
        transaction.setProjectId(decision.projectId());
        transaction.setIdeaId(decision.ideaId());
        transaction.setReviewId(decision.reviewId());
        transaction.setDedupKey(decision.dedupKey());
        transaction.setRetroactive(retroactive);
        transaction.setOccurredAt(occurredAt == null ? now : occurredAt);
        transaction.setCreatedAt(now);
        xpTransactionRepository.saveAndFlush(transaction);

        long newTotal = (long) recipient.getTotalXp() + decision.amount();
        if (newTotal < 0) {
            log.warn(
                    "XP total for actor {} would drop to {} after {}; clamping to 0",
                    recipient.getActorId(),
                    newTotal,
                    decision.dedupKey()
            );
            newTotal = 0;
        }
        int total = (int) Math.min(Integer.MAX_VALUE, newTotal);
        recipient.setTotalXp(total);
        recipient.setXpLevel(XpLevelCalculator.levelFor(total));
        recipient.setLastAwardAt(now);
        recipient.setUpdatedAt(now);
        actorRepository.save(recipient);
        return new AppendResult(decision, true, total);
    }

    public record AppendResult(
            AwardDecision decision,
            boolean applied,
            int totalXpAfter
    ) {
    }
}
