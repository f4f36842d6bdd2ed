package com.projecthub.xp.service;

import com.projecthub.xp.model.Actor;
import com.projecthub.xp.repository.ActorLedgerTotalRow;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.repository.XpTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Recomputes cached totals and levels from the ledger for actors whose cache diverged.
 * Each actor is re-checked and fixed under its own row lock.
 */
@Service
@RequiredArgsConstructor
public class XpAggregateRepairService {

    private static final Logger log = LoggerFactory.getLogger(XpAggregateRepairService.class);

    private final ActorRepository actorRepository;
    private final XpTransactionRepository xpTransactionRepository;
    private final XpLedgerService xpLedgerService;
    private final LedgerTransactionExecutor ledgerTransactionExecutor;

    public int repairAll() {
        List<ActorLedgerTotalRow> candidates = actorRepository.findAllWithLedgerTotals().stream()
                .filter(XpAggregateRepairService::diverged)
                .toList();

        int repaired = 0;
        for (ActorLedgerTotalRow candidate : candidates) {
            Boolean fixed = ledgerTransactionExecutor.execute("aggregate repair for " + candidate.getActorId(), status -> {
                Actor actor = xpLedgerService.lockActor(candidate.getActorId());
                Long ledgerTotal = xpTransactionRepository.sumAmountByActorId(actor.getActorId());
                int expectedTotal = expectedTotal(ledgerTotal == null ? 0L : ledgerTotal);
                int expectedLevel = XpLevelCalculator.levelFor(expectedTotal);
                if (actor.getTotalXp() == expectedTotal && actor.getXpLevel() == expectedLevel) {
                    return false;
                }
                log.warn(
                        "Repairing XP aggregate for actor {}: totalXp {} -> {}, xpLevel {} -> {}",
                        actor.getActorId(),
                        actor.getTotalXp(),
                        expectedTotal,
                        actor.getXpLevel(),
                        expectedLevel
                );
                actor.setTotalXp(expectedTotal);
                actor.setXpLevel(expectedLevel);
                actor.setUpdatedAt(OffsetDateTime.now());
                actorRepository.save(actor);
                return true;
            });
            if (Boolean.TRUE.equals(fixed)) {
                repaired++;
            }
        }
        log.info("XP aggregate repair pass finished: scanned={}, repaired={}", candidates.size(), repaired);
        return repaired;
    }

    static boolean diverged(ActorLedgerTotalRow row) {
        long ledgerTotal = row.getLedgerTotal() == null ? 0L : row.getLedgerTotal();
        int expectedTotal = expectedTotal(ledgerTotal);
        return row.getTotalXp() != expectedTotal || row.getXpLevel() != XpLevelCalculator.levelFor(expectedTotal);
    }

    private static int expectedTotal(long ledgerTotal) {
        return (int) Math.max(0L, Math.min(Integer.MAX_VALUE, ledgerTotal));
    }
}
