package com.projecthub.xp.service;

import com.projecthub.xp.model.Actor;
import com.projecthub.xp.repository.ActorLedgerTotalRow;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.repository.XpTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class XpAggregateRepairServiceTest {

    @Mock
    private ActorRepository actorRepository;

    @Mock
    private XpTransactionRepository xpTransactionRepository;

    @Mock
    private XpLedgerService xpLedgerService;

    @Mock
    private LedgerTransactionExecutor ledgerTransactionExecutor;

    private XpAggregateRepairService xpAggregateRepairService;

    @BeforeEach
    void setUp() {
        xpAggregateRepairService = new XpAggregateRepairService(
                actorRepository, xpTransactionRepository, xpLedgerService, ledgerTransactionExecutor
        );
        lenient().when(ledgerTransactionExecutor.execute(anyString(), any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(1);
            return callback.doInTransaction(null);
        });
    }

    @Test
    void repairsOnlyDivergedActors() {
        UUID healthyId = UUID.randomUUID();
        UUID driftedId = UUID.randomUUID();
        when(actorRepository.findAllWithLedgerTotals()).thenReturn(List.of(
                row(healthyId, 55, 7, 55L),
                row(driftedId, 40, 6, 65L)
        ));
        Actor drifted = actor(driftedId, 40, 6);
        when(xpLedgerService.lockActor(driftedId)).thenReturn(drifted);
        when(xpTransactionRepository.sumAmountByActorId(driftedId)).thenReturn(65L);

        int repaired = xpAggregateRepairService.repairAll();

        assertEquals(1, repaired);
        assertEquals(65, drifted.getTotalXp());
        assertEquals(XpLevelCalculator.levelFor(65), drifted.getXpLevel());
        verify(actorRepository).save(drifted);
        verify(xpLedgerService, never()).lockActor(healthyId);
    }

    @Test
    void skipsActorFixedConcurrently() {
        UUID actorId = UUID.randomUUID();
        when(actorRepository.findAllWithLedgerTotals()).thenReturn(List.of(row(actorId, 0, 1, 10L)));
        Actor current = actor(actorId, 10, XpLevelCalculator.levelFor(10));
        when(xpLedgerService.lockActor(actorId)).thenReturn(current);
        when(xpTransactionRepository.sumAmountByActorId(actorId)).thenReturn(10L);

        assertEquals(0, xpAggregateRepairService.repairAll());
        verify(actorRepository, never()).save(any());
    }

    @Test
    void nothingToRepairWhenAllConsistent() {
        when(actorRepository.findAllWithLedgerTotals()).thenReturn(List.of(row(UUID.randomUUID(), 0, 1, null)));

        assertEquals(0, xpAggregateRepairService.repairAll());
        verifyNoInteractions(ledgerTransactionExecutor);
    }

    @Test
    void negativeLedgerSumIsTreatedAsZero() {
        assertFalse(XpAggregateRepairService.diverged(row(UUID.randomUUID(), 0, 1, -4L)));
        assertTrue(XpAggregateRepairService.diverged(row(UUID.randomUUID(), 3, 1, -4L)));
    }

    private static Actor actor(UUID actorId, int totalXp, int xpLevel) {
        Actor actor = new Actor();
        actor.setActorId(actorId);
        actor.setTotalXp(totalXp);
        actor.setXpLevel(xpLevel);
        return actor;
    }

    private static ActorLedgerTotalRow row(UUID actorId, int totalXp, int xpLevel, Long ledgerTotal) {
        return new ActorLedgerTotalRow() {
            @Override
            public UUID getActorId() {
                return actorId;
            }

            @Override
            public Integer getTotalXp() {
                return totalXp;
            }

            @Override
            public Integer getXpLevel() {
                return xpLevel;
            }

            @Override
            public Long getLedgerTotal() {
                return ledgerTotal;
            }
        };
    }
}
