package com.projecthub.xp.service;

import com.projecthub.xp.config.XpEngineProperties;
import com.projecthub.xp.repository.ActorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FirstCohortServiceTest {

    @Mock
    private ActorRepository actorRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private XpEngineProperties xpEngineProperties;
    private FirstCohortService firstCohortService;

    @BeforeEach
    void setUp() {
        xpEngineProperties = new XpEngineProperties();
        firstCohortService = new FirstCohortService(
                actorRepository, xpEngineProperties, new TransactionTemplate(transactionManager)
        );
    }

    @Test
    void marksEarliestJoinersWhenNoBadgeAssigned() {
        List<UUID> earliest = List.of(UUID.randomUUID(), UUID.randomUUID());
        when(actorRepository.existsByFirstHundredTrue()).thenReturn(false);
        when(actorRepository.findEarliestJoinedActorIds(100)).thenReturn(earliest);
        when(actorRepository.markFirstHundred(earliest)).thenReturn(2);

        assertEquals(2, firstCohortService.markFirstCohort());
    }

    @Test
    void doesNothingOnceBadgeAssigned() {
        when(actorRepository.existsByFirstHundredTrue()).thenReturn(true);

        assertEquals(0, firstCohortService.markFirstCohort());
        verify(actorRepository, never()).findEarliestJoinedActorIds(anyInt());
        verify(actorRepository, never()).markFirstHundred(any());
    }

    @Test
    void doesNothingWithoutActors() {
        when(actorRepository.existsByFirstHundredTrue()).thenReturn(false);
        when(actorRepository.findEarliestJoinedActorIds(100)).thenReturn(List.of());

        assertEquals(0, firstCohortService.markFirstCohort());
        verify(actorRepository, never()).markFirstHundred(any());
    }

    @Test
    void startupBootstrapCanBeDisabled() {
        xpEngineProperties.getFirstCohort().setBootstrapOnStartup(false);

        firstCohortService.run(new DefaultApplicationArguments());

        verifyNoInteractions(actorRepository);
    }
}
