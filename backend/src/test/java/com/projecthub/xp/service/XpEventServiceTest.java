package com.projecthub.xp.service;

import com.projecthub.xp.dto.XpEventRequests;
import com.projecthub.xp.dto.XpEventResponses;
import com.projecthub.xp.event.ProjectPublishedEvent;
import com.projecthub.xp.event.ReviewReceivedEvent;
import com.projecthub.xp.event.XpEventParser;
import com.projecthub.xp.mapper.XpResponseMapper;
import com.projecthub.xp.model.XpReason;
import com.projecthub.xp.repository.ActorRepository;
import com.projecthub.xp.rules.AwardDecision;
import com.projecthub.xp.rules.AwardRulesEngine;
import com.projecthub.xp.web.XpEventRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class XpEventServiceTest {

    private static final UUID PUBLISHER = UUID.fromString("00000000-0000-0000-0000-000000000041");
    private static final UUID OWNER = UUID.fromString("00000000-0000-0000-0000-000000000042");
    private static final UUID PROJECT = UUID.fromString("00000000-0000-0000-0000-000000000141");
    private static final UUID OTHER_PROJECT = UUID.fromString("00000000-0000-0000-0000-000000000142");
    private static final UUID REVIEW = UUID.fromString("00000000-0000-0000-0000-000000000341");
    private static final OffsetDateTime OCCURRED_AT = OffsetDateTime.parse("2026-03-01T09:00:00Z");

    @Mock
    private LedgerAwardContext ledgerAwardContext;

    @Mock
    private XpLedgerService xpLedgerService;

    @Mock
    private BotDetectionService botDetectionService;

    @Mock
    private PublicReviewBonusReconciler publicReviewBonusReconciler;

    @Mock
    private ActorRepository actorRepository;

    private XpEventService xpEventService;

    @BeforeEach
    void setUp() {
        xpEventService = new XpEventService(
                new XpEventParser(),
                new AwardRulesEngine(),
                ledgerAwardContext,
                xpLedgerService,
                botDetectionService,
                publicReviewBonusReconciler,
                actorRepository,
                new EventProcessingGate(),
                new XpResponseMapper()
        );
    }

    @Test
    void recordsFirstProjectAward() {
        when(actorRepository.existsById(PUBLISHER)).thenReturn(true);
        when(botDetectionService.inspect(any(), eq(true)))
                .thenReturn(new BotDetectionService.InspectionResult(true, List.of()));
        when(ledgerAwardContext.firstProjectAwardedFor(PUBLISHER)).thenReturn(Optional.empty());
        when(xpLedgerService.append(any(), eq(OCCURRED_AT), eq(false)))
                .thenAnswer(invocation -> new XpLedgerService.AppendResult(invocation.getArgument(0), true, 50));

        XpEventResponses.RecordEventResult result = xpEventService.recordEvent(new XpEventRequests.RecordEventRequest(
                "PROJECT_PUBLISHED",
                PUBLISHER,
                new XpEventRequests.TargetRefs(PROJECT, null, null, null, null),
                null,
                null,
                OCCURRED_AT
        ));

        assertEquals("PROJECT_PUBLISHED", result.eventType());
        assertEquals(1, result.awards().size());
        assertEquals(XpReason.FIRST_PROJECT, result.awards().get(0).reason());
        assertTrue(result.awards().get(0).applied());
        assertTrue(result.botAlerts().isEmpty());
    }

    @Test
    void lostFirstProjectRaceIsReevaluatedAsAdditionalProject() {
        when(actorRepository.existsById(PUBLISHER)).thenReturn(true);
        when(botDetectionService.inspect(any(), anyBoolean()))
                .thenReturn(new BotDetectionService.InspectionResult(true, List.of()));
        when(ledgerAwardContext.firstProjectAwardedFor(PUBLISHER))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(OTHER_PROJECT));
        when(xpLedgerService.append(any(), any(), anyBoolean())).thenAnswer(invocation -> {
            AwardDecision decision = invocation.getArgument(0);
            return new XpLedgerService.AppendResult(decision, decision.reason() != XpReason.FIRST_PROJECT, 60);
        });

        XpEventService.ProcessedEvent processed = xpEventService.process(
                new ProjectPublishedEvent(PUBLISHER, PROJECT, OCCURRED_AT), false);

        assertEquals(2, processed.appendResults().size());
        assertFalse(processed.appendResults().get(0).applied());
        XpLedgerService.AppendResult retried = processed.appendResults().get(1);
        assertEquals(XpReason.ADDITIONAL_PROJECT, retried.decision().reason());
        assertEquals("project:" + PROJECT, retried.decision().dedupKey());
        assertTrue(retried.applied());
    }

    @Test
    void anonymousReviewTouchesNoLedgerAndNoBonus() {
        when(actorRepository.existsById(OWNER)).thenReturn(true);
        when(botDetectionService.inspect(any(), anyBoolean()))
                .thenReturn(new BotDetectionService.InspectionResult(false, List.of()));

        XpEventService.ProcessedEvent processed = xpEventService.process(
                new ReviewReceivedEvent(REVIEW, PROJECT, OWNER, null, OCCURRED_AT), false);

        assertTrue(processed.appendResults().isEmpty());
        verifyNoInteractions(xpLedgerService, publicReviewBonusReconciler);
    }

    @Test
    void authenticatedReviewReconcilesReviewerBonus() {
        when(actorRepository.existsById(any())).thenReturn(true);
        when(botDetectionService.inspect(any(), anyBoolean()))
                .thenReturn(new BotDetectionService.InspectionResult(true, List.of()));
        when(xpLedgerService.append(any(), any(), anyBoolean()))
                .thenAnswer(invocation -> new XpLedgerService.AppendResult(invocation.getArgument(0), true, 5));
        when(publicReviewBonusReconciler.reconcileReview(PUBLISHER, REVIEW, OCCURRED_AT, false)).thenReturn(List.of());

        XpEventService.ProcessedEvent processed = xpEventService.process(
                new ReviewReceivedEvent(REVIEW, PROJECT, OWNER, PUBLISHER, OCCURRED_AT), false);

        assertEquals(1, processed.appendResults().size());
        assertEquals(OWNER, processed.appendResults().get(0).decision().recipientId());
        verify(publicReviewBonusReconciler).reconcileReview(PUBLISHER, REVIEW, OCCURRED_AT, false);
    }

    @Test
    void unknownRecipientIsRejectedBeforeAnyStateChange() {
        when(actorRepository.existsById(PUBLISHER)).thenReturn(false);

        XpEventRejectedException ex = assertThrows(XpEventRejectedException.class, () -> xpEventService.process(
                new ProjectPublishedEvent(PUBLISHER, PROJECT, OCCURRED_AT), false));

        assertEquals("unknown_actor", ex.getCode());
        verifyNoInteractions(botDetectionService, xpLedgerService);
    }

    @Test
    void retroactiveReplaySkipsBotDetection() {
        when(actorRepository.existsById(PUBLISHER)).thenReturn(true);
        when(botDetectionService.inspect(any(), eq(false)))
                .thenReturn(new BotDetectionService.InspectionResult(true, List.of()));
        when(ledgerAwardContext.firstProjectAwardedFor(PUBLISHER)).thenReturn(Optional.empty());
        when(xpLedgerService.append(any(), any(), eq(true)))
                .thenAnswer(invocation -> new XpLedgerService.AppendResult(invocation.getArgument(0), true, 50));

        xpEventService.process(new ProjectPublishedEvent(PUBLISHER, PROJECT, OCCURRED_AT), true);

        verify(botDetectionService).inspect(any(), eq(false));
        verify(botDetectionService, never()).inspect(any(), eq(true));
    }
}
