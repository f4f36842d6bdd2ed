package com.projecthub.xp.service;

import com.projecthub.xp.dto.XpEventRequests;
import com.projecthub.xp.dto.XpEventResponses;
import com.projecthub.xp.event.XpEvent;
import com.projecthub.xp.event.XpEventParser;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Replays historical events through the live rules and dedup keys, oldest first, while holding the processing gate
 * exclusively. Replayed awards are marked retroactive and bot detection is skipped.
 */
@Service
@RequiredArgsConstructor
public class XpBackfillService {

    private static final Logger log = LoggerFactory.getLogger(XpBackfillService.class);

    private final XpEventParser xpEventParser;
    private final XpEventService xpEventService;
    private final EventProcessingGate eventProcessingGate;
    private final LeaderboardRankingService leaderboardRankingService;

    public XpEventResponses.BackfillResult backfill(XpEventRequests.BackfillRequest request) {
        OffsetDateTime receivedAt = OffsetDateTime.now();
        List<XpEvent> events = new ArrayList<>();
        for (XpEventRequests.RecordEventRequest eventRequest : request.events()) {
            events.add(xpEventParser.parse(eventRequest, receivedAt));
        }
        events.sort(Comparator.comparing(XpEvent::occurredAt));

        BackfillTally tally = eventProcessingGate.runExclusive(() -> {
            BackfillTally running = new BackfillTally();
            for (XpEvent event : events) {
                XpEventService.ProcessedEvent processed = xpEventService.process(event, true);
                for (XpLedgerService.AppendResult result : processed.appendResults()) {
                    if (result.applied()) {
                        running.applied++;
                    } else {
                        running.duplicates++;
                    }
                }
            }
            return running;
        });

        LeaderboardRankingService.RecomputeOutcome recompute = leaderboardRankingService.recompute();
        log.info(
                "XP backfill finished: events={}, applied={}, duplicatesSkipped={}, rankedActors={}",
                events.size(),
                tally.applied,
                tally.duplicates,
                recompute.rankedActors()
        );
        return new XpEventResponses.BackfillResult(
                events.size(),
                tally.applied,
                tally.duplicates,
                recompute.rankedActors()
        );
    }

    private static final class BackfillTally {
        private int applied;
        private int duplicates;
    }
}
