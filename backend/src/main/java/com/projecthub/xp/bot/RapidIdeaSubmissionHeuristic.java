package com.projecthub.xp.bot;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.projecthub.xp.event.IdeaSubmittedEvent;
import com.projecthub.xp.event.XpEvent;
import com.projecthub.xp.event.XpEventType;
import com.projecthub.xp.model.BotAlertSeverity;
import com.projecthub.xp.model.BotAlertType;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Flags more than five ideas inside the hour ending at the current submission, the current one included.
 */
public class RapidIdeaSubmissionHeuristic implements BotHeuristic {

    static final Duration WINDOW = Duration.ofHours(1);
    static final int MAX_IDEAS_PER_WINDOW = 5;
    static final int SCORE_INCREASE = 15;

    @Override
    public Optional<BotAlertDraft> inspect(XpEvent event, ActorHistory history) {
        if (event.type() != XpEventType.IDEA_SUBMITTED) {
            return Optional.empty();
        }
        IdeaSubmittedEvent submitted = (IdeaSubmittedEvent) event;
        OffsetDateTime windowStart = submitted.occurredAt().minus(WINDOW);

        long earlierInWindow = history.submittedIdeas().stream()
                .map(ActorHistory.PastActivity::occurredAt)
                .filter(at -> at.isAfter(windowStart) && !at.isAfter(submitted.occurredAt()))
                .count();
        long ideasInWindow = earlierInWindow + 1;
        if (ideasInWindow <= MAX_IDEAS_PER_WINDOW) {
            return Optional.empty();
        }

        ObjectNode evidence = JsonNodeFactory.instance.objectNode();
        evidence.put("ideas_in_hour", ideasInWindow);
        evidence.put("idea_id", submitted.ideaId().toString());
        return Optional.of(new BotAlertDraft(
                BotAlertType.RAPID_IDEA_SUBMISSION,
                BotAlertSeverity.MEDIUM,
                SCORE_INCREASE,
                evidence
        ));
    }
}
