package com.projecthub.xp.bot;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.projecthub.xp.event.ProjectPublishedEvent;
import com.projecthub.xp.event.XpEvent;
import com.projecthub.xp.event.XpEventType;
import com.projecthub.xp.model.BotAlertSeverity;
import com.projecthub.xp.model.BotAlertType;

import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;

/**
 * Flags a publication that follows the actor's previous one by less than five minutes.
 */
public class RapidProjectPublishingHeuristic implements BotHeuristic {

    static final Duration MIN_GAP = Duration.ofMinutes(5);
    static final int SCORE_INCREASE = 20;

    @Override
    public Optional<BotAlertDraft> inspect(XpEvent event, ActorHistory history) {
        if (event.type() != XpEventType.PROJECT_PUBLISHED) {
            return Optional.empty();
        }
        ProjectPublishedEvent published = (ProjectPublishedEvent) event;

        Optional<ActorHistory.PastActivity> previous = history.publishedProjects().stream()
                .filter(activity -> !activity.occurredAt().isAfter(published.occurredAt()))
                .max(Comparator.comparing(ActorHistory.PastActivity::occurredAt));
        if (previous.isEmpty()) {
            return Optional.empty();
        }

        Duration gap = Duration.between(previous.get().occurredAt(), published.occurredAt());
        if (gap.compareTo(MIN_GAP) >= 0) {
            return Optional.empty();
        }

        ObjectNode evidence = JsonNodeFactory.instance.objectNode();
        evidence.put("project_count", history.publishedProjectCount() + 1);
        evidence.put("time_since_last_seconds", gap.toSeconds());
        evidence.put("project_id", published.projectId().toString());
        evidence.put("previous_project_id", previous.get().subjectId().toString());
        return Optional.of(new BotAlertDraft(
                BotAlertType.RAPID_PROJECT_PUBLISHING,
                BotAlertSeverity.HIGH,
                SCORE_INCREASE,
                evidence
        ));
    }
}
