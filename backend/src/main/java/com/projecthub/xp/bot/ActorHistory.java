package com.projecthub.xp.bot;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Prior activity of the actor an event is attributed to. The event's own subject is never included.
 * {@code publishedProjects} may hold only the most recent earlier publication, in which case
 * {@code publishedProjectCount} carries how many earlier publications exist in total.
 */
public record ActorHistory(
        UUID actorId,
        List<PastActivity> publishedProjects,
        List<PastActivity> submittedIdeas,
        long publishedProjectCount
) {

    public ActorHistory {
        publishedProjects = List.copyOf(publishedProjects);
        submittedIdeas = List.copyOf(submittedIdeas);
        publishedProjectCount = Math.max(publishedProjectCount, publishedProjects.size());
    }

    public ActorHistory(UUID actorId, List<PastActivity> publishedProjects, List<PastActivity> submittedIdeas) {
        this(actorId, publishedProjects, submittedIdeas, publishedProjects.size());
    }

    public static ActorHistory empty(UUID actorId) {
        return new ActorHistory(actorId, List.of(), List.of());
    }

    public record PastActivity(UUID subjectId, OffsetDateTime occurredAt) {
    }
}
