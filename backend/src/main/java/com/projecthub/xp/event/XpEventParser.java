package com.projecthub.xp.event;

import com.projecthub.xp.dto.XpEventRequests;
import com.projecthub.xp.web.XpEventRejectedException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns the loosely-typed wire request into one typed {@link XpEvent}, rejecting unknown types
 * and events that lack the references their type requires.
 */
@Component
public class XpEventParser {

    public XpEvent parse(XpEventRequests.RecordEventRequest request, OffsetDateTime receivedAt) {
        if (request == null) {
            throw XpEventRejectedException.malformedEvent("Event body is required");
        }
        XpEventType type = XpEventType.fromWireName(request.eventType())
                .orElseThrow(() -> XpEventRejectedException.unknownEventType(
                        "Unknown XP event type: " + request.eventType()
                ));

        XpEventRequests.TargetRefs refs = request.targetRefs() == null
                ? new XpEventRequests.TargetRefs(null, null, null, null, null)
                : request.targetRefs();
        String sessionToken = request.dedupContext() == null ? null : normalizeToken(request.dedupContext().sessionToken());
        OffsetDateTime occurredAt = request.occurredAt() == null ? receivedAt : request.occurredAt();
        UUID actorId = request.actorId();

        List<String> missing = new ArrayList<>();
        XpEvent event = switch (type) {
            case PROJECT_PUBLISHED -> {
                require(actorId, "actorId", missing);
                require(refs.projectId(), "targetRefs.projectId", missing);
                yield missing.isEmpty() ? new ProjectPublishedEvent(actorId, refs.projectId(), occurredAt) : null;
            }
            case DEMO_VIEWED -> {
                require(refs.projectId(), "targetRefs.projectId", missing);
                require(refs.projectOwnerId(), "targetRefs.projectOwnerId", missing);
                requireIdentity(actorId, sessionToken, missing);
                yield missing.isEmpty()
                        ? new DemoViewedEvent(refs.projectId(), refs.projectOwnerId(),
                        new ParticipantIdentity(actorId, sessionToken), occurredAt)
                        : null;
            }
            case IDEA_SUBMITTED -> {
                require(actorId, "actorId", missing);
                require(refs.ideaId(), "targetRefs.ideaId", missing);
                yield missing.isEmpty()
                        ? new IdeaSubmittedEvent(actorId, refs.ideaId(), refs.projectId(), occurredAt)
                        : null;
            }
            case IDEA_REACTION_RECEIVED -> {
                require(refs.ideaId(), "targetRefs.ideaId", missing);
                require(refs.ideaOwnerId(), "targetRefs.ideaOwnerId", missing);
                requireIdentity(actorId, sessionToken, missing);
                yield missing.isEmpty()
                        ? new IdeaReactionReceivedEvent(refs.ideaId(), refs.ideaOwnerId(),
                        new ParticipantIdentity(actorId, sessionToken), occurredAt)
                        : null;
            }
            case REVIEW_RECEIVED -> {
                require(refs.reviewId(), "targetRefs.reviewId", missing);
                require(refs.projectId(), "targetRefs.projectId", missing);
                require(refs.projectOwnerId(), "targetRefs.projectOwnerId", missing);
                yield missing.isEmpty()
                        ? new ReviewReceivedEvent(refs.reviewId(), refs.projectId(), refs.projectOwnerId(),
                        actorId, occurredAt)
                        : null;
            }
            case IDENTITY_VISIBILITY_TOGGLED -> {
                require(actorId, "actorId", missing);
                require(request.identityPublic(), "identityPublic", missing);
                yield missing.isEmpty()
                        ? new IdentityVisibilityToggledEvent(actorId, request.identityPublic(), occurredAt)
                        : null;
            }
        };

        if (event == null) {
            throw XpEventRejectedException.malformedEvent(
                    type.name() + " event is missing " + String.join(", ", missing)
            );
        }
        return event;
    }

    private static void require(Object value, String field, List<String> missing) {
        if (value == null) {
            missing.add(field);
        }
    }

    private static void requireIdentity(UUID actorId, String sessionToken, List<String> missing) {
        if (actorId == null && sessionToken == null) {
            missing.add("actorId or dedupContext.sessionToken");
        }
    }

    private static String normalizeToken(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            return null;
        }
        return sessionToken.trim();
    }
}
