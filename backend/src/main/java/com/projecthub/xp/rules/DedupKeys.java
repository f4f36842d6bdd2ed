package com.projecthub.xp.rules;

import com.projecthub.xp.event.ParticipantIdentity;

import java.util.UUID;

/**
 * Dedup key formats. A key is unique together with its reason, so each format scopes one at-most-once rule.
 */
public final class DedupKeys {

    static final String REVOKE_SUFFIX = "-revoke";

    private DedupKeys() {
    }

    public static String firstProject(UUID publisherId) {
        return "first-project:" + publisherId;
    }

    public static String additionalProject(UUID projectId) {
        return "project:" + projectId;
    }

    public static String demoView(UUID projectId, ParticipantIdentity viewer) {
        return "demo-view:" + projectId + ":" + viewer.dedupToken();
    }

    public static String ideaSubmitted(UUID ideaId) {
        return "idea:" + ideaId;
    }

    public static String ideaReaction(UUID ideaId, ParticipantIdentity reactor) {
        return "idea-reaction:" + ideaId + ":" + reactor.dedupToken();
    }

    public static String reviewReceived(UUID reviewId) {
        return "review-received:" + reviewId;
    }

    public static String publicReviewBonusGrant(UUID reviewId, UUID reviewerId, int generation) {
        return "public-review-bonus:" + reviewId + ":" + reviewerId + "#" + generation;
    }

    public static String revokeOf(String grantKey) {
        return grantKey + REVOKE_SUFFIX;
    }
}
