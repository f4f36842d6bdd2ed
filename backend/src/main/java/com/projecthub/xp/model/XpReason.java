package com.projecthub.xp.model;

public enum XpReason {
    FIRST_PROJECT,
    ADDITIONAL_PROJECT,
    DEMO_VIEW,
    IDEA_SUBMITTED,
    IDEA_REACTION,
    REVIEW_RECEIVED,
    PUBLIC_REVIEW_BONUS
}
