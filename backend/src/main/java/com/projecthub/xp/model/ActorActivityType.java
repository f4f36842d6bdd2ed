package com.projecthub.xp.model;

public enum ActorActivityType {
    PROJECT_PUBLISHED,
    IDEA_SUBMITTED,
    REVIEW_AUTHORED
}
