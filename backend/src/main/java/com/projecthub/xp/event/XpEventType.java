package com.projecthub.xp.event;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum XpEventType {
    PROJECT_PUBLISHED,
    DEMO_VIEWED,
    IDEA_SUBMITTED,
    IDEA_REACTION_RECEIVED,
    REVIEW_RECEIVED,
    IDENTITY_VISIBILITY_TOGGLED;

    public static Optional<XpEventType> fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            return Optional.empty();
        }
        String normalized = wireName.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst();
    }
}
