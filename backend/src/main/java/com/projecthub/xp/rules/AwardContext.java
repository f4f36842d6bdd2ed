package com.projecthub.xp.rules;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only ledger facts the rules need to pick between otherwise identical events.
 */
public interface AwardContext {

    /**
     * @return the project that earned the actor's first-project award, if it has been granted
     */
    Optional<UUID> firstProjectAwardedFor(UUID actorId);
}
