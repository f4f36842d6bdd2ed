package com.projecthub.xp.repository;

import java.util.UUID;

public interface ActorLedgerTotalRow {

    UUID getActorId();

    Integer getTotalXp();

    Integer getXpLevel();

    Long getLedgerTotal();
}
