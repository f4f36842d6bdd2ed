package com.projecthub.xp.repository;

import java.util.UUID;

public interface LeaderboardRow {

    UUID getActorId();

    Integer getLeaderboardRank();

    Boolean getTopHundred();

    Integer getTotalXp();

    Integer getXpLevel();

    Boolean getFirstHundred();
}
