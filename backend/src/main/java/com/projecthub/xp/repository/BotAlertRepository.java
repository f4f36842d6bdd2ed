package com.projecthub.xp.repository;

import com.projecthub.xp.model.BotAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BotAlertRepository extends JpaRepository<BotAlert, UUID> {

    List<BotAlert> findByReviewedFalseOrderByCreatedAtAsc();

    List<BotAlert> findByActorIdOrderByCreatedAtDesc(UUID actorId);

    long countByActorId(UUID actorId);
}
