package com.projecthub.xp.repository;

import com.projecthub.xp.model.ActorActivity;
import com.projecthub.xp.model.ActorActivityType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ActorActivityRepository extends JpaRepository<ActorActivity, UUID> {

    boolean existsByActorIdAndActivityTypeAndSubjectId(UUID actorId, ActorActivityType activityType, UUID subjectId);

    Optional<ActorActivity> findFirstByActorIdAndActivityTypeAndOccurredAtLessThanEqualOrderByOccurredAtDesc(
            UUID actorId,
            ActorActivityType activityType,
            OffsetDateTime until
    );

    long countByActorIdAndActivityTypeAndOccurredAtLessThanEqual(
            UUID actorId,
            ActorActivityType activityType,
            OffsetDateTime until
    );

    List<ActorActivity> findByActorIdAndActivityTypeAndOccurredAtAfterOrderByOccurredAtAsc(
            UUID actorId,
            ActorActivityType activityType,
            OffsetDateTime after
    );

    @Query("""
            select a.subjectId from ActorActivity a
            where a.actorId = :actorId and a.activityType = :activityType
            order by a.occurredAt asc
            """)
    List<UUID> findSubjectIds(
            @Param("actorId") UUID actorId,
            @Param("activityType") ActorActivityType activityType
    );
}
