package com.projecthub.xp.repository;

import com.projecthub.xp.model.Actor;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ActorRepository extends JpaRepository<Actor, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Actor a where a.actorId = :actorId")
    Optional<Actor> findByActorIdForUpdate(@Param("actorId") UUID actorId);

    boolean existsByFirstHundredTrue();

    @Query(value = """
            SELECT actor.actor_id
            FROM xp_actors actor
            ORDER BY actor.joined_at ASC, actor.actor_id ASC
            LIMIT :limit
            """, nativeQuery = true)
    List<UUID> findEarliestJoinedActorIds(@Param("limit") int limit);

    @Modifying
    @Query("update Actor a set a.firstHundred = true where a.actorId in :actorIds")
    int markFirstHundred(@Param("actorIds") Collection<UUID> actorIds);

    @Query(value = """
            SELECT
                actor.actor_id AS actorId,
                actor.total_xp AS totalXp,
                actor.xp_level AS xpLevel,
                COALESCE(ledger.ledger_total, 0) AS ledgerTotal
            FROM xp_actors actor
            LEFT JOIN (
                SELECT tx.actor_id, SUM(tx.amount) AS ledger_total
                FROM xp_transactions tx
                GROUP BY tx.actor_id
            ) ledger ON ledger.actor_id = actor.actor_id
            ORDER BY actor.actor_id ASC
            """, nativeQuery = true)
    List<ActorLedgerTotalRow> findAllWithLedgerTotals();
}
