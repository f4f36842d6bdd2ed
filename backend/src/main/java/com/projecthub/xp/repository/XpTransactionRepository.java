package com.projecthub.xp.repository;

import com.projecthub.xp.model.XpReason;
import com.projecthub.xp.model.XpTransaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface XpTransactionRepository extends JpaRepository<XpTransaction, UUID> {

    boolean existsByReasonAndDedupKey(XpReason reason, String dedupKey);

    Optional<XpTransaction> findByReasonAndDedupKey(XpReason reason, String dedupKey);

    Optional<XpTransaction> findFirstByActorIdAndReason(UUID actorId, XpReason reason);

    List<XpTransaction> findByActorIdOrderByCreatedAtDesc(UUID actorId, Pageable pageable);

    List<XpTransaction> findByActorIdOrderByCreatedAtAsc(UUID actorId);

    @Query("select coalesce(sum(t.amount), 0) from XpTransaction t where t.actorId = :actorId")
    Long sumAmountByActorId(@Param("actorId") UUID actorId);

    @Query("""
            select count(t) from XpTransaction t
            where t.actorId = :actorId and t.reviewId = :reviewId and t.reason = :reason and t.amount > 0
            """)
    long countGrantsForReview(
            @Param("actorId") UUID actorId,
            @Param("reviewId") UUID reviewId,
            @Param("reason") XpReason reason
    );

    @Query("""
            select coalesce(sum(t.amount), 0) from XpTransaction t
            where t.actorId = :actorId and t.reviewId = :reviewId and t.reason = :reason
            """)
    Long sumForReview(
            @Param("actorId") UUID actorId,
            @Param("reviewId") UUID reviewId,
            @Param("reason") XpReason reason
    );
}
