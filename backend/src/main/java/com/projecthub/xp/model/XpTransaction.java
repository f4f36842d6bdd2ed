package com.projecthub.xp.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Immutable ledger row. Revocations are appended as negative amounts; rows are never updated or deleted.
 */
@Getter
@Setter
@Entity
@Table(name = "xp_transactions")
public class XpTransaction {

    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "actor_id", nullable = false, updatable = false)
    private UUID actorId;

    @Column(name = "amount", nullable = false, updatable = false)
    private Integer amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, updatable = false, length = 32)
    private XpReason reason;

    @Column(name = "project_id", updatable = false)
    private UUID projectId;

    @Column(name = "idea_id", updatable = false)
    private UUID ideaId;

    @Column(name = "review_id", updatable = false)
    private UUID reviewId;

    @Column(name = "dedup_key", nullable = false, updatable = false, length = 255)
    private String dedupKey;

    @Column(name = "retroactive", nullable = false, updatable = false)
    private Boolean retroactive = false;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
