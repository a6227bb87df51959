package com.vaultengine.journal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable journal entry for one vault state change.
 *
 * Entries are append-only and written in the same transaction as the change they
 * describe, so a rolled-back operation leaves no entry behind.
 */
@Entity
@Table(name = "redemption_events", indexes = {
    @Index(name = "idx_event_account_id", columnList = "account_id"),
    @Index(name = "idx_event_asset", columnList = "asset"),
    @Index(name = "idx_event_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class RedemptionEvent {

    @Id
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private RedemptionEventType eventType;

    /**
     * The controller (or depositor) the change belongs to.
     */
    @Column(name = "account_id")
    private String accountId;

    /**
     * Owner, receiver or fee recipient, depending on the event type.
     */
    private String counterparty;

    private String asset;

    @Column(precision = 78, scale = 0)
    private BigInteger shares;

    @Column(precision = 78, scale = 0)
    private BigInteger assets;

    @Column(precision = 78, scale = 0)
    private BigInteger fee;

    /**
     * The account that invoked the operation.
     */
    private String caller;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public RedemptionEvent(RedemptionEventType eventType, String accountId, String counterparty,
                           String asset, BigInteger shares, BigInteger assets, BigInteger fee,
                           String caller) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.accountId = accountId;
        this.counterparty = counterparty;
        this.asset = asset;
        this.shares = shares;
        this.assets = assets;
        this.fee = fee;
        this.caller = caller;
        this.createdAt = Instant.now();
    }
}
