package com.vaultengine.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Shares escrowed for a future fulfillment, not yet priced.
 *
 * One fungible slot per (account, asset): repeated requests accumulate into it.
 * {@code shares} is bounded to 128 bits; {@code requestTime} is epoch seconds of
 * the latest increase and returns to zero once the shares are fully consumed.
 */
@Entity
@Table(name = "pending_redeems", indexes = {
    @Index(name = "idx_pending_asset", columnList = "asset")
})
@Data
@NoArgsConstructor
public class PendingRedeem {

    @EmbeddedId
    private RedeemKey id;

    @Column(nullable = false, precision = 39, scale = 0)
    private BigInteger shares;

    @Column(name = "request_time", nullable = false)
    private long requestTime;

    public PendingRedeem(RedeemKey id) {
        this.id = id;
        this.shares = BigInteger.ZERO;
        this.requestTime = 0L;
    }
}
