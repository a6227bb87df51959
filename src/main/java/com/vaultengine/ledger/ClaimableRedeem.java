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
 * Fulfilled redemption awaiting withdrawal.
 *
 * The (assets, shares) pair fixes the exchange ratio at fulfillment time; partial
 * consumption keeps that ratio. Both fields are bounded to 128 bits. A record with
 * both fields at zero is equivalent to no record.
 */
@Entity
@Table(name = "claimable_redeems", indexes = {
    @Index(name = "idx_claimable_asset", columnList = "asset")
})
@Data
@NoArgsConstructor
public class ClaimableRedeem {

    @EmbeddedId
    private RedeemKey id;

    @Column(nullable = false, precision = 39, scale = 0)
    private BigInteger assets;

    @Column(nullable = false, precision = 39, scale = 0)
    private BigInteger shares;

    public ClaimableRedeem(RedeemKey id) {
        this.id = id;
        this.assets = BigInteger.ZERO;
        this.shares = BigInteger.ZERO;
    }
}
