package com.vaultengine.metrics;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Point-in-time record of vault size and share price.
 */
@Entity
@Table(name = "vault_metrics", indexes = {
    @Index(name = "idx_metric_captured_at", columnList = "captured_at")
})
@Data
@NoArgsConstructor
public class VaultMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "captured_at", nullable = false, updatable = false)
    private Instant capturedAt;

    /**
     * Raw total assets in underlying units.
     */
    @Column(name = "total_assets", nullable = false, precision = 78, scale = 0)
    private BigInteger totalAssets;

    @Column(name = "total_supply", nullable = false, precision = 78, scale = 0)
    private BigInteger totalSupply;

    /**
     * Total assets in whole underlying tokens.
     */
    @Column(name = "tvl", nullable = false, precision = 96, scale = 18)
    private BigDecimal tvl;

    /**
     * Whole underlying tokens per whole share.
     */
    @Column(name = "share_price", nullable = false, precision = 96, scale = 18)
    private BigDecimal sharePrice;

    public VaultMetric(Instant capturedAt, BigInteger totalAssets, BigInteger totalSupply,
                       BigDecimal tvl, BigDecimal sharePrice) {
        this.capturedAt = capturedAt;
        this.totalAssets = totalAssets;
        this.totalSupply = totalSupply;
        this.tvl = tvl;
        this.sharePrice = sharePrice;
    }
}
