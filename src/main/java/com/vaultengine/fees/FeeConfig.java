package com.vaultengine.fees;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Persisted fee configuration. A single row exists per vault.
 */
@Entity
@Table(name = "fee_config")
@Data
@NoArgsConstructor
public class FeeConfig {

    public static final String SINGLETON_ID = "vault";

    @Id
    private String id;

    @Column(name = "performance_fee_rate", nullable = false)
    private int performanceFeeRate;

    @Column(name = "management_fee_rate", nullable = false)
    private int managementFeeRate;

    @Column(name = "withdrawal_fee_rate", nullable = false)
    private int withdrawalFeeRate;

    @Column(name = "last_update_timestamp", nullable = false)
    private long lastUpdateTimestamp;

    @Column(name = "high_water_mark", nullable = false, precision = 78, scale = 0)
    private BigInteger highWaterMark;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public FeeConfig(Fees fees, Instant now) {
        this.id = SINGLETON_ID;
        apply(fees, now);
    }

    public Fees toFees() {
        return Fees.builder()
            .performanceFeeRate(performanceFeeRate)
            .managementFeeRate(managementFeeRate)
            .withdrawalFeeRate(withdrawalFeeRate)
            .lastUpdateTimestamp(lastUpdateTimestamp)
            .highWaterMark(highWaterMark)
            .build();
    }

    public void apply(Fees fees, Instant now) {
        this.performanceFeeRate = fees.getPerformanceFeeRate();
        this.managementFeeRate = fees.getManagementFeeRate();
        this.withdrawalFeeRate = fees.getWithdrawalFeeRate();
        this.lastUpdateTimestamp = fees.getLastUpdateTimestamp();
        this.highWaterMark = fees.getHighWaterMark();
        this.updatedAt = now;
    }
}
