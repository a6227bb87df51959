package com.vaultengine.metrics;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Vault performance between the first and last snapshot of a window.
 */
@Value
@Builder
public class PerformanceSummary {

    Instant from;
    Instant to;
    int snapshotCount;

    BigDecimal startSharePrice;
    BigDecimal endSharePrice;

    /**
     * Share price change over the window, in percent.
     */
    BigDecimal totalReturnPercent;

    /**
     * TVL change over the window, in percent; {@code null} when the window starts empty.
     */
    BigDecimal tvlChangePercent;

    /**
     * Total return scaled linearly to a year, in percent; {@code null} for a zero-length window.
     */
    BigDecimal apr;
}
