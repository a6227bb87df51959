package com.vaultengine.metrics;

import com.vaultengine.redemption.RedemptionService;
import com.vaultengine.support.VaultIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for share-price history and derived returns.
 */
class VaultMetricsServiceTest extends VaultIntegrationTest {

    private static final BigInteger THOUSAND_USDC = BigInteger.valueOf(1_000_000_000L);

    @Autowired
    private VaultMetricsService metricsService;

    @Autowired
    private RedemptionService redemptionService;

    @Test
    void testCaptureRecordsSharePriceInWholeUnits() {
        custody.credit("USDC", "alice", THOUSAND_USDC);
        redemptionService.deposit("USDC", THOUSAND_USDC, "alice", "alice");

        VaultMetric metric = metricsService.captureSnapshot();

        assertEquals(THOUSAND_USDC, metric.getTotalAssets());
        assertEquals(THOUSAND_USDC, metric.getTotalSupply());
        assertEquals(0, new BigDecimal("1").compareTo(metric.getSharePrice()));
        assertEquals(0, new BigDecimal("1000").compareTo(metric.getTvl()));
    }

    @Test
    void testPerformanceNeedsTwoSnapshots() {
        metricsService.captureSnapshot();

        assertTrue(metricsService.performance(Duration.ofDays(90)).isEmpty());
    }

    @Test
    void testPerformanceAnnualizesReturn() {
        custody.credit("USDC", "alice", THOUSAND_USDC);
        redemptionService.deposit("USDC", THOUSAND_USDC, "alice", "alice");
        metricsService.captureSnapshot();

        clock.advance(Duration.ofDays(30));
        custody.credit("USDC", "vault", BigInteger.valueOf(10_000_000));
        metricsService.captureSnapshot();

        Optional<PerformanceSummary> result = metricsService.performance(Duration.ofDays(90));

        assertTrue(result.isPresent());
        PerformanceSummary summary = result.get();
        assertEquals(2, summary.getSnapshotCount());
        assertEquals(0, new BigDecimal("1.009999").compareTo(summary.getEndSharePrice()));
        assertEquals(0.9999, summary.getTotalReturnPercent().doubleValue(), 1e-9);
        assertEquals(1.0, summary.getTvlChangePercent().doubleValue(), 1e-9);
        // 0.009999 / 30 * 365 * 100
        assertEquals(12.165450, summary.getApr().doubleValue(), 1e-6);
    }

    @Test
    void testHistoryLimitedToWindow() {
        metricsService.captureSnapshot();
        clock.advance(Duration.ofDays(10));
        metricsService.captureSnapshot();

        assertEquals(1, metricsService.history(Duration.ofDays(5)).size());
        assertEquals(2, metricsService.history(Duration.ofDays(30)).size());
    }
}
