package com.vaultengine.metrics;

import com.vaultengine.conversion.ConversionEngine;
import com.vaultengine.conversion.Totals;
import com.vaultengine.conversion.VaultTotals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Records share-price history and derives returns from it.
 *
 * Observation only: capturing a snapshot never settles fees or changes vault state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultMetricsService {

    private static final int PRICE_SCALE = 18;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(86_400);
    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);

    private final VaultMetricRepository metricRepository;
    private final VaultTotals vaultTotals;
    private final ConversionEngine conversionEngine;
    private final Clock clock;

    @Transactional
    public VaultMetric captureSnapshot() {
        Totals totals = vaultTotals.snapshot();
        int decimals = conversionEngine.getUnderlyingDecimals();

        BigDecimal tvl = new BigDecimal(totals.getTotalAssets(), decimals).setScale(PRICE_SCALE, RoundingMode.DOWN);
        BigDecimal sharePrice = new BigDecimal(totals.getShareValue(), decimals).setScale(PRICE_SCALE, RoundingMode.DOWN);

        VaultMetric metric = metricRepository.save(new VaultMetric(
            clock.instant(), totals.getTotalAssets(), totals.getTotalSupply(), tvl, sharePrice));

        log.info("Captured vault metric: tvl={}, sharePrice={}, supply={}",
            tvl, sharePrice, totals.getTotalSupply());
        return metric;
    }

    /**
     * Performance over the trailing {@code window}. Empty when fewer than two snapshots fall in it.
     */
    @Transactional(readOnly = true)
    public Optional<PerformanceSummary> performance(Duration window) {
        Instant since = clock.instant().minus(window);
        List<VaultMetric> metrics = metricRepository.findByCapturedAtGreaterThanEqualOrderByCapturedAtAsc(since);
        if (metrics.size() < 2) {
            return Optional.empty();
        }

        VaultMetric first = metrics.get(0);
        VaultMetric last = metrics.get(metrics.size() - 1);

        BigDecimal totalReturn = relativeChange(first.getSharePrice(), last.getSharePrice());
        BigDecimal days = BigDecimal.valueOf(Duration.between(first.getCapturedAt(), last.getCapturedAt()).getSeconds())
            .divide(SECONDS_PER_DAY, MathContext.DECIMAL64);
        BigDecimal apr = days.signum() == 0 ? null
            : totalReturn.divide(days, MathContext.DECIMAL64).multiply(DAYS_PER_YEAR).multiply(HUNDRED);

        return Optional.of(PerformanceSummary.builder()
            .from(first.getCapturedAt())
            .to(last.getCapturedAt())
            .snapshotCount(metrics.size())
            .startSharePrice(first.getSharePrice())
            .endSharePrice(last.getSharePrice())
            .totalReturnPercent(totalReturn.multiply(HUNDRED))
            .tvlChangePercent(first.getTvl().signum() == 0 ? null
                : relativeChange(first.getTvl(), last.getTvl()).multiply(HUNDRED))
            .apr(apr)
            .build());
    }

    @Transactional(readOnly = true)
    public List<VaultMetric> history(Duration window) {
        return metricRepository.findByCapturedAtGreaterThanEqualOrderByCapturedAtAsc(clock.instant().minus(window));
    }

    private static BigDecimal relativeChange(BigDecimal start, BigDecimal end) {
        if (start.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return end.subtract(start).divide(start, MathContext.DECIMAL64);
    }
}
