package com.vaultengine.fees;

import com.vaultengine.common.Rounding;
import com.vaultengine.common.UintMath;
import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.conversion.ConversionEngine;
import com.vaultengine.conversion.Totals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Management and performance fee arithmetic.
 *
 * Pure: takes a {@link Fees} value and a {@link Totals} snapshot, returns amounts
 * and the next fee state. Management fee accrues linearly on total assets.
 * Performance fee is charged on the whole supply's gain above one global
 * high-water mark.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeeAccrualEngine {

    public static final int MAX_BPS = 10_000;
    public static final long SECONDS_PER_YEAR = 365L * 24 * 60 * 60;

    public static final int MAX_PERFORMANCE_FEE = 5_000;
    public static final int MAX_MANAGEMENT_FEE = 1_000;
    public static final int MAX_WITHDRAWAL_FEE = 500;

    private static final BigInteger BPS = BigInteger.valueOf(MAX_BPS);

    private final ConversionEngine conversionEngine;

    /**
     * {@code managementFeeRate * totalAssets * elapsed / SECONDS_PER_YEAR / MAX_BPS}, rounded down.
     */
    public BigInteger accruedManagementFee(Fees fees, Totals totals, long now) {
        if (fees.getManagementFeeRate() == 0) {
            return BigInteger.ZERO;
        }
        long elapsed = Math.max(0L, now - fees.getLastUpdateTimestamp());
        BigInteger numerator = BigInteger.valueOf(fees.getManagementFeeRate()).multiply(totals.getTotalAssets());
        return UintMath.mulDiv(numerator, BigInteger.valueOf(elapsed),
            BigInteger.valueOf(SECONDS_PER_YEAR).multiply(BPS), Rounding.DOWN);
    }

    /**
     * {@code performanceFeeRate * (shareValue - highWaterMark) * totalSupply / (MAX_BPS * oneShareUnit)},
     * rounded down; zero unless the share value is above the high-water mark.
     */
    public BigInteger accruedPerformanceFee(Fees fees, Totals totals) {
        if (fees.getPerformanceFeeRate() == 0 || totals.getShareValue().compareTo(fees.getHighWaterMark()) <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger gain = totals.getShareValue().subtract(fees.getHighWaterMark());
        BigInteger numerator = BigInteger.valueOf(fees.getPerformanceFeeRate()).multiply(gain);
        return UintMath.mulDiv(numerator, totals.getTotalSupply(),
            BPS.multiply(conversionEngine.getOneShareUnit()), Rounding.DOWN);
    }

    /**
     * Compute both fees and the next fee state. The high-water mark always moves up to the
     * current share value; the timestamp only advances when a nonzero fee was charged.
     */
    public FeeSettlement settle(Fees fees, Totals totals, long now) {
        BigInteger managementFee = accruedManagementFee(fees, totals, now);
        BigInteger performanceFee = accruedPerformanceFee(fees, totals);
        BigInteger totalFee = managementFee.add(performanceFee);

        Fees.FeesBuilder next = fees.toBuilder()
            .highWaterMark(fees.getHighWaterMark().max(totals.getShareValue()));
        if (totalFee.signum() > 0) {
            next.lastUpdateTimestamp(now);
        }

        BigInteger feeShares = conversionEngine.underlyingToShares(totalFee, totals);
        log.debug("Fee settlement: management={}, performance={}, feeShares={}",
            managementFee, performanceFee, feeShares);
        return new FeeSettlement(managementFee, performanceFee, feeShares, next.build());
    }

    /**
     * Withdrawal fee on a fulfilled amount, rounded up.
     */
    public BigInteger withdrawalFee(BigInteger assets, Fees fees) {
        if (fees.getWithdrawalFeeRate() == 0) {
            return BigInteger.ZERO;
        }
        return UintMath.mulDiv(assets, BigInteger.valueOf(fees.getWithdrawalFeeRate()), BPS, Rounding.UP);
    }

    /**
     * @throws VaultException with INVALID_FEES if any rate is negative or above its ceiling
     */
    public void validate(FeeRates rates) {
        checkRate("performance", rates.getPerformanceFeeRate(), MAX_PERFORMANCE_FEE);
        checkRate("management", rates.getManagementFeeRate(), MAX_MANAGEMENT_FEE);
        checkRate("withdrawal", rates.getWithdrawalFeeRate(), MAX_WITHDRAWAL_FEE);
    }

    private void checkRate(String name, int rate, int ceiling) {
        if (rate < 0 || rate > ceiling) {
            throw new VaultException(VaultErrorCode.INVALID_FEES,
                String.format("%s fee rate %d outside [0, %d]", name, rate, ceiling));
        }
    }
}
