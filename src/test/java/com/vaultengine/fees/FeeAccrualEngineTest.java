package com.vaultengine.fees;

import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.conversion.ConversionEngine;
import com.vaultengine.conversion.Totals;
import com.vaultengine.providers.RateProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for management, performance and withdrawal fee arithmetic.
 */
class FeeAccrualEngineTest {

    private static final BigInteger THOUSAND_USDC = BigInteger.valueOf(1_000_000_000L);
    private static final long T0 = 1_700_000_000L;

    private ConversionEngine conversionEngine;
    private FeeAccrualEngine engine;

    @BeforeEach
    void setUp() {
        conversionEngine = new ConversionEngine(mock(RateProvider.class), "USDC", 6, 0);
        engine = new FeeAccrualEngine(conversionEngine);
    }

    @Test
    void testManagementFeeAccruesLinearly() {
        Fees fees = fees(0, 200, 0, BigInteger.valueOf(1_000_000));
        Totals totals = conversionEngine.snapshot(THOUSAND_USDC, THOUSAND_USDC);

        // 2% of 1000 USDC over a full year
        assertEquals(BigInteger.valueOf(20_000_000),
            engine.accruedManagementFee(fees, totals, T0 + FeeAccrualEngine.SECONDS_PER_YEAR));
        assertEquals(BigInteger.valueOf(10_000_000),
            engine.accruedManagementFee(fees, totals, T0 + FeeAccrualEngine.SECONDS_PER_YEAR / 2));
        assertEquals(BigInteger.ZERO, engine.accruedManagementFee(fees, totals, T0));
    }

    @Test
    void testPerformanceFeeOnlyAboveHighWaterMark() {
        Totals totals = conversionEngine.snapshot(THOUSAND_USDC, THOUSAND_USDC);
        assertEquals(BigInteger.valueOf(1_000_000), totals.getShareValue());

        // 20% of a 0.1 USDC gain per share on 1000 shares
        Fees belowValue = fees(2000, 0, 0, BigInteger.valueOf(900_000));
        assertEquals(BigInteger.valueOf(20_000_000), engine.accruedPerformanceFee(belowValue, totals));

        Fees atValue = fees(2000, 0, 0, BigInteger.valueOf(1_000_000));
        assertEquals(BigInteger.ZERO, engine.accruedPerformanceFee(atValue, totals));

        Fees aboveValue = fees(2000, 0, 0, BigInteger.valueOf(1_100_000));
        assertEquals(BigInteger.ZERO, engine.accruedPerformanceFee(aboveValue, totals));
    }

    @Test
    void testSettleReportsFeeSharesAndAdvancesState() {
        Fees fees = fees(2000, 0, 0, BigInteger.valueOf(900_000));
        Totals totals = conversionEngine.snapshot(THOUSAND_USDC, THOUSAND_USDC);

        FeeSettlement settlement = engine.settle(fees, totals, T0 + 3600);

        assertEquals(BigInteger.valueOf(20_000_000), settlement.getPerformanceFee());
        assertEquals(BigInteger.ZERO, settlement.getManagementFee());
        assertEquals(BigInteger.valueOf(20_000_000), settlement.getFeeShares());
        assertEquals(BigInteger.valueOf(1_000_000), settlement.getUpdatedFees().getHighWaterMark());
        assertEquals(T0 + 3600, settlement.getUpdatedFees().getLastUpdateTimestamp());
    }

    @Test
    void testSettleWithoutFeeKeepsTimestampButRaisesHighWaterMark() {
        Fees fees = fees(0, 0, 0, BigInteger.valueOf(900_000));
        Totals totals = conversionEngine.snapshot(THOUSAND_USDC, THOUSAND_USDC);

        FeeSettlement settlement = engine.settle(fees, totals, T0 + 3600);

        assertEquals(BigInteger.ZERO, settlement.totalFee());
        assertEquals(BigInteger.ZERO, settlement.getFeeShares());
        assertEquals(T0, settlement.getUpdatedFees().getLastUpdateTimestamp());
        assertEquals(BigInteger.valueOf(1_000_000), settlement.getUpdatedFees().getHighWaterMark());
    }

    @Test
    void testHighWaterMarkNeverDecreases() {
        Fees fees = fees(2000, 0, 0, BigInteger.valueOf(1_500_000));
        Totals lowerValue = conversionEngine.snapshot(THOUSAND_USDC, THOUSAND_USDC);

        FeeSettlement settlement = engine.settle(fees, lowerValue, T0 + 60);

        assertEquals(BigInteger.valueOf(1_500_000), settlement.getUpdatedFees().getHighWaterMark());
        assertEquals(BigInteger.ZERO, settlement.totalFee());
    }

    @Test
    void testWithdrawalFeeRoundsUp() {
        Fees fees = fees(0, 0, 100, BigInteger.ZERO);

        assertEquals(BigInteger.ONE, engine.withdrawalFee(BigInteger.valueOf(100), fees));
        // 1% of 101 is 1.01
        assertEquals(BigInteger.TWO, engine.withdrawalFee(BigInteger.valueOf(101), fees));
        assertEquals(BigInteger.ONE, engine.withdrawalFee(BigInteger.ONE, fees));
        assertEquals(BigInteger.ZERO, engine.withdrawalFee(BigInteger.ZERO, fees));
    }

    @Test
    void testValidateRejectsRatesAboveCeilings() {
        engine.validate(new FeeRates(5000, 1000, 500));

        assertEquals(VaultErrorCode.INVALID_FEES, assertThrows(VaultException.class, () ->
            engine.validate(new FeeRates(5001, 0, 0))).getCode());
        assertEquals(VaultErrorCode.INVALID_FEES, assertThrows(VaultException.class, () ->
            engine.validate(new FeeRates(0, 1001, 0))).getCode());
        assertEquals(VaultErrorCode.INVALID_FEES, assertThrows(VaultException.class, () ->
            engine.validate(new FeeRates(0, 0, 501))).getCode());
        assertEquals(VaultErrorCode.INVALID_FEES, assertThrows(VaultException.class, () ->
            engine.validate(new FeeRates(-1, 0, 0))).getCode());
    }

    private static Fees fees(int performance, int management, int withdrawal, BigInteger highWaterMark) {
        return Fees.builder()
            .performanceFeeRate(performance)
            .managementFeeRate(management)
            .withdrawalFeeRate(withdrawal)
            .lastUpdateTimestamp(T0)
            .highWaterMark(highWaterMark)
            .build();
    }
}
