package com.vaultengine.fees;

import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.journal.RedemptionEventType;
import com.vaultengine.providers.ShareToken;
import com.vaultengine.redemption.RedemptionService;
import com.vaultengine.support.TestClockConfig;
import com.vaultengine.support.VaultIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigInteger;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for fee bootstrap, settlement and rate changes.
 */
class FeeServiceTest extends VaultIntegrationTest {

    private static final String USDC = "USDC";
    private static final String FEE_RECIPIENT = "fee-recipient";
    private static final BigInteger THOUSAND_USDC = BigInteger.valueOf(1_000_000_000L);

    @Autowired
    private FeeService feeService;

    @Autowired
    private RedemptionService redemptionService;

    @Autowired
    private ShareToken shareToken;

    @Test
    void testBootstrapFromConfiguredDefaults() {
        Fees fees = feeService.getFees();

        assertEquals(0, fees.getPerformanceFeeRate());
        assertEquals(0, fees.getManagementFeeRate());
        assertEquals(0, fees.getWithdrawalFeeRate());
        assertEquals(TestClockConfig.START.getEpochSecond(), fees.getLastUpdateTimestamp());
        // empty vault: (0 + 1) * 1e6 / (0 + 1)
        assertEquals(BigInteger.valueOf(1_000_000), fees.getHighWaterMark());
    }

    @Test
    void testManagementFeeMintedAfterOneYear() {
        deposit("alice", THOUSAND_USDC);
        feeService.updateFees(new FeeRates(0, 200, 0), "fee-manager");

        clock.advance(Duration.ofDays(365));
        FeeSettlement settlement = feeService.settleFees();

        assertEquals(BigInteger.valueOf(20_000_000), settlement.getManagementFee());
        assertEquals(BigInteger.valueOf(20_000_000), shareToken.balanceOf(FEE_RECIPIENT));
        assertEquals(clock.instant().getEpochSecond(), feeService.getFees().getLastUpdateTimestamp());
        assertEquals(1, eventRepository.findByEventType(RedemptionEventType.FEE_SETTLEMENT).size());
    }

    @Test
    void testNewManagementRateNotChargedForPastPeriod() {
        deposit("alice", THOUSAND_USDC);
        clock.advance(Duration.ofDays(365));

        feeService.updateFees(new FeeRates(0, 200, 0), "fee-manager");
        FeeSettlement settlement = feeService.settleFees();

        assertEquals(BigInteger.ZERO, settlement.getManagementFee());
        assertEquals(BigInteger.ZERO, shareToken.balanceOf(FEE_RECIPIENT));
        assertEquals(clock.instant().getEpochSecond(), feeService.getFees().getLastUpdateTimestamp());

        clock.advance(Duration.ofDays(365));
        assertEquals(BigInteger.valueOf(20_000_000), feeService.settleFees().getManagementFee());
    }

    @Test
    void testFeeConfigStampedWithClock() {
        feeService.getFees();
        assertEquals(TestClockConfig.START, feeConfigRepository.findById(FeeConfig.SINGLETON_ID).orElseThrow().getUpdatedAt());

        clock.advance(Duration.ofHours(1));
        feeService.updateFees(new FeeRates(0, 0, 10), "fee-manager");

        assertEquals(TestClockConfig.START.plus(Duration.ofHours(1)),
            feeConfigRepository.findById(FeeConfig.SINGLETON_ID).orElseThrow().getUpdatedAt());
    }

    @Test
    void testPerformanceFeeChargedOnceAboveHighWaterMark() {
        deposit("alice", THOUSAND_USDC);
        feeService.updateFees(new FeeRates(1000, 0, 0), "fee-manager");
        // 10% yield
        custody.credit(USDC, "vault", BigInteger.valueOf(100_000_000));

        FeeSettlement first = feeService.settleFees();

        assertEquals(BigInteger.valueOf(9_999_900), first.getPerformanceFee());
        assertEquals(BigInteger.valueOf(9_090_818), first.getFeeShares());
        assertEquals(BigInteger.valueOf(1_099_999), feeService.getFees().getHighWaterMark());

        FeeSettlement second = feeService.settleFees();
        assertEquals(BigInteger.ZERO, second.totalFee());
        assertEquals(BigInteger.valueOf(9_090_818), shareToken.balanceOf(FEE_RECIPIENT));
    }

    @Test
    void testFeesSettledBeforeDeposit() {
        deposit("alice", THOUSAND_USDC);
        feeService.updateFees(new FeeRates(0, 200, 0), "fee-manager");
        clock.advance(Duration.ofDays(365));

        deposit("bob", THOUSAND_USDC);

        assertEquals(BigInteger.valueOf(20_000_000), shareToken.balanceOf(FEE_RECIPIENT));
    }

    @Test
    void testUpdateRequiresFeeManager() {
        VaultException e = assertThrows(VaultException.class, () ->
            feeService.updateFees(new FeeRates(100, 100, 100), "alice"));

        assertEquals(VaultErrorCode.UNAUTHORIZED, e.getCode());
        assertEquals(0, feeService.getFees().getWithdrawalFeeRate());
    }

    @Test
    void testUpdateRejectsRatesAboveCeilings() {
        VaultException e = assertThrows(VaultException.class, () ->
            feeService.updateFees(new FeeRates(0, 0, 501), "fee-manager"));

        assertEquals(VaultErrorCode.INVALID_FEES, e.getCode());
        assertEquals(0, feeService.getFees().getWithdrawalFeeRate());
        assertTrue(eventRepository.findByEventType(RedemptionEventType.FEE_UPDATE).isEmpty());
    }

    @Test
    void testUpdateAppliesNewRates() {
        Fees updated = feeService.updateFees(new FeeRates(2000, 100, 50), "fee-manager");

        assertEquals(2000, updated.getPerformanceFeeRate());
        assertEquals(100, feeService.getFees().getManagementFeeRate());
        assertEquals(50, feeService.getFees().getWithdrawalFeeRate());
        assertEquals(1, eventRepository.findByEventType(RedemptionEventType.FEE_UPDATE).size());
    }

    private void deposit(String account, BigInteger amount) {
        custody.credit(USDC, account, amount);
        redemptionService.deposit(USDC, amount, account, account);
    }
}
