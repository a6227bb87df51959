package com.vaultengine.fees;

import com.vaultengine.common.OperationGuard;
import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.conversion.Totals;
import com.vaultengine.conversion.VaultTotals;
import com.vaultengine.journal.RedemptionJournal;
import com.vaultengine.providers.AccessGate;
import com.vaultengine.providers.ShareToken;
import com.vaultengine.providers.VaultRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Owns the vault's fee state: bootstrap, settlement with fee-share minting,
 * and rate changes.
 */
@Service
@Slf4j
public class FeeService {

    private final FeeConfigRepository feeConfigRepository;
    private final FeeAccrualEngine feeAccrualEngine;
    private final VaultTotals vaultTotals;
    private final ShareToken shareToken;
    private final AccessGate accessGate;
    private final RedemptionJournal journal;
    private final OperationGuard operationGuard;
    private final Clock clock;
    private final String feeRecipient;
    private final FeeRates defaultRates;

    public FeeService(FeeConfigRepository feeConfigRepository,
                      FeeAccrualEngine feeAccrualEngine,
                      VaultTotals vaultTotals,
                      ShareToken shareToken,
                      AccessGate accessGate,
                      RedemptionJournal journal,
                      OperationGuard operationGuard,
                      Clock clock,
                      @Value("${vault-engine.fee-recipient:fee-recipient}") String feeRecipient,
                      @Value("${vault-engine.fees.performance-rate:0}") int performanceRate,
                      @Value("${vault-engine.fees.management-rate:0}") int managementRate,
                      @Value("${vault-engine.fees.withdrawal-rate:0}") int withdrawalRate) {
        this.feeConfigRepository = feeConfigRepository;
        this.feeAccrualEngine = feeAccrualEngine;
        this.vaultTotals = vaultTotals;
        this.shareToken = shareToken;
        this.accessGate = accessGate;
        this.journal = journal;
        this.operationGuard = operationGuard;
        this.clock = clock;
        this.feeRecipient = feeRecipient;
        this.defaultRates = new FeeRates(performanceRate, managementRate, withdrawalRate);
        feeAccrualEngine.validate(defaultRates);
    }

    @Transactional
    public Fees getFees() {
        return loadConfig().toFees();
    }

    /**
     * Settle accrued fees as a standalone operation.
     */
    public FeeSettlement settleFees() {
        return operationGuard.execute("settleFees", this::accrueAndMint);
    }

    /**
     * Settle accrued fees and mint the fee shares, inside the caller's operation.
     * Invoked before every change to total supply or total assets.
     */
    @Transactional
    public FeeSettlement accrueAndMint() {
        FeeConfig config = loadConfig();
        Totals totals = vaultTotals.snapshot();
        Instant now = clock.instant();
        FeeSettlement settlement = feeAccrualEngine.settle(config.toFees(), totals, now.getEpochSecond());

        config.apply(settlement.getUpdatedFees(), now);
        feeConfigRepository.save(config);

        if (settlement.getFeeShares().signum() > 0) {
            shareToken.mint(feeRecipient, settlement.getFeeShares());
            journal.recordFeeSettlement(feeRecipient, settlement.getFeeShares(), settlement.totalFee());
            log.info("Settled fees: management={}, performance={}, minted {} shares to {}",
                settlement.getManagementFee(), settlement.getPerformanceFee(),
                settlement.getFeeShares(), feeRecipient);
        }
        return settlement;
    }

    /**
     * Replace the fee rates. Fees accrued so far are settled at the old rates first,
     * and the accrual period of the new rates starts now.
     *
     * @throws VaultException with UNAUTHORIZED without the FEE_MANAGER role, INVALID_FEES above a ceiling
     */
    public Fees updateFees(FeeRates rates, String caller) {
        return operationGuard.execute("updateFees", () -> {
            if (!accessGate.hasRole(VaultRole.FEE_MANAGER, caller)) {
                throw new VaultException(VaultErrorCode.UNAUTHORIZED, caller + " is not a fee manager");
            }
            feeAccrualEngine.validate(rates);
            accrueAndMint();

            // accrual up to now is settled at the old rates; the new rates apply from now on
            Instant now = clock.instant();
            FeeConfig config = loadConfig();
            Fees updated = config.toFees().toBuilder()
                .performanceFeeRate(rates.getPerformanceFeeRate())
                .managementFeeRate(rates.getManagementFeeRate())
                .withdrawalFeeRate(rates.getWithdrawalFeeRate())
                .lastUpdateTimestamp(now.getEpochSecond())
                .build();
            config.apply(updated, now);
            feeConfigRepository.save(config);
            journal.recordFeeUpdate(caller);

            log.info("Fees updated by {}: performance={}, management={}, withdrawal={}",
                caller, rates.getPerformanceFeeRate(), rates.getManagementFeeRate(), rates.getWithdrawalFeeRate());
            return updated;
        });
    }

    public String getFeeRecipient() {
        return feeRecipient;
    }

    private FeeConfig loadConfig() {
        return feeConfigRepository.findById(FeeConfig.SINGLETON_ID).orElseGet(this::bootstrap);
    }

    private FeeConfig bootstrap() {
        Fees initial = Fees.builder()
            .performanceFeeRate(defaultRates.getPerformanceFeeRate())
            .managementFeeRate(defaultRates.getManagementFeeRate())
            .withdrawalFeeRate(defaultRates.getWithdrawalFeeRate())
            .lastUpdateTimestamp(clock.instant().getEpochSecond())
            .highWaterMark(vaultTotals.snapshot().getShareValue())
            .build();
        FeeConfig config = feeConfigRepository.save(new FeeConfig(initial, clock.instant()));
        log.info("Initialized fee configuration: {}", initial);
        return config;
    }
}
