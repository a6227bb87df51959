package com.vaultengine.redemption;

import com.vaultengine.common.OperationGuard;
import com.vaultengine.common.UintMath;
import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.conversion.ConversionEngine;
import com.vaultengine.conversion.Totals;
import com.vaultengine.conversion.VaultTotals;
import com.vaultengine.fees.FeeAccrualEngine;
import com.vaultengine.fees.FeeService;
import com.vaultengine.fees.Fees;
import com.vaultengine.journal.RedemptionJournal;
import com.vaultengine.ledger.ClaimableRedeem;
import com.vaultengine.ledger.PendingRedeem;
import com.vaultengine.ledger.RedeemLedger;
import com.vaultengine.providers.AccessGate;
import com.vaultengine.providers.AssetTransfer;
import com.vaultengine.providers.PauseGate;
import com.vaultengine.providers.ShareToken;
import com.vaultengine.providers.VaultRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates the asynchronous redemption lifecycle.
 *
 * Redemption flow per (controller, asset):
 * 1. requestRedeem escrows shares into the pending slot
 * 2. cancelRedeem releases them again, or an operator fulfills them
 * 3. fulfillment prices the shares once, burns them and locks an (assets, shares) claimable pair
 * 4. withdraw / redeem pay the claimable assets out of the claim escrow
 *
 * Every state-changing call runs through {@link OperationGuard}: serialized, non-reentrant
 * and all-or-nothing. Ledger and share-supply changes always happen before asset transfers.
 */
@Service
@Slf4j
public class RedemptionService {

    /**
     * Pending redemptions share one fungible slot per (controller, asset), so every request has this id.
     */
    public static final BigInteger REQUEST_ID = BigInteger.ZERO;

    private final RedeemLedger ledger;
    private final ConversionEngine conversionEngine;
    private final VaultTotals vaultTotals;
    private final FeeAccrualEngine feeAccrualEngine;
    private final FeeService feeService;
    private final ShareToken shareToken;
    private final AssetTransfer assetTransfer;
    private final AccessGate accessGate;
    private final PauseGate pauseGate;
    private final RedemptionJournal journal;
    private final OperationGuard operationGuard;
    private final String vaultAccount;
    private final String claimEscrowAccount;

    public RedemptionService(RedeemLedger ledger,
                             ConversionEngine conversionEngine,
                             VaultTotals vaultTotals,
                             FeeAccrualEngine feeAccrualEngine,
                             FeeService feeService,
                             ShareToken shareToken,
                             AssetTransfer assetTransfer,
                             AccessGate accessGate,
                             PauseGate pauseGate,
                             RedemptionJournal journal,
                             OperationGuard operationGuard,
                             @Value("${vault-engine.vault-account:vault}") String vaultAccount,
                             @Value("${vault-engine.claim-escrow-account:claim-escrow}") String claimEscrowAccount) {
        this.ledger = ledger;
        this.conversionEngine = conversionEngine;
        this.vaultTotals = vaultTotals;
        this.feeAccrualEngine = feeAccrualEngine;
        this.feeService = feeService;
        this.shareToken = shareToken;
        this.assetTransfer = assetTransfer;
        this.accessGate = accessGate;
        this.pauseGate = pauseGate;
        this.journal = journal;
        this.operationGuard = operationGuard;
        this.vaultAccount = vaultAccount;
        this.claimEscrowAccount = claimEscrowAccount;
    }

    /**
     * Escrow {@code shares} of {@code owner} for a future redemption into {@code asset},
     * claimable by {@code controller}.
     *
     * @return the request id, always {@link #REQUEST_ID}
     */
    public BigInteger requestRedeem(String asset, BigInteger shares, String controller, String owner, String caller) {
        return operationGuard.execute("requestRedeem", () -> {
            whenNotPaused();
            conversionEngine.requireSupported(asset);
            requireNonZero(shares, "shares", VaultErrorCode.NOTHING_TO_REDEEM);
            requireAuthorized(owner, caller);

            BigInteger balance = shareToken.balanceOf(owner);
            if (balance.compareTo(shares) < 0) {
                throw new VaultException(VaultErrorCode.INSUFFICIENT_BALANCE,
                    String.format("%s holds %s shares, requested %s", owner, balance, shares));
            }

            ledger.increasePending(controller, asset, shares);
            shareToken.transfer(owner, vaultAccount, shares);
            journal.recordRequest(controller, owner, asset, shares, caller);

            log.info("Redeem requested: controller={}, owner={}, asset={}, shares={}",
                controller, owner, asset, shares);
            return REQUEST_ID;
        });
    }

    /**
     * Cancel the whole pending amount of {@code controller} for {@code asset}.
     *
     * @return the shares released to {@code receiver}
     */
    public BigInteger cancelRedeem(String asset, String controller, String receiver, String caller) {
        return operationGuard.execute("cancelRedeem", () -> {
            requireAuthorized(controller, caller);
            BigInteger pending = ledger.getPending(controller, asset).getShares();
            return cancel(asset, pending, controller, receiver, caller);
        });
    }

    /**
     * Cancel part of the pending amount of {@code controller} for {@code asset}.
     */
    public BigInteger cancelRedeemPartial(String asset, BigInteger shares, String controller,
                                          String receiver, String caller) {
        return operationGuard.execute("cancelRedeemPartial", () -> {
            requireAuthorized(controller, caller);
            UintMath.requireUint(shares, "shares");
            if (UintMath.isZero(ledger.getPending(controller, asset).getShares())) {
                throw new VaultException(VaultErrorCode.NO_PENDING_REDEEM,
                    "No pending shares for " + controller + " in " + asset);
            }
            return cancel(asset, shares, controller, receiver, caller);
        });
    }

    /**
     * Fulfill pending shares of one controller.
     *
     * @return the net assets made claimable
     */
    public BigInteger fulfillRedeem(String asset, BigInteger shares, String controller, String caller) {
        return operationGuard.execute("fulfillRedeem", () -> {
            requireOperator(caller);
            return fulfill(List.of(asset), List.of(shares), List.of(controller), caller).get(0);
        });
    }

    /**
     * Fulfill several pending redemptions priced from a single totals snapshot.
     * Atomic: one failing entry aborts the whole batch.
     *
     * @return the net assets made claimable, per entry in input order
     */
    public List<BigInteger> fulfillBatch(List<String> assets, List<BigInteger> shares,
                                         List<String> controllers, String caller) {
        return operationGuard.execute("fulfillBatch", () -> {
            requireOperator(caller);
            if (assets.isEmpty() || assets.size() != shares.size() || assets.size() != controllers.size()) {
                throw new VaultException(VaultErrorCode.INVALID_BATCH, String.format(
                    "assets=%d, shares=%d, controllers=%d", assets.size(), shares.size(), controllers.size()));
            }
            return fulfill(assets, shares, controllers, caller);
        });
    }

    /**
     * Withdraw {@code assets} from the claimable record of {@code controller}.
     * Not pause gated.
     *
     * @return the claimable shares consumed
     */
    public BigInteger withdraw(String asset, BigInteger assets, String receiver, String controller, String caller) {
        return operationGuard.execute("withdraw", () -> {
            requireAuthorized(controller, caller);
            requireNonZero(assets, "assets", VaultErrorCode.NOTHING_TO_WITHDRAW);

            BigInteger shares = ledger.consumeClaimableByAssets(controller, asset, assets);
            assetTransfer.transferFrom(asset, claimEscrowAccount, receiver, assets);
            journal.recordWithdraw(controller, receiver, asset, shares, assets, caller);

            log.info("Withdrawn: controller={}, receiver={}, asset={}, assets={}, shares={}",
                controller, receiver, asset, assets, shares);
            return shares;
        });
    }

    /**
     * Redeem {@code shares} from the claimable record of {@code controller}.
     * Not pause gated.
     *
     * @return the assets paid to {@code receiver}
     */
    public BigInteger redeem(String asset, BigInteger shares, String receiver, String controller, String caller) {
        return operationGuard.execute("redeem", () -> {
            requireAuthorized(controller, caller);
            requireNonZero(shares, "shares", VaultErrorCode.NOTHING_TO_REDEEM);

            BigInteger assets = ledger.consumeClaimableByShares(controller, asset, shares);
            if (UintMath.isZero(assets)) {
                throw new VaultException(VaultErrorCode.NOTHING_TO_WITHDRAW,
                    shares + " claimable shares are worth zero assets");
            }
            assetTransfer.transferFrom(asset, claimEscrowAccount, receiver, assets);
            journal.recordRedeem(controller, receiver, asset, shares, assets, caller);

            log.info("Redeemed: controller={}, receiver={}, asset={}, shares={}, assets={}",
                controller, receiver, asset, shares, assets);
            return assets;
        });
    }

    /**
     * Deposit {@code assets} of {@code asset} from the caller and mint shares to {@code receiver}.
     *
     * @return the shares minted
     */
    public BigInteger deposit(String asset, BigInteger assets, String receiver, String caller) {
        return operationGuard.execute("deposit", () -> {
            whenNotPaused();
            conversionEngine.requireSupported(asset);
            UintMath.requireUint(assets, "assets");

            feeService.accrueAndMint();
            Totals totals = vaultTotals.snapshot();
            BigInteger underlying = conversionEngine.toUnderlying(asset, assets);
            BigInteger shares = conversionEngine.underlyingToShares(underlying, totals);
            if (UintMath.isZero(shares)) {
                throw new VaultException(VaultErrorCode.NOTHING_TO_MINT,
                    assets + " " + asset + " is worth zero shares");
            }

            shareToken.mint(receiver, shares);
            assetTransfer.transferFrom(asset, caller, vaultAccount, assets);
            journal.recordDeposit(receiver, asset, shares, assets, caller);

            log.info("Deposited: receiver={}, asset={}, assets={}, shares={}", receiver, asset, assets, shares);
            return shares;
        });
    }

    /**
     * Shares a deposit would mint at current totals, before fee settlement.
     */
    @Transactional(readOnly = true)
    public BigInteger previewDeposit(String asset, BigInteger assets) {
        BigInteger underlying = conversionEngine.toUnderlying(asset, assets);
        return conversionEngine.underlyingToShares(underlying, vaultTotals.snapshot());
    }

    /**
     * Gross assets a fulfillment of {@code shares} would price at current totals,
     * before fee settlement and withdrawal fee.
     */
    @Transactional(readOnly = true)
    public BigInteger previewRedeem(String asset, BigInteger shares) {
        BigInteger underlying = conversionEngine.sharesToUnderlying(shares, vaultTotals.snapshot());
        return conversionEngine.fromUnderlying(asset, underlying);
    }

    @Transactional(readOnly = true)
    public PendingRedeem getPending(String asset, String account) {
        return ledger.getPending(account, asset);
    }

    @Transactional(readOnly = true)
    public ClaimableRedeem getClaimable(String asset, String account) {
        return ledger.getClaimable(account, asset);
    }

    @Transactional(readOnly = true)
    public BigInteger maxWithdraw(String asset, String account) {
        return ledger.getClaimable(account, asset).getAssets();
    }

    @Transactional(readOnly = true)
    public BigInteger maxRedeem(String asset, String account) {
        return ledger.getClaimable(account, asset).getShares();
    }

    private BigInteger cancel(String asset, BigInteger shares, String controller, String receiver, String caller) {
        if (UintMath.isZero(shares)) {
            throw new VaultException(VaultErrorCode.NO_PENDING_REDEEM,
                "No pending shares for " + controller + " in " + asset);
        }
        BigInteger pending = ledger.getPending(controller, asset).getShares();
        if (shares.compareTo(pending) > 0) {
            throw new VaultException(VaultErrorCode.NO_PENDING_REDEEM,
                String.format("%s has %s pending shares in %s, cannot cancel %s", controller, pending, asset, shares));
        }
        ledger.consumePending(controller, asset, shares);
        shareToken.transfer(vaultAccount, receiver, shares);
        journal.recordCancel(controller, receiver, asset, shares, caller);

        log.info("Redeem canceled: controller={}, receiver={}, asset={}, shares={}",
            controller, receiver, asset, shares);
        return shares;
    }

    private List<BigInteger> fulfill(List<String> assets, List<BigInteger> shares,
                                     List<String> controllers, String caller) {
        whenNotPaused();
        feeService.accrueAndMint();
        Fees fees = feeService.getFees();
        Totals totals = vaultTotals.snapshot();

        List<Payout> payouts = new ArrayList<>(assets.size());
        BigInteger sharesToBurn = BigInteger.ZERO;
        for (int i = 0; i < assets.size(); i++) {
            Payout payout = price(assets.get(i), shares.get(i), controllers.get(i), totals, fees);
            ledger.consumePending(payout.controller, payout.asset, payout.shares);
            ledger.increaseClaimable(payout.controller, payout.asset, payout.netAssets, payout.shares);
            sharesToBurn = sharesToBurn.add(payout.shares);
            payouts.add(payout);
        }

        shareToken.burn(vaultAccount, sharesToBurn);

        List<BigInteger> fulfilled = new ArrayList<>(payouts.size());
        for (Payout payout : payouts) {
            if (payout.withdrawalFee.signum() > 0) {
                assetTransfer.transfer(payout.asset, feeService.getFeeRecipient(), payout.withdrawalFee);
            }
            assetTransfer.transfer(payout.asset, claimEscrowAccount, payout.netAssets);
            journal.recordFulfill(payout.controller, payout.asset, payout.shares, payout.netAssets,
                payout.withdrawalFee, caller);
            fulfilled.add(payout.netAssets);

            log.info("Redeem fulfilled: controller={}, asset={}, shares={}, assets={}, fee={}",
                payout.controller, payout.asset, payout.shares, payout.netAssets, payout.withdrawalFee);
        }
        return fulfilled;
    }

    private Payout price(String asset, BigInteger shares, String controller, Totals totals, Fees fees) {
        conversionEngine.requireSupported(asset);
        requireNonZero(shares, "shares", VaultErrorCode.NOTHING_TO_REDEEM);

        BigInteger underlying = conversionEngine.sharesToUnderlying(shares, totals);
        BigInteger grossAssets = conversionEngine.fromUnderlying(asset, underlying);
        BigInteger withdrawalFee = feeAccrualEngine.withdrawalFee(grossAssets, fees);
        BigInteger netAssets = grossAssets.subtract(withdrawalFee);
        if (netAssets.signum() <= 0) {
            throw new VaultException(VaultErrorCode.NOTHING_TO_WITHDRAW,
                shares + " shares of " + controller + " are worth no " + asset);
        }
        return new Payout(asset, controller, shares, netAssets, withdrawalFee);
    }

    private void whenNotPaused() {
        if (pauseGate.isPaused()) {
            throw new VaultException(VaultErrorCode.VAULT_PAUSED);
        }
    }

    private void requireAuthorized(String controller, String caller) {
        if (!accessGate.isAuthorized(controller, caller)) {
            throw new VaultException(VaultErrorCode.UNAUTHORIZED,
                caller + " may not act for " + controller);
        }
    }

    private void requireOperator(String caller) {
        if (!accessGate.hasRole(VaultRole.OPERATOR, caller)) {
            throw new VaultException(VaultErrorCode.UNAUTHORIZED, caller + " is not an operator");
        }
    }

    private static void requireNonZero(BigInteger amount, String name, VaultErrorCode onZero) {
        UintMath.requireUint(amount, name);
        if (UintMath.isZero(amount)) {
            throw new VaultException(onZero, name + " must be nonzero");
        }
    }

    private static final class Payout {
        private final String asset;
        private final String controller;
        private final BigInteger shares;
        private final BigInteger netAssets;
        private final BigInteger withdrawalFee;

        private Payout(String asset, String controller, BigInteger shares,
                       BigInteger netAssets, BigInteger withdrawalFee) {
            this.asset = asset;
            this.controller = controller;
            this.shares = shares;
            this.netAssets = netAssets;
            this.withdrawalFee = withdrawalFee;
        }
    }
}
