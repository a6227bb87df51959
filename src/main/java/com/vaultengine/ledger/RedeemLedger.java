package com.vaultengine.ledger;

import com.vaultengine.common.Rounding;
import com.vaultengine.common.UintMath;
import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Pending and claimable redemption state per (account, asset).
 *
 * Every primitive validates fully before touching the record, so a failed call
 * leaves the stored values unchanged. Authorization is not a concern here; the
 * caller is trusted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedeemLedger {

    private final PendingRedeemRepository pendingRepository;
    private final ClaimableRedeemRepository claimableRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PendingRedeem getPending(String account, String asset) {
        return pendingRepository.findById(new RedeemKey(account, asset))
            .orElseGet(() -> new PendingRedeem(new RedeemKey(account, asset)));
    }

    @Transactional(readOnly = true)
    public ClaimableRedeem getClaimable(String account, String asset) {
        return claimableRepository.findById(new RedeemKey(account, asset))
            .orElseGet(() -> new ClaimableRedeem(new RedeemKey(account, asset)));
    }

    /**
     * Add shares to the pending slot and stamp the request time.
     *
     * @throws VaultException with TOO_MANY_SHARES if the result exceeds 128 bits
     */
    @Transactional
    public void increasePending(String account, String asset, BigInteger amount) {
        UintMath.requireUint(amount, "amount");
        PendingRedeem pending = getPending(account, asset);
        BigInteger updated = UintMath.checkedAdd(pending.getShares(), amount,
            UintMath.MAX_UINT128, VaultErrorCode.TOO_MANY_SHARES);

        pending.setShares(updated);
        pending.setRequestTime(clock.instant().getEpochSecond());
        pendingRepository.save(pending);

        log.debug("Pending {}/{} increased by {} to {}", account, asset, amount, updated);
    }

    /**
     * Remove shares from the pending slot; the request time resets once it is empty.
     *
     * @throws VaultException with INSUFFICIENT_PENDING_SHARES if {@code amount} exceeds the pending shares
     */
    @Transactional
    public void consumePending(String account, String asset, BigInteger amount) {
        UintMath.requireUint(amount, "amount");
        PendingRedeem pending = getPending(account, asset);
        BigInteger remaining = UintMath.checkedSub(pending.getShares(), amount,
            VaultErrorCode.INSUFFICIENT_PENDING_SHARES);

        pending.setShares(remaining);
        if (UintMath.isZero(remaining)) {
            pending.setRequestTime(0L);
        }
        pendingRepository.save(pending);

        log.debug("Pending {}/{} decreased by {} to {}", account, asset, amount, remaining);
    }

    /**
     * Add an (assets, shares) pair to the claimable record. Each field is checked
     * against 128 bits independently.
     */
    @Transactional
    public void increaseClaimable(String account, String asset, BigInteger assets, BigInteger shares) {
        UintMath.requireUint(assets, "assets");
        UintMath.requireUint(shares, "shares");
        ClaimableRedeem claimable = getClaimable(account, asset);
        BigInteger updatedAssets = UintMath.checkedAdd(claimable.getAssets(), assets,
            UintMath.MAX_UINT128, VaultErrorCode.TOO_MANY_ASSETS);
        BigInteger updatedShares = UintMath.checkedAdd(claimable.getShares(), shares,
            UintMath.MAX_UINT128, VaultErrorCode.TOO_MANY_SHARES);

        claimable.setAssets(updatedAssets);
        claimable.setShares(updatedShares);
        claimableRepository.save(claimable);

        log.debug("Claimable {}/{} increased by ({}, {}) to ({}, {})",
            account, asset, assets, shares, updatedAssets, updatedShares);
    }

    /**
     * Consume claimable assets and return the shares they burn at the locked ratio.
     * Shares round up so the holder never burns less than the proportional amount.
     * Withdrawing exactly the stored assets returns exactly the stored shares.
     *
     * @throws VaultException with INSUFFICIENT_CLAIMABLE_ASSETS if {@code assets} exceeds the stored assets
     */
    @Transactional
    public BigInteger consumeClaimableByAssets(String account, String asset, BigInteger assets) {
        UintMath.requireUint(assets, "assets");
        ClaimableRedeem claimable = getClaimable(account, asset);
        BigInteger shares;
        if (assets.equals(claimable.getAssets())) {
            shares = claimable.getShares();
        } else {
            if (assets.compareTo(claimable.getAssets()) > 0) {
                throw new VaultException(VaultErrorCode.INSUFFICIENT_CLAIMABLE_ASSETS,
                    "requested " + assets + ", claimable " + claimable.getAssets());
            }
            shares = UintMath.mulDiv(assets, claimable.getShares(), claimable.getAssets(), Rounding.UP);
        }
        apply(claimable, assets, shares);
        return shares;
    }

    /**
     * Consume claimable shares and return the assets they pay out at the locked ratio.
     * Assets round down so the holder never receives more than the proportional claim.
     * Redeeming exactly the stored shares returns exactly the stored assets.
     *
     * @throws VaultException with INSUFFICIENT_CLAIMABLE_SHARES if {@code shares} exceeds the stored shares
     */
    @Transactional
    public BigInteger consumeClaimableByShares(String account, String asset, BigInteger shares) {
        UintMath.requireUint(shares, "shares");
        ClaimableRedeem claimable = getClaimable(account, asset);
        BigInteger assets;
        if (shares.equals(claimable.getShares())) {
            assets = claimable.getAssets();
        } else {
            if (shares.compareTo(claimable.getShares()) > 0) {
                throw new VaultException(VaultErrorCode.INSUFFICIENT_CLAIMABLE_SHARES,
                    "requested " + shares + ", claimable " + claimable.getShares());
            }
            assets = UintMath.mulDiv(shares, claimable.getAssets(), claimable.getShares(), Rounding.DOWN);
        }
        apply(claimable, assets, shares);
        return assets;
    }

    /**
     * Decrease both claimable fields by exact amounts supplied by the caller.
     */
    @Transactional
    public void consumeClaimable(String account, String asset, BigInteger assets, BigInteger shares) {
        UintMath.requireUint(assets, "assets");
        UintMath.requireUint(shares, "shares");
        ClaimableRedeem claimable = getClaimable(account, asset);
        if (assets.compareTo(claimable.getAssets()) > 0) {
            throw new VaultException(VaultErrorCode.INSUFFICIENT_CLAIMABLE_ASSETS,
                "requested " + assets + ", claimable " + claimable.getAssets());
        }
        if (shares.compareTo(claimable.getShares()) > 0) {
            throw new VaultException(VaultErrorCode.INSUFFICIENT_CLAIMABLE_SHARES,
                "requested " + shares + ", claimable " + claimable.getShares());
        }
        apply(claimable, assets, shares);
    }

    @Transactional(readOnly = true)
    public BigInteger totalPendingShares() {
        BigInteger sum = pendingRepository.sumShares();
        return sum == null ? BigInteger.ZERO : sum;
    }

    @Transactional(readOnly = true)
    public BigInteger totalClaimableShares() {
        BigInteger sum = claimableRepository.sumShares();
        return sum == null ? BigInteger.ZERO : sum;
    }

    @Transactional(readOnly = true)
    public BigInteger totalClaimableAssets(String asset) {
        BigInteger sum = claimableRepository.sumAssetsByAsset(asset);
        return sum == null ? BigInteger.ZERO : sum;
    }

    private void apply(ClaimableRedeem claimable, BigInteger assets, BigInteger shares) {
        claimable.setAssets(claimable.getAssets().subtract(assets));
        claimable.setShares(claimable.getShares().subtract(shares));
        claimableRepository.save(claimable);

        log.debug("Claimable {}/{} decreased by ({}, {}) to ({}, {})",
            claimable.getId().getAccountId(), claimable.getId().getAsset(),
            assets, shares, claimable.getAssets(), claimable.getShares());
    }
}
