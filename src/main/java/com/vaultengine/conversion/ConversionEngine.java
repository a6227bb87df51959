package com.vaultengine.conversion;

import com.vaultengine.common.Rounding;
import com.vaultengine.common.UintMath;
import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.providers.RateProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Conversions between shares, the canonical underlying unit and per-asset units.
 *
 * Stateless apart from configuration. Every conversion rounds down, in favour of
 * the vault. The {@code +1} and {@code +offset} terms keep the ratio defined when
 * the vault is empty and make share-price inflation attacks unprofitable.
 */
@Component
@Slf4j
public class ConversionEngine {

    private final RateProvider rateProvider;
    private final String canonicalAsset;
    private final int underlyingDecimals;
    private final BigInteger offset;
    private final BigInteger oneShareUnit;

    public ConversionEngine(
            RateProvider rateProvider,
            @Value("${vault-engine.canonical-asset:USDC}") String canonicalAsset,
            @Value("${vault-engine.underlying-decimals:6}") int underlyingDecimals,
            @Value("${vault-engine.decimals-offset:0}") int decimalsOffset) {
        if (underlyingDecimals < 0 || decimalsOffset < 0) {
            throw new IllegalArgumentException("Decimals cannot be negative");
        }
        this.rateProvider = rateProvider;
        this.canonicalAsset = canonicalAsset;
        this.underlyingDecimals = underlyingDecimals;
        this.offset = BigInteger.TEN.pow(decimalsOffset);
        this.oneShareUnit = BigInteger.TEN.pow(underlyingDecimals + decimalsOffset);
    }

    /**
     * {@code shares * (totalAssets + 1) / (totalSupply + offset)}, rounded down.
     */
    public BigInteger sharesToUnderlying(BigInteger shares, BigInteger totalAssets, BigInteger totalSupply) {
        UintMath.requireUint(shares, "shares");
        return UintMath.mulDiv(shares, totalAssets.add(BigInteger.ONE), totalSupply.add(offset), Rounding.DOWN);
    }

    /**
     * {@code assets * (totalSupply + offset) / (totalAssets + 1)}, rounded down.
     */
    public BigInteger underlyingToShares(BigInteger assets, BigInteger totalAssets, BigInteger totalSupply) {
        UintMath.requireUint(assets, "assets");
        return UintMath.mulDiv(assets, totalSupply.add(offset), totalAssets.add(BigInteger.ONE), Rounding.DOWN);
    }

    public BigInteger sharesToUnderlying(BigInteger shares, Totals totals) {
        return sharesToUnderlying(shares, totals.getTotalAssets(), totals.getTotalSupply());
    }

    public BigInteger underlyingToShares(BigInteger assets, Totals totals) {
        return underlyingToShares(assets, totals.getTotalAssets(), totals.getTotalSupply());
    }

    /**
     * Build a totals snapshot, deriving the value of one whole share.
     */
    public Totals snapshot(BigInteger totalAssets, BigInteger totalSupply) {
        UintMath.requireUint(totalAssets, "totalAssets");
        UintMath.requireUint(totalSupply, "totalSupply");
        BigInteger shareValue = sharesToUnderlying(oneShareUnit, totalAssets, totalSupply);
        return new Totals(totalAssets, totalSupply, shareValue);
    }

    /**
     * Convert between asset units and underlying units. Identity for the canonical asset.
     *
     * @throws VaultException with ASSET_NOT_SUPPORTED for unknown assets
     */
    public BigInteger convertAssetUnits(String asset, BigInteger amount, ConversionDirection direction) {
        UintMath.requireUint(amount, "amount");
        if (canonicalAsset.equals(asset)) {
            return amount;
        }
        requireSupported(asset);
        BigInteger converted = direction == ConversionDirection.TO_UNDERLYING
            ? rateProvider.convertToUnderlying(asset, amount)
            : rateProvider.convertFromUnderlying(asset, amount);
        log.debug("Converted {} {} {} -> {}", amount, asset, direction, converted);
        return converted;
    }

    public BigInteger toUnderlying(String asset, BigInteger amount) {
        return convertAssetUnits(asset, amount, ConversionDirection.TO_UNDERLYING);
    }

    public BigInteger fromUnderlying(String asset, BigInteger amount) {
        return convertAssetUnits(asset, amount, ConversionDirection.FROM_UNDERLYING);
    }

    public boolean isSupported(String asset) {
        return canonicalAsset.equals(asset) || rateProvider.isSupported(asset);
    }

    public void requireSupported(String asset) {
        if (!isSupported(asset)) {
            throw new VaultException(VaultErrorCode.ASSET_NOT_SUPPORTED, "Asset not supported: " + asset);
        }
    }

    public String getCanonicalAsset() {
        return canonicalAsset;
    }

    public int getUnderlyingDecimals() {
        return underlyingDecimals;
    }

    public BigInteger getOneShareUnit() {
        return oneShareUnit;
    }
}
