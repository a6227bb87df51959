package com.vaultengine.providers;

import java.math.BigInteger;

/**
 * Per-asset rate collaborator.
 *
 * Converts between an asset's own units and the vault's canonical accounting unit.
 * The canonical asset itself never reaches this interface.
 *
 * In production, this would be backed by an on-chain oracle or a pricing service.
 */
public interface RateProvider {

    /**
     * Whether the asset has a rate.
     */
    boolean isSupported(String asset);

    /**
     * Convert an amount of {@code asset} into underlying units, rounded down.
     */
    BigInteger convertToUnderlying(String asset, BigInteger amount);

    /**
     * Convert an amount of underlying units into {@code asset} units, rounded down.
     */
    BigInteger convertFromUnderlying(String asset, BigInteger amount);
}
