package com.vaultengine.providers;

import java.math.BigInteger;

/**
 * Source of the vault's total assets, expressed in underlying units.
 */
public interface TotalAssetsSource {

    BigInteger totalAssets();
}
