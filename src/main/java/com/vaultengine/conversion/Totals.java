package com.vaultengine.conversion;

import lombok.Value;

import java.math.BigInteger;

/**
 * Point-in-time snapshot of vault totals used to price one operation.
 *
 * Never persisted. A batch operation takes exactly one snapshot and prices every
 * entry from it.
 */
@Value
public class Totals {

    /**
     * Total assets under management, in underlying units.
     */
    BigInteger totalAssets;

    /**
     * Total share supply.
     */
    BigInteger totalSupply;

    /**
     * Underlying value of one whole share at these totals.
     */
    BigInteger shareValue;
}
