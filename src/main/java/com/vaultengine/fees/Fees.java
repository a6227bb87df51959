package com.vaultengine.fees;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Immutable view of the vault's fee configuration.
 *
 * Rates are in basis points of {@link FeeAccrualEngine#MAX_BPS}.
 */
@Value
@Builder(toBuilder = true)
public class Fees {

    int performanceFeeRate;

    int managementFeeRate;

    int withdrawalFeeRate;

    /**
     * Epoch seconds of the last settlement that charged a nonzero fee.
     */
    long lastUpdateTimestamp;

    /**
     * Share value at the last settlement. Never decreases.
     */
    BigInteger highWaterMark;
}
