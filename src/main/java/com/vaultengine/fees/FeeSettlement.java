package com.vaultengine.fees;

import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a fee settlement: the fees charged, the shares to mint for them
 * and the fee state to store.
 */
@Value
public class FeeSettlement {

    BigInteger managementFee;

    BigInteger performanceFee;

    /**
     * Shares the caller mints to the fee recipient.
     */
    BigInteger feeShares;

    Fees updatedFees;

    public BigInteger totalFee() {
        return managementFee.add(performanceFee);
    }
}
