package com.vaultengine.journal;

/**
 * Kinds of journaled vault state changes.
 */
public enum RedemptionEventType {
    /**
     * Shares moved into escrow and added to a pending slot.
     */
    REDEEM_REQUEST,

    /**
     * Pending shares released back out of escrow.
     */
    REDEEM_CANCEL,

    /**
     * Pending shares priced, burned and turned into a claimable pair.
     */
    REDEEM_FULFILL,

    /**
     * Claimable assets paid out by asset amount.
     */
    WITHDRAW,

    /**
     * Claimable assets paid out by share amount.
     */
    REDEEM,

    DEPOSIT,

    FEE_SETTLEMENT,

    FEE_UPDATE
}
