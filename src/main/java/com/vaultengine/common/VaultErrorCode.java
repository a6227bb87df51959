package com.vaultengine.common;

/**
 * Error kinds raised by the vault engine.
 *
 * Every kind aborts the operation that raised it; none are retried internally.
 */
public enum VaultErrorCode {
    INSUFFICIENT_PENDING_SHARES("Consuming more pending shares than recorded"),
    INSUFFICIENT_CLAIMABLE_SHARES("Consuming more claimable shares than recorded"),
    INSUFFICIENT_CLAIMABLE_ASSETS("Consuming more claimable assets than recorded"),
    TOO_MANY_SHARES("Share amount exceeds its bounded width"),
    TOO_MANY_ASSETS("Asset amount exceeds its bounded width"),
    NOTHING_TO_REDEEM("Share amount is zero"),
    NOTHING_TO_WITHDRAW("Asset amount is zero"),
    NOTHING_TO_MINT("Computed share amount is zero"),
    NO_PENDING_REDEEM("No pending redemption to cancel"),
    ASSET_NOT_SUPPORTED("Asset is not supported"),
    INVALID_FEES("Fee rate exceeds its ceiling"),
    ARITHMETIC_OVERFLOW("Result exceeds 256 bits"),
    INSUFFICIENT_BALANCE("Balance too low for transfer"),
    UNAUTHORIZED("Caller is not authorized"),
    VAULT_PAUSED("Vault is paused"),
    REENTRANT_CALL("Reentrant call into the vault"),
    INVALID_BATCH("Batch arrays are empty or of different lengths");

    private final String description;

    VaultErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
