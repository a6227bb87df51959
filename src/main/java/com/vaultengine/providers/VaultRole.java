package com.vaultengine.providers;

/**
 * Privileged roles checked through {@link AccessGate}.
 */
public enum VaultRole {
    /**
     * Fulfills pending redemptions.
     */
    OPERATOR,

    /**
     * Changes fee rates.
     */
    FEE_MANAGER
}
