package com.vaultengine.providers;

/**
 * Capability check queried before any call that acts on behalf of an account
 * or requires a privileged role.
 */
public interface AccessGate {

    /**
     * Whether {@code caller} may act for {@code controller}: either the same account
     * or an operator the controller approved.
     */
    boolean isAuthorized(String controller, String caller);

    boolean hasRole(VaultRole role, String caller);
}
