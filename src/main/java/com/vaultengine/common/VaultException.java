package com.vaultengine.common;

/**
 * Base exception for all vault engine failures.
 *
 * Carries the {@link VaultErrorCode} so callers can react to the specific kind
 * rather than to a generic failure.
 */
public class VaultException extends RuntimeException {

    private final VaultErrorCode code;

    public VaultException(VaultErrorCode code, String message) {
        super(code.name() + ": " + message);
        this.code = code;
    }

    public VaultException(VaultErrorCode code) {
        this(code, code.getDescription());
    }

    public VaultErrorCode getCode() {
        return code;
    }
}
