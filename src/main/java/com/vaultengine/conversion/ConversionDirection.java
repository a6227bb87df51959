package com.vaultengine.conversion;

/**
 * Direction of a per-asset unit conversion.
 */
public enum ConversionDirection {
    TO_UNDERLYING,
    FROM_UNDERLYING
}
