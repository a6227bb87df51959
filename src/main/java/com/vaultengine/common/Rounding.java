package com.vaultengine.common;

/**
 * Direction of integer division in fixed-point conversions.
 */
public enum Rounding {
    DOWN,
    UP
}
