package com.vaultengine.common;

import java.math.BigInteger;

/**
 * Unsigned, bounded-width integer arithmetic.
 *
 * Amounts are non-negative {@link BigInteger}s that must fit in 256 bits. Stored
 * fields use narrower widths and are checked explicitly; nothing wraps.
 */
public final class UintMath {

    public static final BigInteger MAX_UINT128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private UintMath() {
    }

    /**
     * Validate that an input amount is a non-null unsigned 256-bit value.
     */
    public static BigInteger requireUint(BigInteger value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
        if (value.compareTo(MAX_UINT256) > 0) {
            throw new VaultException(VaultErrorCode.ARITHMETIC_OVERFLOW, name + " exceeds 256 bits");
        }
        return value;
    }

    public static boolean isZero(BigInteger value) {
        return value.signum() == 0;
    }

    /**
     * Add two amounts, failing with {@code onOverflow} when the sum exceeds {@code max}.
     */
    public static BigInteger checkedAdd(BigInteger a, BigInteger b, BigInteger max, VaultErrorCode onOverflow) {
        BigInteger sum = a.add(b);
        if (sum.compareTo(max) > 0) {
            throw new VaultException(onOverflow, sum + " exceeds maximum " + max);
        }
        return sum;
    }

    /**
     * Subtract {@code b} from {@code a}, failing with {@code onUnderflow} when {@code b > a}.
     */
    public static BigInteger checkedSub(BigInteger a, BigInteger b, VaultErrorCode onUnderflow) {
        if (b.compareTo(a) > 0) {
            throw new VaultException(onUnderflow, "requested " + b + ", available " + a);
        }
        return a.subtract(b);
    }

    /**
     * Compute {@code a * b / denominator} with full-precision intermediate and the given rounding.
     * The result must fit in 256 bits.
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator, Rounding rounding) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
        BigInteger[] qr = a.multiply(b).divideAndRemainder(denominator);
        BigInteger result = qr[0];
        if (rounding == Rounding.UP && qr[1].signum() != 0) {
            result = result.add(BigInteger.ONE);
        }
        if (result.compareTo(MAX_UINT256) > 0) {
            throw new VaultException(VaultErrorCode.ARITHMETIC_OVERFLOW,
                "mulDiv result exceeds 256 bits");
        }
        return result;
    }
}
