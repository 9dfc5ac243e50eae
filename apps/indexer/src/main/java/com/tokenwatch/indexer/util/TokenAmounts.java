package com.tokenwatch.indexer.util;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions between raw token integers and human-readable decimal strings.
 */
public final class TokenAmounts {

    private TokenAmounts() {
    }

    /**
     * Scale a raw amount by {@code decimals}, without trailing zeros but with at least one
     * fractional digit ({@code 1500000 -> "1.5"}, {@code 2000000 -> "2.0"} for 6 decimals).
     */
    public static String format(BigInteger raw, int decimals) {
        BigDecimal value = new BigDecimal(raw, decimals).stripTrailingZeros();
        if (value.scale() < 1) {
            value = value.setScale(1);
        }
        return value.toPlainString();
    }

    /**
     * Parse a decimal amount into the token's smallest unit.
     *
     * @throws IllegalArgumentException if the amount is not a non-negative number with at most
     *                                  {@code decimals} fractional digits
     */
    public static BigInteger parse(String amount, int decimals) {
        if (amount == null || amount.isBlank()) {
            throw new IllegalArgumentException("amount is required");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("amount is not a number: " + amount);
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("amount cannot be negative: " + amount);
        }
        try {
            return value.movePointRight(decimals).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("amount has more than " + decimals + " decimals: " + amount);
        }
    }
}
