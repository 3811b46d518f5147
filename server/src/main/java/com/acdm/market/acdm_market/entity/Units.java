package com.acdm.market.acdm_market.entity;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Conversions between human decimal amounts ("0.00001") and integer base units.
 *
 * The engine only ever computes with base units (BigInteger). Decimal strings are
 * for configuration and logs. Parsing is exact: an amount with more fractional
 * digits than the unit has decimals is rejected rather than rounded.
 */
public final class Units {

    /**
     * Decimals of the native currency.
     */
    public static final int NATIVE_DECIMALS = 18;

    private Units() {
    }

    /**
     * Parse a decimal string into base units.
     */
    public static BigInteger parse(String amount, int decimals) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        try {
            return value.movePointRight(decimals).setScale(0, RoundingMode.UNNECESSARY).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                String.format("Amount %s has more than %d decimals", amount, decimals), e);
        }
    }

    public static BigInteger parseNative(String amount) {
        return parse(amount, NATIVE_DECIMALS);
    }

    /**
     * Format base units as a plain decimal string without trailing zeros.
     */
    public static String format(BigInteger baseUnits, int decimals) {
        if (baseUnits == null) {
            return "null";
        }
        BigDecimal value = new BigDecimal(baseUnits, decimals).stripTrailingZeros();
        return value.toPlainString();
    }

    public static String formatNative(BigInteger baseUnits) {
        return format(baseUnits, NATIVE_DECIMALS);
    }

    /**
     * 10^decimals.
     */
    public static BigInteger scale(int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("Decimals cannot be negative: " + decimals);
        }
        return BigInteger.TEN.pow(decimals);
    }
}
