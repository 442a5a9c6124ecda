package com.currencyconverter.common;

import java.util.Locale;

/**
 * Normalization of ISO 4217 currency codes.
 */
public final class CurrencyCodes {

    private CurrencyCodes() {
    }

    /**
     * Trims and upper-cases a code. Null becomes an empty string.
     */
    public static String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isBase(String normalizedCode) {
        return ConverterConstants.BASE_CURRENCY.equals(normalizedCode);
    }
}
