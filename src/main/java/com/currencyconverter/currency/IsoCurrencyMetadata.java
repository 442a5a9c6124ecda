package com.currencyconverter.currency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Currency metadata backed by the ISO 4217 tables shipped with the JDK.
 *
 * Codes the JDK does not know, and pseudo-currencies without a minor unit
 * definition (XAU, XDR, ...), are displayed with {@link #DEFAULT_FRACTION_DIGITS}.
 */
@Component
@Slf4j
public class IsoCurrencyMetadata implements CurrencyMetadata {

    static final int DEFAULT_FRACTION_DIGITS = 2;

    @Override
    public int fractionDigits(String currencyCode) {
        try {
            int digits = java.util.Currency.getInstance(currencyCode).getDefaultFractionDigits();
            return digits < 0 ? DEFAULT_FRACTION_DIGITS : digits;
        } catch (IllegalArgumentException e) {
            log.debug("No ISO 4217 entry for {}, using {} fraction digits",
                currencyCode, DEFAULT_FRACTION_DIGITS);
            return DEFAULT_FRACTION_DIGITS;
        }
    }

    /**
     * Whether the code is a valid ISO 4217 currency code.
     */
    public static boolean isIsoCode(String currencyCode) {
        if (currencyCode == null) {
            return false;
        }
        try {
            java.util.Currency.getInstance(currencyCode);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
