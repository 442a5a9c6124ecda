package com.currencyconverter.common;

/**
 * Application-wide constants.
 */
public final class ConverterConstants {

    /**
     * All stored rates are expressed as units of a currency per 1 unit of this currency.
     */
    public static final String BASE_CURRENCY = "GBP";

    /**
     * Decimal places kept on an exchange rate before it is applied to an amount.
     */
    public static final int RATE_PRECISION = 7;

    public static final String API_KEY_HEADER = "X-API-Key";

    private ConverterConstants() {
    }
}
