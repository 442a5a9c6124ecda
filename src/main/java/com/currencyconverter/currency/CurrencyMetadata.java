package com.currencyconverter.currency;

/**
 * Display metadata for currencies.
 */
public interface CurrencyMetadata {

    /**
     * Number of minor-unit decimal places used when displaying an amount in the
     * given currency, e.g. 2 for USD and 0 for JPY. Never negative.
     *
     * @param currencyCode normalized ISO 4217 code
     */
    int fractionDigits(String currencyCode);
}
