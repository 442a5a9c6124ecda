package com.currencyconverter.rates;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Source of base-relative exchange rates.
 *
 * Implementations answer for "now"; two calls may observe different rate
 * snapshots if rates rotate in between.
 */
public interface RateStore {

    /**
     * Units of the currency per 1 unit of the base currency, valid right now.
     *
     * @param currencyCode normalized ISO 4217 code
     * @return the rate, or empty if the code is unknown or has no current rate
     */
    Optional<BigDecimal> currentRatePerBase(String currencyCode);

    /**
     * Whether the currency is recorded at all, regardless of rate validity.
     */
    boolean isKnownCurrency(String currencyCode);
}
