package com.currencyconverter.common.exception;

/**
 * Thrown when a new exchange rate's validity window overlaps an existing rate
 * for the same currency.
 */
public class RateConflictException extends CurrencyConverterException {

    public RateConflictException(String message) {
        super(message);
    }
}
