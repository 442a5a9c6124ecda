package com.currencyconverter.common.exception;

/**
 * Base exception for all currency converter exceptions.
 */
public class CurrencyConverterException extends RuntimeException {

    public CurrencyConverterException(String message) {
        super(message);
    }

    public CurrencyConverterException(String message, Throwable cause) {
        super(message, cause);
    }
}
