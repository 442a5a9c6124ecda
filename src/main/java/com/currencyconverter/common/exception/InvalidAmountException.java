package com.currencyconverter.common.exception;

import java.math.BigDecimal;

/**
 * Thrown when an amount to convert is missing or negative.
 */
public class InvalidAmountException extends CurrencyConverterException {

    private final BigDecimal amount;

    public InvalidAmountException(BigDecimal amount) {
        super("Amount must be positive");
        this.amount = amount;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
