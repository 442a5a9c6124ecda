package com.currencyconverter.conversion;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a conversion: the destination amount and the rate that produced it.
 */
@Value
public class ConversionResult {
    BigDecimal destinationAmount;
    BigDecimal exchangeRate;
}
