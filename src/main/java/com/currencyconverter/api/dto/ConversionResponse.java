package com.currencyconverter.api.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of a conversion as returned to API clients.
 */
@Value
@Builder
public class ConversionResponse {
    String sourceCurrency;
    String destinationCurrency;
    BigDecimal sourceAmount;
    BigDecimal destinationAmount;
    BigDecimal exchangeRate;
}
