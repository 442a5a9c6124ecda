package com.currencyconverter.api.dto;

import com.currencyconverter.rates.ExchangeRate;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Stored exchange rate of a currency against GBP.
 */
@Value
@Builder
public class RateView {
    String currencyCode;
    String currencyName;
    BigDecimal unitsPerGbp;
    LocalDateTime validFrom;
    LocalDateTime validTo;

    public static RateView from(ExchangeRate rate) {
        return RateView.builder()
            .currencyCode(rate.getCurrency().getCode())
            .currencyName(rate.getCurrency().getName())
            .unitsPerGbp(rate.getUnitsPerGbp())
            .validFrom(rate.getValidFrom())
            .validTo(rate.getValidTo())
            .build();
    }
}
