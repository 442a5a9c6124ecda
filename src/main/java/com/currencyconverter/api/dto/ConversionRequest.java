package com.currencyconverter.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for converting an amount between two currencies.
 */
@Data
public class ConversionRequest {

    @NotBlank(message = "Source currency is required")
    @IsoCurrencyCode(message = "Invalid source currency code")
    private String sourceCurrency;

    @NotBlank(message = "Destination currency is required")
    @IsoCurrencyCode(message = "Invalid destination currency code")
    private String destinationCurrency;

    @NotNull(message = "Source amount is required")
    @Positive(message = "Source amount must be positive")
    private BigDecimal sourceAmount;
}
