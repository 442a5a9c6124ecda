package com.currencyconverter.api.controller;

import com.currencyconverter.api.dto.ConversionRequest;
import com.currencyconverter.api.dto.ConversionResponse;
import com.currencyconverter.common.CurrencyCodes;
import com.currencyconverter.conversion.ConversionResult;
import com.currencyconverter.conversion.CurrencyConverterService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for currency conversion.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Conversion", description = "Currency conversion API")
public class ConversionController {

    private final CurrencyConverterService currencyConverterService;

    @PostMapping("/convert")
    @Operation(summary = "Convert an amount from one currency to another")
    public ResponseEntity<ConversionResponse> convert(@Valid @RequestBody ConversionRequest request) {
        String source = CurrencyCodes.normalize(request.getSourceCurrency());
        String destination = CurrencyCodes.normalize(request.getDestinationCurrency());

        ConversionResult result = currencyConverterService.convert(
            source, destination, request.getSourceAmount());

        return ResponseEntity.ok(ConversionResponse.builder()
            .sourceCurrency(source)
            .destinationCurrency(destination)
            .sourceAmount(request.getSourceAmount())
            .destinationAmount(result.getDestinationAmount())
            .exchangeRate(result.getExchangeRate())
            .build());
    }
}
