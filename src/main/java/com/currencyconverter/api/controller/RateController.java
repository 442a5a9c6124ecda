package com.currencyconverter.api.controller;

import com.currencyconverter.api.dto.RateView;
import com.currencyconverter.rates.ExchangeRateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only REST API for stored exchange rates.
 */
@RestController
@RequestMapping("/api/v1/rates")
@RequiredArgsConstructor
@Tag(name = "Rates", description = "Exchange rates against GBP")
public class RateController {

    private final ExchangeRateService exchangeRateService;

    @GetMapping
    @Operation(summary = "List the rates valid right now")
    public ResponseEntity<List<RateView>> getCurrentRates() {
        List<RateView> rates = exchangeRateService.getCurrentRates().stream()
            .map(RateView::from)
            .toList();
        return ResponseEntity.ok(rates);
    }

    @GetMapping("/{currencyCode}")
    @Operation(summary = "List the rates of a currency whose window lies within a range")
    public ResponseEntity<List<RateView>> getRateHistory(
            @PathVariable String currencyCode,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {

        List<RateView> rates = exchangeRateService.getRateHistory(currencyCode, from, to).stream()
            .map(RateView::from)
            .toList();
        return ResponseEntity.ok(rates);
    }
}
