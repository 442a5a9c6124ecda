package com.currencyconverter.rates;

import com.currencyconverter.currency.CurrencyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Rate store backed by the exchange_rates table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaRateStore implements RateStore {

    private final ExchangeRateRepository exchangeRateRepository;
    private final CurrencyRepository currencyRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<BigDecimal> currentRatePerBase(String currencyCode) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<BigDecimal> rate = exchangeRateRepository.findCurrentRate(currencyCode, now)
            .map(ExchangeRate::getUnitsPerGbp);
        log.debug("Current rate for {} at {}: {}", currencyCode, now, rate.orElse(null));
        return rate;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isKnownCurrency(String currencyCode) {
        return currencyRepository.existsByCode(currencyCode);
    }
}
