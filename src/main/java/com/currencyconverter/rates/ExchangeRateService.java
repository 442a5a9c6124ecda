package com.currencyconverter.rates;

import com.currencyconverter.common.CurrencyCodes;
import com.currencyconverter.common.exception.CurrencyNotFoundException;
import com.currencyconverter.currency.Currency;
import com.currencyconverter.currency.CurrencyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Read access to stored exchange rates.
 */
@Service
@RequiredArgsConstructor
public class ExchangeRateService {

    private final ExchangeRateRepository exchangeRateRepository;
    private final CurrencyRepository currencyRepository;
    private final Clock clock;

    /**
     * Rates valid right now for every non-base currency, ordered by code.
     */
    @Transactional(readOnly = true)
    public List<ExchangeRate> getCurrentRates() {
        return exchangeRateRepository.findAllCurrent(LocalDateTime.now(clock)).stream()
            .filter(rate -> !CurrencyCodes.isBase(rate.getCurrency().getCode()))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<ExchangeRate> getRateHistory(String currencyCode, LocalDateTime from, LocalDateTime to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
        String code = CurrencyCodes.normalize(currencyCode);
        Currency currency = currencyRepository.findByCode(code)
            .orElseThrow(() -> new CurrencyNotFoundException(
                String.format("Currency \"%s\" not found", code)));
        return exchangeRateRepository.findRatesInDateRange(currency, from, to);
    }
}
