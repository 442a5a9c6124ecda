package com.currencyconverter.fixtures;

import com.currencyconverter.rates.ExchangeRateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds exchange rates from the configured CSV file at startup.
 *
 * Skipped when disabled, when no path is set, or when rates are already stored.
 */
@Component
@Slf4j
public class RateFixtureRunner implements ApplicationRunner {

    private final RateFixtureLoader loader;
    private final ExchangeRateRepository exchangeRateRepository;
    private final boolean enabled;
    private final String path;

    public RateFixtureRunner(RateFixtureLoader loader,
                             ExchangeRateRepository exchangeRateRepository,
                             @Value("${converter.fixtures.enabled:false}") boolean enabled,
                             @Value("${converter.fixtures.path:}") String path) {
        this.loader = loader;
        this.exchangeRateRepository = exchangeRateRepository;
        this.enabled = enabled;
        this.path = path;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled || path.isBlank()) {
            log.info("Rate fixtures disabled");
            return;
        }
        if (exchangeRateRepository.count() > 0) {
            log.info("Exchange rates already present, skipping fixtures from {}", path);
            return;
        }
        loader.load(path);
    }
}
