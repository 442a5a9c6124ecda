package com.currencyconverter.rates;

import com.currencyconverter.currency.Currency;
import com.currencyconverter.currency.CurrencyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the database-backed rate store.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JpaRateStoreTest {

    @Autowired
    private JpaRateStore rateStore;

    @Autowired
    private CurrencyRepository currencyRepository;

    @Autowired
    private ExchangeRateRepository exchangeRateRepository;

    private Currency usd;
    private LocalDateTime now;

    @BeforeEach
    void setUp() {
        now = LocalDateTime.now();
        usd = currencyRepository.save(new Currency("USD", "Dollar", Instant.now()));
        currencyRepository.save(new Currency("CHF", "Franc", Instant.now()));
    }

    private ExchangeRate saveRate(Currency currency, String rate, LocalDateTime from, LocalDateTime to) {
        return exchangeRateRepository.save(
            new ExchangeRate(currency, new BigDecimal(rate), from, to, Instant.now()));
    }

    @Test
    void testCurrentRateIsReturned() {
        saveRate(usd, "1.25000000", now.minusDays(1), now.plusDays(1));

        Optional<BigDecimal> rate = rateStore.currentRatePerBase("USD");

        assertTrue(rate.isPresent());
        assertEquals(0, new BigDecimal("1.25").compareTo(rate.get()));
    }

    @Test
    void testExpiredAndFutureRatesAreIgnored() {
        saveRate(usd, "1.10", now.minusDays(30), now.minusDays(1));
        saveRate(usd, "1.40", now.plusDays(1), now.plusDays(30));

        assertTrue(rateStore.currentRatePerBase("USD").isEmpty());
        assertTrue(rateStore.isKnownCurrency("USD"));
    }

    @Test
    void testMostRecentlyStartedWindowWins() {
        saveRate(usd, "1.10", now.minusDays(30), now.plusDays(30));
        saveRate(usd, "1.30", now.minusDays(2), now.plusDays(2));

        assertEquals(0, new BigDecimal("1.30").compareTo(rateStore.currentRatePerBase("USD").orElseThrow()));
    }

    @Test
    void testUnknownCurrency() {
        assertTrue(rateStore.currentRatePerBase("XYZ").isEmpty());
        assertFalse(rateStore.isKnownCurrency("XYZ"));
        assertTrue(rateStore.isKnownCurrency("CHF"));
        assertTrue(rateStore.currentRatePerBase("CHF").isEmpty());
    }

    @Test
    void testOverlapAndRangeQueries() {
        ExchangeRate january = saveRate(usd, "1.20",
            LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 1, 31, 23, 59, 59));
        ExchangeRate february = saveRate(usd, "1.21",
            LocalDateTime.of(2024, 2, 1, 0, 0), LocalDateTime.of(2024, 2, 29, 23, 59, 59));

        List<ExchangeRate> overlapping = exchangeRateRepository.findOverlappingRates(usd,
            LocalDateTime.of(2024, 1, 31, 12, 0), LocalDateTime.of(2024, 2, 1, 12, 0));
        assertEquals(2, overlapping.size());

        List<ExchangeRate> inRange = exchangeRateRepository.findRatesInDateRange(usd,
            LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 3, 1, 0, 0));
        assertEquals(List.of(january.getId(), february.getId()),
            inRange.stream().map(ExchangeRate::getId).toList());

        List<ExchangeRate> partial = exchangeRateRepository.findRatesInDateRange(usd,
            LocalDateTime.of(2024, 1, 15, 0, 0), LocalDateTime.of(2024, 3, 1, 0, 0));
        assertEquals(1, partial.size());
    }

    @Test
    void testRateMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> new ExchangeRate(usd, BigDecimal.ZERO, now, now.plusDays(1), Instant.now()));
        assertThrows(IllegalArgumentException.class,
            () -> new ExchangeRate(usd, BigDecimal.ONE, now, now.minusDays(1), Instant.now()));
    }
}
