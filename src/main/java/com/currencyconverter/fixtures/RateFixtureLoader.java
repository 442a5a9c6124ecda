package com.currencyconverter.fixtures;

import com.currencyconverter.common.CurrencyCodes;
import com.currencyconverter.common.exception.CurrencyNotFoundException;
import com.currencyconverter.common.exception.RateConflictException;
import com.currencyconverter.currency.Currency;
import com.currencyconverter.currency.CurrencyRepository;
import com.currencyconverter.currency.IsoCurrencyMetadata;
import com.currencyconverter.rates.ExchangeRate;
import com.currencyconverter.rates.ExchangeRateRepository;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads currencies and GBP exchange rates from a CSV file.
 *
 * Expected header columns: {@code Currency}, {@code Currency Code} and a rate
 * column starting with {@code Currency units per} (the pound sign is not
 * matched, its encoding varies between exports). {@code Valid From} and
 * {@code Valid To} are read only when the fixed window is disabled.
 *
 * Rows are grouped by code and window, the first row of a group wins. A rate
 * whose window overlaps a stored rate for the same currency is a conflict.
 */
@Component
@Slf4j
public class RateFixtureLoader {

    static final String CURRENCY_COLUMN = "Currency";
    static final String CODE_COLUMN = "Currency Code";
    static final String RATE_COLUMN_PREFIX = "Currency units per";
    static final String VALID_FROM_COLUMN = "Valid From";
    static final String VALID_TO_COLUMN = "Valid To";

    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final CurrencyRepository currencyRepository;
    private final ExchangeRateRepository exchangeRateRepository;
    private final ResourceLoader resourceLoader;
    private final Clock clock;
    private final boolean fixedWindowEnabled;
    private final LocalDateTime fixedFrom;
    private final LocalDateTime fixedTo;

    public RateFixtureLoader(
            CurrencyRepository currencyRepository,
            ExchangeRateRepository exchangeRateRepository,
            ResourceLoader resourceLoader,
            Clock clock,
            @Value("${converter.fixtures.fixed-window.enabled:true}") boolean fixedWindowEnabled,
            @Value("${converter.fixtures.fixed-window.from:2025-01-01T00:00:00}") String fixedFrom,
            @Value("${converter.fixtures.fixed-window.to:2099-12-31T23:59:59}") String fixedTo) {

        this.currencyRepository = currencyRepository;
        this.exchangeRateRepository = exchangeRateRepository;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
        this.fixedWindowEnabled = fixedWindowEnabled;
        this.fixedFrom = LocalDateTime.parse(fixedFrom);
        this.fixedTo = LocalDateTime.parse(fixedTo);
    }

    /**
     * Load rates from a Spring resource location ({@code classpath:}, {@code file:} or a plain path).
     *
     * @return number of exchange rates created
     */
    @Transactional
    public int load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("CSV file not found at path: " + location);
        }

        List<Map<String, String>> rows = readRows(resource);
        Map<String, RateFixtureRow> groups = groupRows(rows);

        Instant now = clock.instant();
        int created = 0;
        for (RateFixtureRow row : groups.values()) {
            if (!IsoCurrencyMetadata.isIsoCode(row.getCurrencyCode())) {
                throw new CurrencyNotFoundException(String.format(
                    "Invalid currency code \"%s\". This is not a valid ISO 4217 currency code.",
                    row.getCurrencyCode()));
            }

            Currency currency = getOrCreateCurrency(row, now);
            checkForConflict(currency, row);

            exchangeRateRepository.save(new ExchangeRate(
                currency, row.getUnitsPerGbp(), row.getValidFrom(), row.getValidTo(), now));
            created++;
        }

        log.info("Loaded {} exchange rates from {}", created, location);
        return created;
    }

    private List<Map<String, String>> readRows(Resource resource) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (InputStream in = resource.getInputStream();
             MappingIterator<Map<String, String>> iterator = new CsvMapper()
                 .readerForMapOf(String.class)
                 .with(schema)
                 .readValues(in)) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV file " + resource.getDescription(), e);
        }
    }

    private Map<String, RateFixtureRow> groupRows(List<Map<String, String>> rows) {
        Map<String, RateFixtureRow> groups = new LinkedHashMap<>();
        if (rows.isEmpty()) {
            return groups;
        }

        String rateColumn = requireColumns(rows.get(0));

        for (Map<String, String> row : rows) {
            String code = CurrencyCodes.normalize(row.get(CODE_COLUMN));
            if (code.isEmpty()) {
                throw new CurrencyNotFoundException(
                    String.format("Row: %s Currency code cannot be empty", row));
            }

            LocalDateTime validFrom = fixedWindowEnabled ? fixedFrom : parseDate(row.get(VALID_FROM_COLUMN), false);
            LocalDateTime validTo = fixedWindowEnabled ? fixedTo : parseDate(row.get(VALID_TO_COLUMN), true);

            String groupKey = String.format("%s_%s_%s", code, validFrom, validTo);
            groups.computeIfAbsent(groupKey, key -> new RateFixtureRow(
                code,
                trimToEmpty(row.get(CURRENCY_COLUMN)),
                parseRate(row.get(rateColumn), code),
                validFrom,
                validTo));
        }
        return groups;
    }

    /**
     * @return the name of the rate column
     */
    private String requireColumns(Map<String, String> firstRow) {
        String rateColumn = firstRow.keySet().stream()
            .filter(column -> column.startsWith(RATE_COLUMN_PREFIX))
            .findFirst()
            .orElse(null);

        boolean datesPresent = fixedWindowEnabled
            || (firstRow.containsKey(VALID_FROM_COLUMN) && firstRow.containsKey(VALID_TO_COLUMN));

        if (rateColumn == null || !firstRow.containsKey(CODE_COLUMN)
                || !firstRow.containsKey(CURRENCY_COLUMN) || !datesPresent) {
            throw new IllegalStateException("Required columns not found in CSV file");
        }
        return rateColumn;
    }

    private Currency getOrCreateCurrency(RateFixtureRow row, Instant now) {
        return currencyRepository.findByCode(row.getCurrencyCode())
            .orElseGet(() -> {
                Currency currency = currencyRepository.save(
                    new Currency(row.getCurrencyCode(), row.getCurrencyName(), now));
                log.debug("Created currency {} ({})", currency.getCode(), currency.getName());
                return currency;
            });
    }

    private void checkForConflict(Currency currency, RateFixtureRow row) {
        List<ExchangeRate> overlapping = exchangeRateRepository.findOverlappingRates(
            currency, row.getValidFrom(), row.getValidTo());
        if (!overlapping.isEmpty()) {
            ExchangeRate existing = overlapping.get(0);
            throw new RateConflictException(String.format(
                "Conflict detected for %s: existing rate (ID=%d) from %s to %s overlaps new CSV range %s to %s.",
                currency.getCode(),
                existing.getId(),
                existing.getValidFrom().format(DATE_TIME_FORMAT),
                existing.getValidTo().format(DATE_TIME_FORMAT),
                row.getValidFrom().format(DATE_TIME_FORMAT),
                row.getValidTo().format(DATE_TIME_FORMAT)));
        }
    }

    private BigDecimal parseRate(String raw, String code) {
        try {
            return new BigDecimal(trimToEmpty(raw));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                String.format("Invalid rate '%s' for currency %s", raw, code), e);
        }
    }

    /**
     * Accepts {@code yyyy-MM-dd HH:mm:ss} as an exact timestamp, or {@code dd/MM/yyyy}
     * as the start or end of that day.
     */
    static LocalDateTime parseDate(String raw, boolean isEnd) {
        String value = trimToEmpty(raw);
        try {
            if (value.contains("/")) {
                LocalDate date = LocalDate.parse(value, DATE_FORMAT);
                return isEnd ? date.atTime(END_OF_DAY) : date.atStartOfDay();
            }
            return LocalDateTime.parse(value, DATE_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(String.format(
                "Unrecognized date format: '%s'. Expected 'dd/MM/yyyy' or 'yyyy-MM-dd HH:mm:ss'.", value), e);
        }
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
