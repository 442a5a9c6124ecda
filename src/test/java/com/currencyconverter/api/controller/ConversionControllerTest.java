package com.currencyconverter.api.controller;

import com.currencyconverter.currency.Currency;
import com.currencyconverter.currency.CurrencyRepository;
import com.currencyconverter.rates.ExchangeRate;
import com.currencyconverter.rates.ExchangeRateRepository;
import com.currencyconverter.security.ApiKeyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for the conversion endpoint, including API key checks.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class ConversionControllerTest {

    private static final String API_KEY = "test-api-key";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CurrencyRepository currencyRepository;

    @Autowired
    private ExchangeRateRepository exchangeRateRepository;

    @Autowired
    private ApiKeyRepository apiKeyRepository;

    @BeforeEach
    void setUp() {
        LocalDateTime now = LocalDateTime.now();
        saveRate("USD", "Dollar", "1.25", now.minusDays(1), now.plusDays(1));
        saveRate("EUR", "Euro", "1.15", now.minusDays(1), now.plusDays(1));
        saveRate("JPY", "Yen", "150.00", now.minusDays(1), now.plusDays(1));
        saveRate("CHF", "Franc", "1.20", now.minusDays(10), now.minusDays(5));
    }

    private void saveRate(String code, String name, String rate, LocalDateTime from, LocalDateTime to) {
        Currency currency = currencyRepository.save(new Currency(code, name, Instant.now()));
        exchangeRateRepository.save(new ExchangeRate(currency, new BigDecimal(rate), from, to, Instant.now()));
    }

    private ResultActions convert(String body) throws Exception {
        return mockMvc.perform(post("/api/v1/convert")
            .header("X-API-Key", API_KEY)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body));
    }

    @Test
    void testSuccessfulConversion() throws Exception {
        convert("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"EUR\",\"sourceAmount\":100.00}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sourceCurrency").value("USD"))
            .andExpect(jsonPath("$.destinationCurrency").value("EUR"))
            .andExpect(jsonPath("$.sourceAmount").value(100.0))
            .andExpect(jsonPath("$.destinationAmount").value(92.0))
            .andExpect(jsonPath("$.exchangeRate").value(0.92));
    }

    @Test
    void testConversionToYenHasNoDecimals() throws Exception {
        convert("{\"sourceCurrency\":\"usd\",\"destinationCurrency\":\"jpy\",\"sourceAmount\":100.00}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sourceCurrency").value("USD"))
            .andExpect(jsonPath("$.destinationCurrency").value("JPY"))
            .andExpect(jsonPath("$.destinationAmount").value(12000))
            .andExpect(jsonPath("$.exchangeRate").value(120.0));
    }

    @Test
    void testConversionFromAndToBaseCurrency() throws Exception {
        convert("{\"sourceCurrency\":\"GBP\",\"destinationCurrency\":\"EUR\",\"sourceAmount\":10.00}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.destinationAmount").value(11.5))
            .andExpect(jsonPath("$.exchangeRate").value(1.15));

        convert("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"GBP\",\"sourceAmount\":10.00}")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.destinationAmount").value(8.0))
            .andExpect(jsonPath("$.exchangeRate").value(0.8));
    }

    @Test
    void testMissingApiKey() throws Exception {
        mockMvc.perform(post("/api/v1/convert")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"EUR\",\"sourceAmount\":1}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.message").value("API key is required"));
    }

    @Test
    void testInvalidApiKey() throws Exception {
        mockMvc.perform(post("/api/v1/convert")
                .header("X-API-Key", "wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"EUR\",\"sourceAmount\":1}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.message").value("Invalid API key"));
    }

    @Test
    void testApiKeyUseIsRecorded() throws Exception {
        convert("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"EUR\",\"sourceAmount\":1}")
            .andExpect(status().isOk());

        assertNotNull(apiKeyRepository.findByApiKey(API_KEY).orElseThrow().getLastUsedAt());
    }

    @Test
    void testNegativeAmount() throws Exception {
        convert("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"EUR\",\"sourceAmount\":-100.00}")
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message").value("Validation failed"))
            .andExpect(jsonPath("$.errors.sourceAmount").value("Source amount must be positive"));
    }

    @Test
    void testMalformedCurrencyCode() throws Exception {
        convert("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"INVALID\",\"sourceAmount\":100.00}")
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errors.destinationCurrency").value("Invalid destination currency code"));
    }

    @Test
    void testMissingRequiredFields() throws Exception {
        convert("{\"sourceCurrency\":\"USD\"}")
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message").value("Validation failed"))
            .andExpect(jsonPath("$.errors.destinationCurrency").value("Destination currency is required"))
            .andExpect(jsonPath("$.errors.sourceAmount").value("Source amount is required"));
    }

    @Test
    void testIsoCurrencyWithoutStoredRate() throws Exception {
        convert("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"CAD\",\"sourceAmount\":100.00}")
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Destination currency \"CAD\" not found"));
    }

    @Test
    void testNonIsoCurrencyCode() throws Exception {
        convert("{\"sourceCurrency\":\"USD\",\"destinationCurrency\":\"ABC\",\"sourceAmount\":100}")
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message").value("Validation failed"))
            .andExpect(jsonPath("$.errors.destinationCurrency").value("Invalid destination currency code"));

        convert("{\"sourceCurrency\":\"abc\",\"destinationCurrency\":\"EUR\",\"sourceAmount\":100}")
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errors.sourceCurrency").value("Invalid source currency code"));
    }

    @Test
    void testCurrencyWithExpiredRate() throws Exception {
        convert("{\"sourceCurrency\":\"CHF\",\"destinationCurrency\":\"EUR\",\"sourceAmount\":100.00}")
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("No current rate found for source currency CHF"));
    }

    @Test
    void testMalformedJson() throws Exception {
        convert("{\"sourceCurrency\":")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid JSON"));
    }
}
