package com.currencyconverter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Currency Converter.
 *
 * Converts amounts between currencies using exchange rates stored relative to
 * GBP. Rates are seeded from CSV fixtures and every /api/ route requires an API key.
 */
@SpringBootApplication
public class CurrencyConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CurrencyConverterApplication.class, args);
    }
}
