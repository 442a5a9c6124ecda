package com.currencyconverter.conversion;

import com.currencyconverter.common.CurrencyCodes;
import com.currencyconverter.common.CurrencyRole;
import com.currencyconverter.common.exception.CurrencyNotFoundException;
import com.currencyconverter.common.exception.InvalidAmountException;
import com.currencyconverter.currency.CurrencyMetadata;
import com.currencyconverter.rates.RateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import static com.currencyconverter.common.ConverterConstants.RATE_PRECISION;

/**
 * Converts amounts between currencies using rates stored against GBP.
 *
 * Every cross-rate is triangulated through the base currency: with both rates
 * expressed as units per 1 GBP, the rate from A to B is {@code rate(B) / rate(A)}.
 * GBP itself has an implicit rate of exactly 1 and is never looked up.
 *
 * Stateless; safe to call from any number of request threads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrencyConverterService {

    private final RateStore rateStore;
    private final CurrencyMetadata currencyMetadata;

    /**
     * Get the unrounded exchange rate between two currencies.
     *
     * @param sourceCurrencyCode the currency converted from
     * @param destinationCurrencyCode the currency converted to
     * @return units of destination per 1 unit of source
     * @throws CurrencyNotFoundException if either currency is unknown or has no
     *         current rate; the source is checked first
     */
    public BigDecimal getRate(String sourceCurrencyCode, String destinationCurrencyCode) {
        String source = CurrencyCodes.normalize(sourceCurrencyCode);
        String destination = CurrencyCodes.normalize(destinationCurrencyCode);

        if (source.isEmpty()) {
            throw CurrencyNotFoundException.unknown(source, CurrencyRole.SOURCE);
        }
        if (destination.isEmpty()) {
            throw CurrencyNotFoundException.unknown(destination, CurrencyRole.DESTINATION);
        }
        if (source.equals(destination)) {
            return BigDecimal.ONE;
        }

        BigDecimal sourcePerBase = ratePerBase(source, CurrencyRole.SOURCE);
        BigDecimal destinationPerBase = ratePerBase(destination, CurrencyRole.DESTINATION);

        BigDecimal rate = destinationPerBase.divide(sourcePerBase, MathContext.DECIMAL128);
        log.debug("Cross rate {} -> {}: {} / {} = {}",
            source, destination, destinationPerBase, sourcePerBase, rate);
        return rate;
    }

    /**
     * Convert an amount from one currency to another.
     *
     * The rate is rounded to {@code RATE_PRECISION} places before it is applied,
     * so the returned rate is exactly the one used. The converted amount is
     * rounded to the destination currency's fraction digits. Both roundings are
     * half-up.
     *
     * @throws InvalidAmountException if the amount is null or negative
     * @throws CurrencyNotFoundException if either currency cannot be priced
     */
    public ConversionResult convert(String sourceCurrencyCode, String destinationCurrencyCode,
                                    BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new InvalidAmountException(amount);
        }

        String destination = CurrencyCodes.normalize(destinationCurrencyCode);
        log.info("Converting {} {} to {}", amount, CurrencyCodes.normalize(sourceCurrencyCode), destination);

        BigDecimal rate = getRate(sourceCurrencyCode, destination)
            .setScale(RATE_PRECISION, RoundingMode.HALF_UP);

        int decimalPlaces = currencyMetadata.fractionDigits(destination);
        BigDecimal destinationAmount = amount.multiply(rate)
            .setScale(decimalPlaces, RoundingMode.HALF_UP);

        log.debug("Converted {} at rate {} into {} {}", amount, rate, destinationAmount, destination);
        return new ConversionResult(destinationAmount, rate);
    }

    private BigDecimal ratePerBase(String currencyCode, CurrencyRole role) {
        if (CurrencyCodes.isBase(currencyCode)) {
            return BigDecimal.ONE;
        }
        return rateStore.currentRatePerBase(currencyCode)
            .orElseThrow(() -> rateStore.isKnownCurrency(currencyCode)
                ? CurrencyNotFoundException.noCurrentRate(currencyCode, role)
                : CurrencyNotFoundException.unknown(currencyCode, role));
    }
}
