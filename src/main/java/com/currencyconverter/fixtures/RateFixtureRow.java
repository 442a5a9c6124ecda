package com.currencyconverter.fixtures;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One grouped CSV row ready to be stored.
 */
@Value
class RateFixtureRow {
    String currencyCode;
    String currencyName;
    BigDecimal unitsPerGbp;
    LocalDateTime validFrom;
    LocalDateTime validTo;
}
