package com.currencyconverter.rates;

import com.currencyconverter.currency.Currency;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Exchange rate of one currency against GBP for a validity window.
 *
 * The rate is the number of units of the currency equal to 1 GBP: a USD rate
 * of 1.25 means 1 GBP = 1.25 USD. The window is inclusive at both ends.
 */
@Entity
@Table(name = "exchange_rates", indexes = {
    @Index(name = "idx_rate_currency_window", columnList = "currency_id, valid_from, valid_to")
})
@Data
@NoArgsConstructor
public class ExchangeRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "currency_id", nullable = false)
    private Currency currency;

    @Column(name = "units_per_gbp", nullable = false, precision = 15, scale = 8)
    private BigDecimal unitsPerGbp;

    @Column(name = "valid_from", nullable = false)
    private LocalDateTime validFrom;

    @Column(name = "valid_to", nullable = false)
    private LocalDateTime validTo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ExchangeRate(Currency currency, BigDecimal unitsPerGbp,
                        LocalDateTime validFrom, LocalDateTime validTo, Instant now) {
        if (unitsPerGbp == null || unitsPerGbp.signum() <= 0) {
            throw new IllegalArgumentException("Rate must be positive: " + unitsPerGbp);
        }
        if (validTo.isBefore(validFrom)) {
            throw new IllegalArgumentException(
                String.format("Rate window ends before it starts: %s to %s", validFrom, validTo));
        }
        this.currency = currency;
        this.unitsPerGbp = unitsPerGbp;
        this.validFrom = validFrom;
        this.validTo = validTo;
        this.createdAt = now;
        this.updatedAt = now;
    }
}
