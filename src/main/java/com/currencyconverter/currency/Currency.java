package com.currencyconverter.currency;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A currency known to the converter, identified by its ISO 4217 code.
 *
 * Exchange rates reference a currency; a currency may have many rates over
 * different validity windows.
 */
@Entity
@Table(name = "currencies", indexes = {
    @Index(name = "idx_currency_code", columnList = "code", unique = true)
})
@Data
@NoArgsConstructor
public class Currency {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Three-letter ISO 4217 code, always upper case (e.g. USD, EUR, GBP).
     */
    @Column(nullable = false, unique = true, length = 3)
    private String code;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Currency(String code, String name, Instant now) {
        this.code = code;
        this.name = name;
        this.createdAt = now;
        this.updatedAt = now;
    }
}
