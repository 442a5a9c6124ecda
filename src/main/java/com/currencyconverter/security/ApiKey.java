package com.currencyconverter.security;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;

/**
 * API key granting access to the /api/ routes.
 *
 * Keys are 64 hex characters derived from 32 random bytes unless an explicit
 * value is registered. Inactive keys are rejected.
 */
@Entity
@Table(name = "api_keys")
@Data
@NoArgsConstructor
public class ApiKey {

    private static final SecureRandom RANDOM = new SecureRandom();

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "api_key", nullable = false, unique = true, length = 64)
    private String apiKey;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    public ApiKey(String name, String apiKey, Instant now) {
        this.name = name;
        this.apiKey = apiKey;
        this.createdAt = now;
    }

    public static ApiKey generate(String name, Instant now) {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return new ApiKey(name, HexFormat.of().formatHex(bytes), now);
    }

    public void markUsed(Instant now) {
        this.lastUsedAt = now;
    }
}
