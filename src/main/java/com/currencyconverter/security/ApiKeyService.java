package com.currencyconverter.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Service for issuing, checking and revoking API keys.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApiKeyService {

    private final ApiKeyRepository apiKeyRepository;
    private final Clock clock;

    /**
     * Look up an active key and record its use.
     *
     * @return the key, or empty if it does not exist or is inactive
     */
    @Transactional
    public Optional<ApiKey> authenticate(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return Optional.empty();
        }
        return apiKeyRepository.findByApiKeyAndActiveTrue(rawKey)
            .map(key -> {
                key.markUsed(clock.instant());
                return apiKeyRepository.save(key);
            });
    }

    @Transactional
    public ApiKey issue(String name) {
        ApiKey key = apiKeyRepository.save(ApiKey.generate(name, clock.instant()));
        log.info("Issued API key {} for {}", key.getId(), name);
        return key;
    }

    /**
     * Register a key with a fixed value unless one with that value already exists.
     */
    @Transactional
    public ApiKey registerIfAbsent(String name, String value) {
        return apiKeyRepository.findByApiKey(value)
            .orElseGet(() -> {
                ApiKey key = apiKeyRepository.save(new ApiKey(name, value, clock.instant()));
                log.info("Registered API key {} for {}", key.getId(), name);
                return key;
            });
    }

    @Transactional
    public void revoke(String value) {
        ApiKey key = apiKeyRepository.findByApiKey(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown API key"));
        key.setActive(false);
        apiKeyRepository.save(key);
        log.info("Revoked API key {} ({})", key.getId(), key.getName());
    }
}
