package com.currencyconverter.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Registers the configured bootstrap key at startup so a fresh install can be called.
 */
@Component
@Slf4j
public class ApiKeyBootstrap implements ApplicationRunner {

    private final ApiKeyService apiKeyService;
    private final String bootstrapKey;

    public ApiKeyBootstrap(ApiKeyService apiKeyService,
                           @Value("${converter.security.bootstrap-key:}") String bootstrapKey) {
        this.apiKeyService = apiKeyService;
        this.bootstrapKey = bootstrapKey;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (bootstrapKey.isBlank()) {
            log.info("No bootstrap API key configured");
            return;
        }
        apiKeyService.registerIfAbsent("bootstrap", bootstrapKey);
    }
}
