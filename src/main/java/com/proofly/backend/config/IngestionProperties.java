package com.proofly.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "proofly.ingestion")
public record IngestionProperties(
        String defaultCurrency,
        Integer sniffSampleBytes,
        Boolean syntheticFallbackEnabled,
        Long maxUploadBytes,
        Duration processingTimeout
) {
    public IngestionProperties {
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            defaultCurrency = "PHP";
        }
        if (sniffSampleBytes == null || sniffSampleBytes <= 0) {
            sniffSampleBytes = 1024;
        }
        if (syntheticFallbackEnabled == null) {
            syntheticFallbackEnabled = Boolean.TRUE;
        }
        if (maxUploadBytes == null || maxUploadBytes <= 0) {
            maxUploadBytes = 10L * 1024 * 1024;
        }
        if (processingTimeout == null || processingTimeout.isNegative() || processingTimeout.isZero()) {
            processingTimeout = Duration.ofMinutes(30);
        }
    }

    public static IngestionProperties defaults() {
        return new IngestionProperties(null, null, null, null, null);
    }
}
