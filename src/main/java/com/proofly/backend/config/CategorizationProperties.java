package com.proofly.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "proofly.categorization")
public record CategorizationProperties(
        Duration jobTimeout,
        boolean allowIndexJoin,
        Integer maxBatchSize,
        Integer summaryContextLimit,
        Integer summaryMaxTokens
) {
    public CategorizationProperties {
        if (jobTimeout == null || jobTimeout.isNegative() || jobTimeout.isZero()) {
            jobTimeout = Duration.ofMinutes(10);
        }
        if (maxBatchSize == null || maxBatchSize <= 0) {
            maxBatchSize = 300;
        }
        if (summaryContextLimit == null || summaryContextLimit <= 0) {
            summaryContextLimit = 50;
        }
        if (summaryMaxTokens == null || summaryMaxTokens <= 0) {
            summaryMaxTokens = 2000;
        }
    }

    public static CategorizationProperties defaults() {
        return new CategorizationProperties(null, false, null, null, null);
    }
}
