package com.proofly.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-token prices used to estimate the USD cost of each AI call.
 */
@ConfigurationProperties(prefix = "proofly.ai")
public record AiUsageProperties(
        BigDecimal inputCostPerToken,
        BigDecimal outputCostPerToken
) {
    public AiUsageProperties {
        if (inputCostPerToken == null) {
            inputCostPerToken = new BigDecimal("0.00000015");
        }
        if (outputCostPerToken == null) {
            outputCostPerToken = new BigDecimal("0.0000006");
        }
    }

    public static AiUsageProperties defaults() {
        return new AiUsageProperties(null, null);
    }
}
