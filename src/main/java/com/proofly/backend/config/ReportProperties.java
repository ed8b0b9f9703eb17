package com.proofly.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "proofly.reports")
public record ReportProperties(
        String verificationBaseUrl,
        Integer validityDays,
        Integer identityMaxAttempts
) {
    public ReportProperties {
        if (verificationBaseUrl == null || verificationBaseUrl.isBlank()) {
            verificationBaseUrl = "http://localhost:3000";
        }
        while (verificationBaseUrl.endsWith("/")) {
            verificationBaseUrl = verificationBaseUrl.substring(0, verificationBaseUrl.length() - 1);
        }
        if (validityDays == null || validityDays <= 0) {
            validityDays = 30;
        }
        if (identityMaxAttempts == null || identityMaxAttempts <= 0) {
            identityMaxAttempts = 20;
        }
    }

    public static ReportProperties defaults() {
        return new ReportProperties(null, null, null);
    }
}
