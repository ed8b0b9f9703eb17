package com.proofly.backend.services.reports;

import java.time.LocalDateTime;
import java.util.Base64;
import java.util.Random;

import org.springframework.stereotype.Service;

import com.proofly.backend.config.ReportProperties;
import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.repositories.IncomeReportRepository;
import com.proofly.backend.services.util.HashUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues the public identity of a report: a 12-character verification code, an opaque access
 * token and the verification URL. Both identifiers are checked against existing reports before
 * use; the unique constraints on the table settle any race that slips past the check.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportIdentityService {

    public static final int CODE_LENGTH = 12;
    static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int TOKEN_BYTES = 32;

    private final IncomeReportRepository reportRepository;
    private final ReportProperties properties;
    private final Random verificationRandom;

    /** Assigns a fresh code, token, URL and expiry. Called again when an insert hits a collision. */
    public void issue(IncomeReport report) {
        String code = uniqueCode();
        report.setVerificationCode(code);
        report.setAccessToken(uniqueToken());
        report.setVerificationUrl(verificationUrl(code));
        if (report.getExpiresAt() == null) {
            report.setExpiresAt(LocalDateTime.now().plusDays(properties.validityDays()));
        }
    }

    public String verificationUrl(String code) {
        return properties.verificationBaseUrl() + "/verify/" + code;
    }

    /**
     * Stores the finished artifact and its SHA-256. The hash is written once; a report that
     * already carries one is rejected.
     */
    public void attachArtifact(IncomeReport report, byte[] artifact) {
        if (report.getDocumentHash() != null) {
            throw new IllegalStateException("Report " + report.getId() + " already has a finalized artifact");
        }
        if (artifact == null || artifact.length == 0) {
            throw new IllegalArgumentException("Artifact is empty");
        }
        report.setArtifactBytes(artifact);
        report.setArtifactSize((long) artifact.length);
        report.setDocumentHash(HashUtil.sha256Hex(artifact));
    }

    String uniqueCode() {
        for (int attempt = 1; attempt <= properties.identityMaxAttempts(); attempt++) {
            String candidate = randomCode();
            if (!reportRepository.existsByVerificationCode(candidate)) {
                return candidate;
            }
            log.warn("[ReportIdentity] verification code collision attempt={}", attempt);
        }
        throw new IllegalStateException("Could not allocate a unique verification code");
    }

    String uniqueToken() {
        for (int attempt = 1; attempt <= properties.identityMaxAttempts(); attempt++) {
            String candidate = randomToken();
            if (!reportRepository.existsByAccessToken(candidate)) {
                return candidate;
            }
            log.warn("[ReportIdentity] access token collision attempt={}", attempt);
        }
        throw new IllegalStateException("Could not allocate a unique access token");
    }

    private String randomCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(CODE_ALPHABET.charAt(verificationRandom.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    private String randomToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        verificationRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
