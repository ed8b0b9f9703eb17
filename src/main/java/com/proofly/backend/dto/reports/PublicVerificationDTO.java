package com.proofly.backend.dto.reports;

import java.time.LocalDate;
import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Data;

/**
 * What a third party sees when checking a verification code. No raw identifiers or tokens.
 */
@Data
@Builder
public class PublicVerificationDTO {
    private String verificationCode;
    private String documentTitle;
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private LocalDateTime createdAt;
    private String totalIncome;
    private String netIncome;
    private int confidenceScore;
    private String ownerEmail;
    private boolean verified;
    private String verificationStatus;
    private String message;
    private LocalDateTime decidedAt;
    private String adminNotes;
    private String documentHash;
    private boolean expired;
}
