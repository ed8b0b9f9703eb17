package com.proofly.backend.dto.reports;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.proofly.backend.entities.IncomeReport;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class IncomeReportResponseDTO {
    private UUID id;
    private String title;
    private String reportType;
    private String purpose;
    private String purposeDescription;
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private BigDecimal totalIncome;
    private BigDecimal totalExpenses;
    private BigDecimal netIncome;
    private BigDecimal averageMonthlyIncome;
    private int transactionCount;
    private Map<String, BigDecimal> incomeBreakdown;
    private Map<String, BigDecimal> expenseBreakdown;
    private Map<String, Map<String, BigDecimal>> monthlyTrends;
    private List<String> dataSources;
    private List<String> anomalies;
    private List<String> insights;
    private String summary;
    private int confidenceScore;
    private String status;
    private String errorMessage;
    private Long artifactSize;
    private String documentHash;
    private String verificationCode;
    private String verificationUrl;
    private String accessToken;
    private LocalDateTime expiresAt;
    private int downloadCount;
    private String signatureStatus;
    private LocalDateTime signatureSubmittedAt;
    private LocalDateTime signatureDecidedAt;
    private String signatureNotes;
    private LocalDateTime createdAt;
    private LocalDateTime generatedAt;

    public static IncomeReportResponseDTO from(IncomeReport r) {
        return IncomeReportResponseDTO.builder()
                .id(r.getId())
                .title(r.getTitle())
                .reportType(r.getReportType() != null ? r.getReportType().name() : null)
                .purpose(r.getPurpose() != null ? r.getPurpose().name() : null)
                .purposeDescription(r.getPurposeDescription())
                .dateFrom(r.getDateFrom())
                .dateTo(r.getDateTo())
                .totalIncome(r.getTotalIncome())
                .totalExpenses(r.getTotalExpenses())
                .netIncome(r.getNetIncome())
                .averageMonthlyIncome(r.getAverageMonthlyIncome())
                .transactionCount(r.getTransactionCount())
                .incomeBreakdown(r.getIncomeBreakdown())
                .expenseBreakdown(r.getExpenseBreakdown())
                .monthlyTrends(r.getMonthlyTrends())
                .dataSources(r.getDataSources())
                .anomalies(r.getAnomalies())
                .insights(r.getInsights())
                .summary(r.getSummary())
                .confidenceScore(r.getConfidenceScore())
                .status(r.getStatus() != null ? r.getStatus().name() : null)
                .errorMessage(r.getErrorMessage())
                .artifactSize(r.getArtifactSize())
                .documentHash(r.getDocumentHash())
                .verificationCode(r.getVerificationCode())
                .verificationUrl(r.getVerificationUrl())
                .accessToken(r.getAccessToken())
                .expiresAt(r.getExpiresAt())
                .downloadCount(r.getDownloadCount())
                .signatureStatus(r.getSignatureStatus() != null ? r.getSignatureStatus().name() : null)
                .signatureSubmittedAt(r.getSignatureSubmittedAt())
                .signatureDecidedAt(r.getSignatureDecidedAt())
                .signatureNotes(r.getSignatureNotes())
                .createdAt(r.getCreatedAt())
                .generatedAt(r.getGeneratedAt())
                .build();
    }
}
