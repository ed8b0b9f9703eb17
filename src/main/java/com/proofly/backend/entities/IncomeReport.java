package com.proofly.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import com.proofly.backend.enums.ReportPurpose;
import com.proofly.backend.enums.ReportStatus;
import com.proofly.backend.enums.ReportType;
import com.proofly.backend.enums.SignatureStatus;

import jakarta.persistence.Basic;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * A generated income statement together with its public verification identity
 * and signature review state.
 */
@Entity
@Table(name = "income_reports", indexes = {
        @Index(name = "idx_income_reports_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_income_reports_signature", columnList = "signature_status")
})
@Getter
@Setter
public class IncomeReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "owner_email")
    private String ownerEmail;

    @Column(name = "owner_name")
    private String ownerName;

    @Column(name = "title", nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "report_type", nullable = false, length = 16)
    private ReportType reportType = ReportType.CUSTOM;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, length = 32)
    private ReportPurpose purpose = ReportPurpose.OTHER;

    @Column(name = "purpose_description", length = 1000)
    private String purposeDescription;

    @Column(name = "date_from", nullable = false)
    private LocalDate dateFrom;

    @Column(name = "date_to", nullable = false)
    private LocalDate dateTo;

    @Column(name = "total_income", precision = 15, scale = 2)
    private BigDecimal totalIncome = BigDecimal.ZERO;

    @Column(name = "total_expenses", precision = 15, scale = 2)
    private BigDecimal totalExpenses = BigDecimal.ZERO;

    @Column(name = "net_income", precision = 15, scale = 2)
    private BigDecimal netIncome = BigDecimal.ZERO;

    @Column(name = "average_monthly_income", precision = 15, scale = 2)
    private BigDecimal averageMonthlyIncome = BigDecimal.ZERO;

    @Column(name = "transaction_count")
    private int transactionCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "income_breakdown")
    private Map<String, BigDecimal> incomeBreakdown = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "expense_breakdown")
    private Map<String, BigDecimal> expenseBreakdown = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "monthly_trends")
    private Map<String, Map<String, BigDecimal>> monthlyTrends = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "data_sources")
    private List<String> dataSources = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "anomalies")
    private List<String> anomalies = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "insights")
    private List<String> insights = new ArrayList<>();

    @Column(name = "summary", length = 4000)
    private String summary;

    @Column(name = "confidence_score")
    private int confidenceScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReportStatus status = ReportStatus.GENERATING;

    @Basic(fetch = FetchType.LAZY)
    @Column(name = "artifact_bytes", columnDefinition = "bytea")
    private byte[] artifactBytes;

    @Column(name = "artifact_size")
    private Long artifactSize;

    @Column(name = "document_hash", length = 64)
    private String documentHash;

    @Column(name = "verification_code", nullable = false, unique = true, updatable = false, length = 12)
    private String verificationCode;

    @Column(name = "access_token", nullable = false, unique = true, updatable = false, length = 64)
    private String accessToken;

    @Column(name = "verification_url", length = 500)
    private String verificationUrl;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "download_count", nullable = false)
    private int downloadCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "signature_status", nullable = false, length = 16)
    private SignatureStatus signatureStatus = SignatureStatus.NOT_SUBMITTED;

    @Column(name = "signature_submitted_at")
    private LocalDateTime signatureSubmittedAt;

    @Column(name = "signature_decided_by")
    private UUID signatureDecidedBy;

    @Column(name = "signature_decided_at")
    private LocalDateTime signatureDecidedAt;

    @Column(name = "signature_notes", length = 2000)
    private String signatureNotes;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Column(name = "generated_at")
    private LocalDateTime generatedAt;
}
