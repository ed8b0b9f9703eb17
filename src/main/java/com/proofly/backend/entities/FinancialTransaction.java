package com.proofly.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.proofly.backend.enums.ConfidenceLevel;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A single money movement owned by one user. {@link #amount} is always a
 * non-negative magnitude; {@link #type} carries the direction.
 */
@Entity
@Table(name = "financial_transactions", indexes = {
        @Index(name = "idx_fin_tx_user_date", columnList = "user_id, transaction_date"),
        @Index(name = "idx_fin_tx_user_category", columnList = "user_id, category"),
        @Index(name = "idx_fin_tx_upload", columnList = "upload_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinancialTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "upload_id")
    private FileUpload upload;

    @Column(name = "transaction_date", nullable = false)
    private LocalDateTime transactionDate;

    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    @Builder.Default
    private String currency = "PHP";

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "reference_number")
    private String referenceNumber;

    @Column(name = "counterparty")
    private String counterparty;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 32)
    private TransactionType transactionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", length = 32)
    @Builder.Default
    private TransactionCategory category = TransactionCategory.OTHER;

    @Column(name = "ai_categorized", nullable = false)
    private boolean aiCategorized;

    @Enumerated(EnumType.STRING)
    @Column(name = "ai_confidence", length = 16)
    private ConfidenceLevel aiConfidence;

    @Column(name = "ai_reasoning", length = 2000)
    private String aiReasoning;

    @Column(name = "anomaly", nullable = false)
    private boolean anomaly;

    @Column(name = "anomaly_reason", length = 500)
    private String anomalyReason;

    @Column(name = "manually_verified", nullable = false)
    private boolean manuallyVerified;

    @Column(name = "source_platform", length = 32)
    private String sourcePlatform;

    @Column(name = "parse_warning", length = 500)
    private String parseWarning;

    @Column(name = "created_at", nullable = false, updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
