package com.proofly.backend.dto.transactions;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.proofly.backend.entities.FinancialTransaction;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FinancialTransactionResponseDTO {
    private UUID id;
    private UUID uploadId;
    private LocalDateTime transactionDate;
    private BigDecimal amount;
    private String currency;
    private String description;
    private String referenceNumber;
    private String counterparty;
    private String transactionType;
    private String category;
    private boolean aiCategorized;
    private String aiConfidence;
    private String aiReasoning;
    private boolean anomaly;
    private String anomalyReason;
    private boolean manuallyVerified;
    private String sourcePlatform;
    private String parseWarning;
    private LocalDateTime createdAt;

    public static FinancialTransactionResponseDTO from(FinancialTransaction tx) {
        return FinancialTransactionResponseDTO.builder()
                .id(tx.getId())
                .uploadId(tx.getUpload() != null ? tx.getUpload().getId() : null)
                .transactionDate(tx.getTransactionDate())
                .amount(tx.getAmount())
                .currency(tx.getCurrency())
                .description(tx.getDescription())
                .referenceNumber(tx.getReferenceNumber())
                .counterparty(tx.getCounterparty())
                .transactionType(tx.getTransactionType() != null ? tx.getTransactionType().getCode() : null)
                .category(tx.getCategory() != null ? tx.getCategory().getCode() : null)
                .aiCategorized(tx.isAiCategorized())
                .aiConfidence(tx.getAiConfidence() != null ? tx.getAiConfidence().getCode() : null)
                .aiReasoning(tx.getAiReasoning())
                .anomaly(tx.isAnomaly())
                .anomalyReason(tx.getAnomalyReason())
                .manuallyVerified(tx.isManuallyVerified())
                .sourcePlatform(tx.getSourcePlatform())
                .parseWarning(tx.getParseWarning())
                .createdAt(tx.getCreatedAt())
                .build();
    }
}
