package com.proofly.backend.dto.transactions;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/** Partial update; null fields are left untouched. */
public record TransactionUpdateRequest(
        LocalDateTime transactionDate,
        @PositiveOrZero(message = "amount must not be negative")
        BigDecimal amount,
        TransactionType transactionType,
        TransactionCategory category,
        @Size(max = 1000)
        String description,
        @Size(max = 255)
        String referenceNumber,
        @Size(max = 255)
        String counterparty
) {}
