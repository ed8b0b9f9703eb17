package com.proofly.backend.dto.uploads;

import java.math.BigDecimal;
import java.util.UUID;

import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record TransactionReviewEdit(
        @NotNull(message = "id is required")
        UUID id,
        @PositiveOrZero(message = "amount must not be negative")
        BigDecimal amount,
        @Size(max = 1000)
        String description,
        TransactionType transactionType,
        TransactionCategory category,
        @Size(max = 255)
        String counterparty
) {}
