package com.proofly.backend.dto.transactions;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * A manually entered transaction. The amount is a magnitude; {@code transactionType} gives the direction.
 */
public record TransactionRequestDTO(
        @NotNull(message = "transactionDate is required")
        LocalDateTime transactionDate,

        @NotNull(message = "amount is required")
        @PositiveOrZero(message = "amount must not be negative")
        BigDecimal amount,

        @NotNull(message = "transactionType is required")
        TransactionType transactionType,

        TransactionCategory category,

        @Size(max = 1000)
        String description,

        @Size(max = 255)
        String referenceNumber,

        @Size(max = 255)
        String counterparty,

        @Size(min = 3, max = 3, message = "currency must be a 3-letter code")
        String currency
) {}
