package com.proofly.backend.dto.transactions;

import java.util.List;
import java.util.UUID;

import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record TransactionBulkUpdateRequest(
        @NotEmpty(message = "transactionIds must not be empty")
        @Size(max = 500)
        List<UUID> transactionIds,
        TransactionCategory category,
        TransactionType transactionType
) {}
