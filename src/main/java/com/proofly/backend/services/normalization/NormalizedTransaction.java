package com.proofly.backend.services.normalization;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import com.proofly.backend.enums.TransactionType;

/**
 * Canonical fields of one input row. {@code amount} is the non-negative magnitude;
 * {@code warnings} lists soft parse failures that were defaulted.
 */
public record NormalizedTransaction(
        LocalDateTime transactionDate,
        BigDecimal amount,
        String currency,
        String description,
        String reference,
        String counterparty,
        TransactionType transactionType,
        DirectionSource directionSource,
        List<String> warnings
) {
    public NormalizedTransaction {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public String warningText() {
        return warnings.isEmpty() ? null : String.join("; ", warnings);
    }
}
