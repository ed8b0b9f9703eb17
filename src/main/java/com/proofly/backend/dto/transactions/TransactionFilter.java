package com.proofly.backend.dto.transactions;

import java.time.LocalDate;

import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

public record TransactionFilter(
        TransactionType transactionType,
        TransactionCategory category,
        String source,
        String search,
        LocalDate dateFrom,
        LocalDate dateTo
) {
    public static TransactionFilter none() {
        return new TransactionFilter(null, null, null, null, null, null);
    }
}
