package com.proofly.backend.services.categorization;

import com.proofly.backend.enums.ConfidenceLevel;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;

/**
 * One AI verdict. {@code id} is the transaction id echoed by the model; {@code index} is only
 * consulted when index joins are enabled. Null type or category means "leave unchanged".
 */
public record CategorizationResult(
        String id,
        Integer index,
        TransactionType transactionType,
        TransactionCategory category,
        ConfidenceLevel confidence,
        String reasoning
) {}
