package com.proofly.backend.dto.jobs;

import java.util.List;
import java.util.UUID;

/**
 * Selects the transactions to categorize: explicit ids, every transaction of one upload, or
 * the user's transactions not yet categorized by the AI service. The first one present wins.
 */
public record CategorizationJobRequest(
        List<UUID> transactionIds,
        UUID uploadId,
        Boolean uncategorizedOnly
) {
    public CategorizationJobRequest {
        transactionIds = transactionIds == null ? List.of() : List.copyOf(transactionIds);
    }

    public boolean wantsUncategorized() {
        return Boolean.TRUE.equals(uncategorizedOnly);
    }
}
