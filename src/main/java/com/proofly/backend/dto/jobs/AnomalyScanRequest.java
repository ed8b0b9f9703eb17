package com.proofly.backend.dto.jobs;

import java.util.List;
import java.util.UUID;

/** Empty or missing ids scan all of the user's transactions. */
public record AnomalyScanRequest(List<UUID> transactionIds) {
    public AnomalyScanRequest {
        transactionIds = transactionIds == null ? List.of() : List.copyOf(transactionIds);
    }
}
