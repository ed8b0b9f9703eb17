package com.proofly.backend.dto.uploads;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import jakarta.validation.Valid;

public record UploadReviewRequest(
        @Valid
        List<TransactionReviewEdit> edits,
        Set<UUID> rejectedIds
) {
    public UploadReviewRequest {
        edits = edits == null ? List.of() : edits;
        rejectedIds = rejectedIds == null ? Set.of() : rejectedIds;
    }
}
