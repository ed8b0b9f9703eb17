package com.proofly.backend.dto.uploads;

import java.util.UUID;

public record UploadReviewResultDTO(
        UUID uploadId,
        String status,
        int rejected,
        int edited,
        long remaining
) {}
