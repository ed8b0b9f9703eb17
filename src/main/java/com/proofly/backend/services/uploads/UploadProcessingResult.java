package com.proofly.backend.services.uploads;

import java.util.UUID;

import com.proofly.backend.enums.UploadStatus;

/**
 * Outcome of one pipeline run. {@code executed} is false when the upload had already left
 * {@code UPLOADED} and the run was a no-op.
 */
public record UploadProcessingResult(
        UUID uploadId,
        UploadStatus status,
        boolean executed,
        int rowsRead,
        int rowsSkipped,
        int softFailures,
        int transactionsCreated,
        boolean syntheticData,
        String errorMessage
) {
    static UploadProcessingResult skipped(UUID uploadId, UploadStatus current) {
        return new UploadProcessingResult(uploadId, current, false, 0, 0, 0, 0, false, null);
    }

    static UploadProcessingResult failed(UUID uploadId, String message) {
        return new UploadProcessingResult(uploadId, UploadStatus.FAILED, true, 0, 0, 0, 0, false, message);
    }
}
