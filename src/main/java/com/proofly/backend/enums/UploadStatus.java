package com.proofly.backend.enums;

/**
 * Processing state of an upload:
 * {@code UPLOADED -> PROCESSING -> AWAITING_REVIEW | FAILED}, then {@code AWAITING_REVIEW -> PROCESSED}.
 * Persisted transitions go through a compare-and-swap on the status column.
 */
public enum UploadStatus {
    UPLOADED,
    PROCESSING,
    AWAITING_REVIEW,
    PROCESSED,
    FAILED
}
