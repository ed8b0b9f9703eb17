package com.proofly.backend.enums;

/**
 * Lifecycle of a categorization job: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}, or
 * {@code PENDING -> CANCELLED}. Transitions are conditional updates in {@code CategorizationJobGate}.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
}
