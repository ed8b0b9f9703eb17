package com.proofly.backend.enums;

public enum ReportStatus {
    GENERATING,
    COMPLETED,
    FAILED,
    EXPIRED
}
