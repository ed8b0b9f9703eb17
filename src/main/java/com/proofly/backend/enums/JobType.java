package com.proofly.backend.enums;

public enum JobType {
    CATEGORIZE_TRANSACTIONS,
    GENERATE_SUMMARY,
    DETECT_ANOMALIES
}
