package com.proofly.backend.enums;

public enum ReportType {
    MONTHLY,
    QUARTERLY,
    ANNUAL,
    CUSTOM
}
