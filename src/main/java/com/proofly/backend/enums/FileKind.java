package com.proofly.backend.enums;

public enum FileKind {
    BANK_STATEMENT,
    EWALLET_STATEMENT,
    RECEIPT,
    INVOICE,
    PAYSLIP,
    OTHER
}
