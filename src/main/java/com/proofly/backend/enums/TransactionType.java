package com.proofly.backend.enums;

import java.util.Locale;

/**
 * Direction of a transaction. Amounts are stored as non-negative magnitudes;
 * the direction carries the sign.
 */
public enum TransactionType {
    INCOME("income"),
    EXPENSE("expense"),
    TRANSFER_IN("transfer_in"),
    TRANSFER_OUT("transfer_out"),
    FEE("fee"),
    REFUND("refund"),
    OTHER("other");

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static TransactionType fromCode(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (TransactionType t : values()) {
            if (t.code.equals(v)) return t;
        }
        return null;
    }
}
