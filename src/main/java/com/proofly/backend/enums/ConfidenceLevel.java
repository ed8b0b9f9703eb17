package com.proofly.backend.enums;

import java.util.Locale;

public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    VERY_LOW("very_low"),
    NONE("none");

    private final String code;

    ConfidenceLevel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ConfidenceLevel fromCode(String raw, ConfidenceLevel fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        String v = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (ConfidenceLevel c : values()) {
            if (c.code.equals(v)) return c;
        }
        return fallback;
    }
}
