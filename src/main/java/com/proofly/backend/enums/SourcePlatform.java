package com.proofly.backend.enums;

import java.util.Locale;

public enum SourcePlatform {
    GCASH("gcash", "GCash"),
    PAYMAYA("paymaya", "PayMaya"),
    GRABPAY("grabpay", "GrabPay"),
    COINS_PH("coins_ph", "Coins.ph"),
    BPI("bpi", "BPI"),
    BDO("bdo", "BDO"),
    METROBANK("metrobank", "Metrobank"),
    UNIONBANK("unionbank", "UnionBank"),
    SECURITY_BANK("security_bank", "Security Bank"),
    PNB("pnb", "PNB"),
    LANDBANK("landbank", "Landbank"),
    OTHER_BANK("other_bank", "Other Bank"),
    OTHER_EWALLET("other_ewallet", "Other E-wallet"),
    MANUAL_ENTRY("manual_entry", "Manual Entry"),
    OTHER("other", "Other");

    private final String code;
    private final String displayName;

    SourcePlatform(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isEwallet() {
        return this == GCASH || this == PAYMAYA || this == GRABPAY || this == COINS_PH || this == OTHER_EWALLET;
    }

    public static SourcePlatform fromCode(String raw) {
        if (raw == null || raw.isBlank()) return OTHER;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (SourcePlatform p : values()) {
            if (p.code.equals(v) || p.name().equalsIgnoreCase(v)) return p;
        }
        return OTHER;
    }
}
