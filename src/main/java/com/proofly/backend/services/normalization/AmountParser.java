package com.proofly.backend.services.normalization;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses money strings such as {@code ₱1,500.00}, {@code (250.00)}, {@code 1.234,56 EUR} or {@code 300.00-}.
 * Thousands separators are inferred from the position of the last separator.
 */
@Slf4j
public final class AmountParser {

    private static final Map<String, String> CURRENCY_MARKERS = new LinkedHashMap<>();

    static {
        CURRENCY_MARKERS.put("PHP", "PHP");
        CURRENCY_MARKERS.put("USD", "USD");
        CURRENCY_MARKERS.put("EUR", "EUR");
        CURRENCY_MARKERS.put("SGD", "SGD");
        CURRENCY_MARKERS.put("₱", "PHP");
        CURRENCY_MARKERS.put("US$", "USD");
        CURRENCY_MARKERS.put("$", "USD");
        CURRENCY_MARKERS.put("€", "EUR");
    }

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");

    private AmountParser() {}

    public static ParsedAmount parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ParsedAmount(BigDecimal.ZERO, null, false);
        }

        String s = raw.trim().replace('\u00A0', ' ');
        String currency = null;
        String upper = s.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, String> e : CURRENCY_MARKERS.entrySet()) {
            int idx = upper.indexOf(e.getKey());
            if (idx >= 0) {
                if (currency == null) currency = e.getValue();
                s = s.substring(0, idx) + s.substring(idx + e.getKey().length());
                upper = s.toUpperCase(Locale.ROOT);
            }
        }

        s = s.replace(" ", "");
        // bare "P" prefix used on local statements, e.g. P1,500.00
        if (s.length() > 1 && (s.charAt(0) == 'P' || s.charAt(0) == 'p') && Character.isDigit(s.charAt(1))) {
            s = s.substring(1);
            if (currency == null) currency = "PHP";
        }

        boolean negative = false;
        if (s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1);
        }
        if (s.endsWith("-")) {
            negative = !negative;
            s = s.substring(0, s.length() - 1);
        }
        if (s.startsWith("-")) {
            negative = !negative;
            s = s.substring(1);
        } else if (s.startsWith("+")) {
            s = s.substring(1);
        }

        String digits = normalizeSeparators(s);
        if (digits == null || !NUMBER.matcher(digits).matches()) {
            log.warn("[AmountParser] could not parse amount: {}", raw);
            return new ParsedAmount(BigDecimal.ZERO, currency, false);
        }

        BigDecimal value = new BigDecimal(digits);
        return new ParsedAmount(negative ? value.negate() : value, currency, true);
    }

    /**
     * Strips thousands separators. The right-most of '.' or ',' is the decimal mark when both occur;
     * a lone ',' is decimal only when followed by one or two trailing digits.
     */
    static String normalizeSeparators(String s) {
        if (s.isEmpty()) return null;
        int lastDot = s.lastIndexOf('.');
        int lastComma = s.lastIndexOf(',');

        if (lastDot >= 0 && lastComma >= 0) {
            if (lastComma > lastDot) {
                return s.replace(".", "").replace(',', '.');
            }
            return s.replace(",", "");
        }
        if (lastComma >= 0) {
            int trailing = s.length() - lastComma - 1;
            boolean singleComma = s.indexOf(',') == lastComma;
            if (singleComma && trailing > 0 && trailing <= 2) {
                return s.replace(',', '.');
            }
            return s.replace(",", "");
        }
        return s;
    }
}
