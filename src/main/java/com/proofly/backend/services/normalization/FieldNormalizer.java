package com.proofly.backend.services.normalization;

import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.proofly.backend.config.IngestionProperties;
import com.proofly.backend.enums.TransactionType;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps one loosely-named raw row onto {@link NormalizedTransaction}.
 * Returns empty when no date or no amount column has a value; the caller counts those as skipped.
 */
@Component
@Slf4j
public class FieldNormalizer {

    static final String NO_DESCRIPTION = "No description";

    private final String defaultCurrency;

    public FieldNormalizer(IngestionProperties properties) {
        this.defaultCurrency = properties.defaultCurrency();
    }

    public Optional<NormalizedTransaction> normalize(Map<String, String> rawRow) {
        if (rawRow == null || rawRow.isEmpty()) return Optional.empty();

        Map<String, String> row = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : rawRow.entrySet()) {
            String key = normalizeHeader(e.getKey());
            if (key.isEmpty() || e.getValue() == null) continue;
            row.putIfAbsent(key, e.getValue().trim());
        }

        String dateRaw = find(row, CanonicalField.DATE);
        if (dateRaw == null) return Optional.empty();

        String typeHint = find(row, CanonicalField.TYPE);
        String amountRaw = find(row, CanonicalField.AMOUNT);
        ParsedAmount amount;
        if (amountRaw != null) {
            amount = AmountParser.parse(amountRaw);
        } else {
            SplitAmount split = resolveSplitColumns(row);
            if (split == null) return Optional.empty();
            amountRaw = split.raw();
            amount = split.amount();
            if (typeHint == null) typeHint = split.hint();
        }

        List<String> warnings = new ArrayList<>();

        LocalDateTime date = DateParser.parse(dateRaw).orElse(null);
        if (date == null) {
            log.warn("[FieldNormalizer] could not parse date: {}, using current time", dateRaw);
            date = LocalDateTime.now();
            warnings.add("Unparseable date '" + abbreviate(dateRaw) + "', defaulted to processing time");
        }

        if (!amount.parsed()) {
            warnings.add("Unparseable amount '" + abbreviate(amountRaw) + "', defaulted to 0");
        }

        String description = find(row, CanonicalField.DESCRIPTION);
        if (description == null) description = NO_DESCRIPTION;

        TransactionType type;
        DirectionSource source;
        Optional<TransactionType> fromHint = DirectionInference.fromHint(typeHint);
        Optional<TransactionType> fromKeywords = DirectionInference.fromKeywords(description);
        if (fromHint.isPresent()) {
            type = fromHint.get();
            source = DirectionSource.TYPE_HINT;
        } else if (fromKeywords.isPresent()) {
            type = fromKeywords.get();
            source = DirectionSource.KEYWORD;
        } else {
            type = DirectionInference.fromSign(amount.value());
            source = DirectionSource.AMOUNT_SIGN;
        }

        return Optional.of(new NormalizedTransaction(
                date,
                amount.magnitude().setScale(2, RoundingMode.HALF_UP),
                resolveCurrency(row, amount),
                description,
                find(row, CanonicalField.REFERENCE),
                find(row, CanonicalField.COUNTERPARTY),
                type,
                source,
                warnings
        ));
    }

    /**
     * Lowercase, trimmed, with runs of spaces, dashes, dots and slashes collapsed to one underscore.
     * {@code "Transaction Date"} becomes {@code transaction_date}.
     */
    public static String normalizeHeader(String header) {
        if (header == null) return "";
        String h = header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
        h = h.replaceAll("[\\s\\-./]+", "_");
        h = h.replaceAll("^_+|_+$", "");
        return h;
    }

    private static String find(Map<String, String> row, CanonicalField field) {
        for (String alias : field.aliases()) {
            String v = row.get(alias);
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private record SplitAmount(String raw, ParsedAmount amount, String hint) {}

    private static SplitAmount resolveSplitColumns(Map<String, String> row) {
        String debitRaw = find(row, CanonicalField.DEBIT);
        String creditRaw = find(row, CanonicalField.CREDIT);
        if (debitRaw == null && creditRaw == null) return null;

        ParsedAmount debit = debitRaw != null ? AmountParser.parse(debitRaw) : null;
        ParsedAmount credit = creditRaw != null ? AmountParser.parse(creditRaw) : null;

        if (debit != null && debit.parsed() && debit.value().signum() != 0) {
            return new SplitAmount(debitRaw, new ParsedAmount(debit.magnitude().negate(), debit.currency(), true), "debit");
        }
        if (credit != null && credit.parsed() && credit.value().signum() != 0) {
            return new SplitAmount(creditRaw, new ParsedAmount(credit.magnitude(), credit.currency(), true), "credit");
        }
        if (credit != null) return new SplitAmount(creditRaw, credit, "credit");
        return new SplitAmount(debitRaw, debit, "debit");
    }

    private String resolveCurrency(Map<String, String> row, ParsedAmount amount) {
        String explicit = find(row, CanonicalField.CURRENCY);
        if (explicit != null && explicit.trim().matches("[A-Za-z]{3}")) {
            return explicit.trim().toUpperCase(Locale.ROOT);
        }
        if (amount.currency() != null) return amount.currency();
        return defaultCurrency;
    }

    private static String abbreviate(String value) {
        if (value == null) return "";
        return value.length() <= 40 ? value : value.substring(0, 37) + "...";
    }
}
