package com.proofly.backend.services.normalization;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.proofly.backend.enums.TransactionType;

/**
 * Direction rules, strongest signal first: explicit type hint, description keywords, amount sign.
 */
public final class DirectionInference {

    static final List<String> INCOME_KEYWORDS = List.of("salary", "payment", "income", "received", "deposit", "credit");
    static final List<String> EXPENSE_KEYWORDS = List.of("purchase", "payment", "bill", "fee", "charge", "debit");

    private static final Set<String> EXPENSE_HINT_TOKENS = Set.of("debit", "dr", "expense", "out", "outgoing", "withdrawal", "sent");
    private static final Set<String> INCOME_HINT_TOKENS = Set.of("credit", "cr", "income", "in", "incoming", "deposit", "received");

    // a keyword listed on both sides says nothing about direction
    private static final List<String> INCOME_ONLY;
    private static final List<String> EXPENSE_ONLY;

    static {
        Set<String> shared = new LinkedHashSet<>(INCOME_KEYWORDS);
        shared.retainAll(EXPENSE_KEYWORDS);
        INCOME_ONLY = INCOME_KEYWORDS.stream().filter(k -> !shared.contains(k)).toList();
        EXPENSE_ONLY = EXPENSE_KEYWORDS.stream().filter(k -> !shared.contains(k)).toList();
    }

    private DirectionInference() {}

    public static Optional<TransactionType> fromHint(String hint) {
        if (hint == null || hint.isBlank()) return Optional.empty();
        String v = hint.trim().toLowerCase(Locale.ROOT);

        TransactionType exact = TransactionType.fromCode(v.replace(' ', '_').replace('-', '_'));
        if (exact != null && exact != TransactionType.OTHER) return Optional.of(exact);

        for (String token : v.split("[^a-z]+")) {
            if (EXPENSE_HINT_TOKENS.contains(token)) return Optional.of(TransactionType.EXPENSE);
        }
        for (String token : v.split("[^a-z]+")) {
            if (INCOME_HINT_TOKENS.contains(token)) return Optional.of(TransactionType.INCOME);
        }
        if (v.contains("debit") || v.contains("expense")) return Optional.of(TransactionType.EXPENSE);
        if (v.contains("credit") || v.contains("income")) return Optional.of(TransactionType.INCOME);
        return Optional.empty();
    }

    public static Optional<TransactionType> fromKeywords(String description) {
        if (description == null || description.isBlank()) return Optional.empty();
        String d = description.toLowerCase(Locale.ROOT);
        for (String k : INCOME_ONLY) {
            if (d.contains(k)) return Optional.of(TransactionType.INCOME);
        }
        for (String k : EXPENSE_ONLY) {
            if (d.contains(k)) return Optional.of(TransactionType.EXPENSE);
        }
        return Optional.empty();
    }

    public static TransactionType fromSign(BigDecimal signedAmount) {
        return signedAmount == null || signedAmount.signum() >= 0 ? TransactionType.INCOME : TransactionType.EXPENSE;
    }
}
