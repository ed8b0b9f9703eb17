package com.proofly.backend.services.normalization;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical transaction fields and the header spellings accepted for each, in preference order.
 * Headers are compared after {@link FieldNormalizer#normalizeHeader(String)}.
 */
public enum CanonicalField {
    DATE,
    AMOUNT,
    DEBIT,
    CREDIT,
    DESCRIPTION,
    REFERENCE,
    TYPE,
    COUNTERPARTY,
    CURRENCY;

    public static final Map<CanonicalField, List<String>> ALIASES;

    static {
        Map<CanonicalField, List<String>> m = new EnumMap<>(CanonicalField.class);
        m.put(DATE, List.of("date", "transaction_date", "txn_date", "datetime", "posting_date", "posted_date", "value_date"));
        m.put(AMOUNT, List.of("amount", "value", "sum", "total"));
        m.put(DEBIT, List.of("debit", "withdrawal", "withdrawals", "debit_amount", "money_out"));
        m.put(CREDIT, List.of("credit", "deposit", "deposits", "credit_amount", "money_in"));
        m.put(DESCRIPTION, List.of("description", "details", "memo", "reference", "particulars", "narration", "remarks"));
        m.put(REFERENCE, List.of("reference", "ref", "transaction_id", "txn_id", "reference_number", "ref_no"));
        m.put(TYPE, List.of("type", "transaction_type", "txn_type", "debit_credit", "direction", "dr_cr"));
        m.put(COUNTERPARTY, List.of("counterparty", "payee", "payer", "recipient", "sender", "merchant"));
        m.put(CURRENCY, List.of("currency", "ccy", "currency_code"));
        ALIASES = Collections.unmodifiableMap(m);
    }

    public List<String> aliases() {
        return ALIASES.get(this);
    }
}
