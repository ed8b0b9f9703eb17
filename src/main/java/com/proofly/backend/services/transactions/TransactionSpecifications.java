package com.proofly.backend.services.transactions;

import java.time.LocalTime;
import java.util.Locale;
import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;

import com.proofly.backend.dto.transactions.TransactionFilter;
import com.proofly.backend.entities.FinancialTransaction;

final class TransactionSpecifications {

    private TransactionSpecifications() {}

    static Specification<FinancialTransaction> forUser(UUID userId, TransactionFilter filter) {
        Specification<FinancialTransaction> spec = (root, query, cb) -> cb.equal(root.get("userId"), userId);
        if (filter == null) {
            return spec;
        }
        if (filter.transactionType() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("transactionType"), filter.transactionType()));
        }
        if (filter.category() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("category"), filter.category()));
        }
        if (filter.source() != null && !filter.source().isBlank()) {
            String source = filter.source().trim().toLowerCase(Locale.ROOT);
            spec = spec.and((root, query, cb) -> cb.equal(root.get("sourcePlatform"), source));
        }
        if (filter.search() != null && !filter.search().isBlank()) {
            String pattern = "%" + filter.search().trim().toLowerCase(Locale.ROOT) + "%";
            spec = spec.and((root, query, cb) -> cb.or(
                    cb.like(cb.lower(root.get("description")), pattern),
                    cb.like(cb.lower(root.get("counterparty")), pattern),
                    cb.like(cb.lower(root.get("referenceNumber")), pattern)));
        }
        if (filter.dateFrom() != null) {
            spec = spec.and((root, query, cb) ->
                    cb.greaterThanOrEqualTo(root.get("transactionDate"), filter.dateFrom().atStartOfDay()));
        }
        if (filter.dateTo() != null) {
            spec = spec.and((root, query, cb) ->
                    cb.lessThanOrEqualTo(root.get("transactionDate"), filter.dateTo().atTime(LocalTime.MAX)));
        }
        return spec;
    }
}
