package com.proofly.backend.services.anomalies;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.repositories.FinancialTransactionRepository;
import com.proofly.backend.services.reports.scoring.CategoryDeviationDetector;
import com.proofly.backend.services.reports.scoring.CategoryDeviationDetector.Deviation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bulk anomaly detection: flags each transaction deviating more than 200% from its category
 * average and persists the flag with a reason. Existing flags are left as they are.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionAnomalyService {

    private final FinancialTransactionRepository transactionRepository;

    /**
     * @param transactionIds ids to scan; empty scans every transaction of the user
     */
    @Transactional
    public Map<String, Object> scan(UUID userId, Collection<UUID> transactionIds) {
        List<FinancialTransaction> transactions = transactionIds == null || transactionIds.isEmpty()
                ? transactionRepository.findByUserIdOrderByTransactionDateDesc(userId)
                : transactionRepository.findByUserIdAndIdIn(userId, transactionIds);

        List<Deviation> deviations = CategoryDeviationDetector.detect(transactions);
        List<Map<String, Object>> anomalies = new ArrayList<>();
        List<FinancialTransaction> changed = new ArrayList<>();
        for (Deviation d : deviations) {
            FinancialTransaction tx = d.transaction();
            tx.setAnomaly(true);
            tx.setAnomalyReason(d.reason());
            changed.add(tx);

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("transaction_id", tx.getId() != null ? tx.getId().toString() : null);
            row.put("amount", tx.getAmount());
            row.put("average_amount", d.categoryAverage());
            row.put("deviation_percentage", d.deviationPercentage());
            row.put("category", tx.getCategory() != null ? tx.getCategory().getCode() : null);
            row.put("reason", d.reason());
            anomalies.add(row);
        }
        transactionRepository.saveAll(changed);

        log.info("[AnomalyScan] userId={} checked={} flagged={}", userId, transactions.size(), anomalies.size());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total_transactions_checked", transactions.size());
        out.put("anomaly_count", anomalies.size());
        out.put("anomalies", anomalies);
        return out;
    }
}
