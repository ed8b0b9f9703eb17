package com.proofly.backend.services.categorization;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.config.CategorizationProperties;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.repositories.FinancialTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes AI verdicts onto the submitted transactions. Rows are re-read here, so when two jobs
 * cover the same transaction the one that writes last wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategorizationResultWriter {

    private final FinancialTransactionRepository transactionRepository;
    private final CategorizationProperties properties;

    /**
     * @param submittedIds ids in the order they were sent, used for index joins only
     */
    @Transactional
    public MergeStats apply(UUID userId, List<UUID> submittedIds, List<CategorizationResult> results) {
        if (results == null || results.isEmpty()) {
            return new MergeStats(submittedIds.size(), 0, 0, 0, 0);
        }

        Map<String, FinancialTransaction> byId = new HashMap<>();
        for (FinancialTransaction tx : transactionRepository.findByUserIdAndIdIn(userId, submittedIds)) {
            byId.put(tx.getId().toString(), tx);
        }

        Set<String> touched = new HashSet<>();
        int unmatched = 0;
        int skippedVerified = 0;
        for (CategorizationResult result : results) {
            FinancialTransaction tx = resolve(result, byId, submittedIds);
            if (tx == null) {
                unmatched++;
                continue;
            }
            if (tx.isManuallyVerified()) {
                skippedVerified++;
                continue;
            }
            if (result.transactionType() != null) tx.setTransactionType(result.transactionType());
            if (result.category() != null) tx.setCategory(result.category());
            tx.setAiCategorized(true);
            tx.setAiConfidence(result.confidence());
            tx.setAiReasoning(trim(result.reasoning()));
            touched.add(tx.getId().toString());
        }

        transactionRepository.saveAll(byId.values().stream().filter(t -> touched.contains(t.getId().toString())).toList());

        if (unmatched > 0) {
            log.warn("[Categorization] userId={} results with unknown id={}", userId, unmatched);
        }
        return new MergeStats(submittedIds.size(), results.size(), touched.size(), unmatched, skippedVerified);
    }

    private FinancialTransaction resolve(CategorizationResult result,
                                         Map<String, FinancialTransaction> byId,
                                         List<UUID> submittedIds) {
        if (result.id() != null) {
            FinancialTransaction tx = byId.get(result.id());
            if (tx != null) return tx;
        }
        if (!properties.allowIndexJoin() || result.index() == null) {
            return null;
        }
        int idx = result.index();
        if (idx < 0 || idx >= submittedIds.size()) return null;
        log.warn("[Categorization] joining result by batch index {} (index joins are deprecated)", idx);
        return byId.get(submittedIds.get(idx).toString());
    }

    private static String trim(String reasoning) {
        if (reasoning == null) return null;
        return reasoning.length() <= 2000 ? reasoning : reasoning.substring(0, 1997) + "...";
    }
}
