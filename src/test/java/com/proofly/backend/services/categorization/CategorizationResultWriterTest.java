package com.proofly.backend.services.categorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import com.proofly.backend.config.CategorizationProperties;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.ConfidenceLevel;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;
import com.proofly.backend.repositories.FinancialTransactionRepository;

@SuppressWarnings("null")
class CategorizationResultWriterTest {

    private final FinancialTransactionRepository transactionRepository = Mockito.mock(FinancialTransactionRepository.class);
    private final UUID userId = UUID.randomUUID();

    private CategorizationResultWriter writer(boolean allowIndexJoin) {
        return new CategorizationResultWriter(transactionRepository,
                new CategorizationProperties(null, allowIndexJoin, null, null, null));
    }

    @Test
    void apply_joinsById_andRecordsAiFields() {
        FinancialTransaction tx = tx(false);
        when(transactionRepository.findByUserIdAndIdIn(userId, List.of(tx.getId()))).thenReturn(List.of(tx));

        MergeStats stats = writer(false).apply(userId, List.of(tx.getId()), List.of(
                new CategorizationResult(tx.getId().toString(), 0, TransactionType.INCOME, TransactionCategory.FREELANCE,
                        ConfidenceLevel.HIGH, "Upwork")));

        assertThat(stats.updated()).isEqualTo(1);
        assertThat(tx.getCategory()).isEqualTo(TransactionCategory.FREELANCE);
        assertThat(tx.getTransactionType()).isEqualTo(TransactionType.INCOME);
        assertThat(tx.isAiCategorized()).isTrue();
        assertThat(tx.getAiConfidence()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(tx.getAiReasoning()).isEqualTo("Upwork");
    }

    @Test
    void apply_overlappingJobs_lastWriteWins() {
        FinancialTransaction tx = tx(false);
        when(transactionRepository.findByUserIdAndIdIn(userId, List.of(tx.getId()))).thenReturn(List.of(tx));
        CategorizationResultWriter writer = writer(false);

        writer.apply(userId, List.of(tx.getId()), List.of(
                new CategorizationResult(tx.getId().toString(), null, null, TransactionCategory.FOOD, ConfidenceLevel.LOW, null)));
        writer.apply(userId, List.of(tx.getId()), List.of(
                new CategorizationResult(tx.getId().toString(), null, null, TransactionCategory.RENT, ConfidenceLevel.HIGH, null)));

        assertThat(tx.getCategory()).isEqualTo(TransactionCategory.RENT);
        assertThat(tx.getAiConfidence()).isEqualTo(ConfidenceLevel.HIGH);
    }

    @Test
    void apply_neverOverwritesManuallyVerifiedTransaction() {
        FinancialTransaction verified = tx(true);
        verified.setCategory(TransactionCategory.SALARY);
        when(transactionRepository.findByUserIdAndIdIn(userId, List.of(verified.getId()))).thenReturn(List.of(verified));

        MergeStats stats = writer(false).apply(userId, List.of(verified.getId()), List.of(
                new CategorizationResult(verified.getId().toString(), null, null, TransactionCategory.FOOD, ConfidenceLevel.HIGH, null)));

        assertThat(stats.skippedVerified()).isEqualTo(1);
        assertThat(stats.updated()).isZero();
        assertThat(verified.getCategory()).isEqualTo(TransactionCategory.SALARY);
        assertThat(verified.isAiCategorized()).isFalse();
    }

    @Test
    void apply_unknownId_isCountedAndIgnored() {
        FinancialTransaction tx = tx(false);
        when(transactionRepository.findByUserIdAndIdIn(userId, List.of(tx.getId()))).thenReturn(List.of(tx));

        MergeStats stats = writer(false).apply(userId, List.of(tx.getId()), List.of(
                new CategorizationResult(UUID.randomUUID().toString(), null, null, TransactionCategory.FOOD, ConfidenceLevel.HIGH, null)));

        assertThat(stats.unmatched()).isEqualTo(1);
        assertThat(stats.updated()).isZero();
        assertThat(tx.getCategory()).isEqualTo(TransactionCategory.OTHER);
    }

    @Test
    void apply_indexOnlyResult_usedOnlyWhenIndexJoinAllowed() {
        FinancialTransaction tx = tx(false);
        when(transactionRepository.findByUserIdAndIdIn(userId, List.of(tx.getId()))).thenReturn(List.of(tx));
        List<CategorizationResult> indexOnly = List.of(
                new CategorizationResult(null, 0, null, TransactionCategory.FOOD, ConfidenceLevel.MEDIUM, null));

        MergeStats disabled = writer(false).apply(userId, List.of(tx.getId()), indexOnly);
        assertThat(disabled.unmatched()).isEqualTo(1);
        assertThat(tx.getCategory()).isEqualTo(TransactionCategory.OTHER);

        MergeStats enabled = writer(true).apply(userId, List.of(tx.getId()), indexOnly);
        assertThat(enabled.updated()).isEqualTo(1);
        assertThat(tx.getCategory()).isEqualTo(TransactionCategory.FOOD);
    }

    @Test
    void apply_emptyResults_updatesNothing() {
        MergeStats stats = writer(false).apply(userId, List.of(UUID.randomUUID()), List.of());

        assertThat(stats.submitted()).isEqualTo(1);
        assertThat(stats.updated()).isZero();
    }

    private FinancialTransaction tx(boolean manuallyVerified) {
        return FinancialTransaction.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .transactionType(TransactionType.EXPENSE)
                .manuallyVerified(manuallyVerified)
                .build();
    }
}
