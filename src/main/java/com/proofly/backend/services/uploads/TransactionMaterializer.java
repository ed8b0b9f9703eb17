package com.proofly.backend.services.uploads;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.classification.rules.KeywordCategoryRules;
import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.ConfidenceLevel;
import com.proofly.backend.enums.SourcePlatform;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.repositories.FileUploadRepository;
import com.proofly.backend.repositories.FinancialTransactionRepository;
import com.proofly.backend.services.normalization.NormalizedTransaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists normalized rows of one upload as transactions, in a single transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionMaterializer {

    static final String SYNTHETIC_NOTE = "Synthetic sample row: no transactions were recognized in the document";

    private final FinancialTransactionRepository transactionRepository;
    private final FileUploadRepository uploadRepository;

    @Transactional
    public int materialize(UploadWork upload, List<NormalizedTransaction> rows, boolean synthetic) {
        if (rows == null || rows.isEmpty()) return 0;

        FileUpload ref = uploadRepository.getReferenceById(upload.uploadId());
        SourcePlatform source = upload.source() != null ? upload.source() : SourcePlatform.OTHER;

        List<FinancialTransaction> entities = new ArrayList<>(rows.size());
        for (NormalizedTransaction row : rows) {
            FinancialTransaction tx = FinancialTransaction.builder()
                    .userId(upload.userId())
                    .upload(ref)
                    .transactionDate(row.transactionDate())
                    .amount(row.amount())
                    .currency(row.currency())
                    .description(row.description())
                    .referenceNumber(row.reference())
                    .counterparty(row.counterparty())
                    .transactionType(row.transactionType())
                    .aiCategorized(false)
                    .sourcePlatform(source.getCode())
                    .parseWarning(warningFor(row, synthetic))
                    .build();

            KeywordCategoryRules.match(row.description(), row.transactionType())
                    .ifPresentOrElse(category -> {
                        tx.setCategory(category);
                        tx.setAiConfidence(ConfidenceLevel.LOW);
                    }, () -> {
                        tx.setCategory(TransactionCategory.OTHER);
                        tx.setAiConfidence(ConfidenceLevel.NONE);
                    });

            entities.add(tx);
        }

        transactionRepository.saveAll(entities);
        log.info("[Materializer] uploadId={} created={} synthetic={}", upload.uploadId(), entities.size(), synthetic);
        return entities.size();
    }

    private static String warningFor(NormalizedTransaction row, boolean synthetic) {
        String text = row.warningText();
        if (!synthetic) return text;
        return text == null ? SYNTHETIC_NOTE : SYNTHETIC_NOTE + "; " + text;
    }
}
