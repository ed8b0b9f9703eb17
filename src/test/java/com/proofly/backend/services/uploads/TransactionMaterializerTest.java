package com.proofly.backend.services.uploads;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.ConfidenceLevel;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.TransactionType;
import com.proofly.backend.repositories.FileUploadRepository;
import com.proofly.backend.repositories.FinancialTransactionRepository;
import com.proofly.backend.services.normalization.DirectionSource;
import com.proofly.backend.services.normalization.NormalizedTransaction;

@SuppressWarnings({"null", "unchecked"})
class TransactionMaterializerTest {

    private final FinancialTransactionRepository transactionRepository = Mockito.mock(FinancialTransactionRepository.class);
    private final FileUploadRepository uploadRepository = Mockito.mock(FileUploadRepository.class);

    private final TransactionMaterializer materializer = new TransactionMaterializer(transactionRepository, uploadRepository);

    @Test
    void materialize_appliesKeywordCategory_orFallsBackToOther() {
        UploadWork work = new UploadWork(UUID.randomUUID(), UUID.randomUUID(), "a.csv", new byte[0], null);
        when(uploadRepository.getReferenceById(work.uploadId())).thenReturn(new FileUpload());

        int created = materializer.materialize(work, List.of(
                row("Meralco bill", TransactionType.EXPENSE, List.of()),
                row("Something vague", TransactionType.EXPENSE, List.of("Unparseable amount 'x', defaulted to 0"))
        ), false);

        assertThat(created).isEqualTo(2);
        ArgumentCaptor<List<FinancialTransaction>> captor = ArgumentCaptor.forClass(List.class);
        verify(transactionRepository).saveAll(captor.capture());
        List<FinancialTransaction> saved = captor.getValue();

        assertThat(saved.get(0).getCategory()).isEqualTo(TransactionCategory.UTILITIES);
        assertThat(saved.get(0).getAiConfidence()).isEqualTo(ConfidenceLevel.LOW);
        assertThat(saved.get(0).getParseWarning()).isNull();
        assertThat(saved.get(0).getSourcePlatform()).isEqualTo("other");

        assertThat(saved.get(1).getCategory()).isEqualTo(TransactionCategory.OTHER);
        assertThat(saved.get(1).getAiConfidence()).isEqualTo(ConfidenceLevel.NONE);
        assertThat(saved.get(1).getParseWarning()).contains("Unparseable amount");
    }

    @Test
    void materialize_marksSyntheticRows() {
        UploadWork work = new UploadWork(UUID.randomUUID(), UUID.randomUUID(), "a.pdf", new byte[0], null);
        when(uploadRepository.getReferenceById(work.uploadId())).thenReturn(new FileUpload());

        materializer.materialize(work, List.of(row("Client Payment Received", TransactionType.INCOME, List.of())), true);

        ArgumentCaptor<List<FinancialTransaction>> captor = ArgumentCaptor.forClass(List.class);
        verify(transactionRepository).saveAll(captor.capture());
        assertThat(captor.getValue().get(0).getParseWarning()).isEqualTo(TransactionMaterializer.SYNTHETIC_NOTE);
    }

    @Test
    void materialize_nothingToSave_returnsZero() {
        UploadWork work = new UploadWork(UUID.randomUUID(), UUID.randomUUID(), "a.csv", new byte[0], null);

        assertThat(materializer.materialize(work, List.of(), false)).isZero();
        verify(transactionRepository, never()).saveAll(Mockito.anyList());
    }

    private static NormalizedTransaction row(String description, TransactionType type, List<String> warnings) {
        return new NormalizedTransaction(LocalDateTime.of(2024, 1, 15, 0, 0), new BigDecimal("100.00"), "PHP",
                description, null, null, type, DirectionSource.TYPE_HINT, warnings);
    }
}
