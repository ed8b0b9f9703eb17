package com.proofly.backend.services.uploads;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.TransactionType;
import com.proofly.backend.enums.UploadStatus;
import com.proofly.backend.repositories.FileUploadRepository;
import com.proofly.backend.repositories.FinancialTransactionRepository;

/**
 * Runs without a surrounding test transaction: every gate method commits in its own
 * transaction, so the rows it works on must already be committed.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(UploadStatusGate.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class UploadStatusGateIntegrationTest {

    @Autowired
    UploadStatusGate statusGate;

    @Autowired
    FileUploadRepository uploadRepository;

    @Autowired
    FinancialTransactionRepository transactionRepository;

    @AfterEach
    void cleanUp() {
        transactionRepository.deleteAll();
        uploadRepository.deleteAll();
    }

    @Test
    void claim_onlyOnce() {
        UUID id = uploadRepository.save(upload(UploadStatus.UPLOADED)).getId();

        assertThat(statusGate.claim(id)).isPresent();
        assertThat(statusGate.claim(id)).isEmpty();

        FileUpload stored = uploadRepository.findById(id).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(UploadStatus.PROCESSING);
        assertThat(stored.getProcessingStartedAt()).isNotNull();
    }

    @Test
    void markFailed_removesTransactionsAlreadyMaterialized() {
        FileUpload upload = uploadRepository.save(upload(UploadStatus.PROCESSING));
        transactionRepository.saveAll(List.of(transaction(upload), transaction(upload)));

        assertThat(statusGate.markFailed(upload.getId(), "  boom  ")).isTrue();

        FileUpload stored = uploadRepository.findById(upload.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(UploadStatus.FAILED);
        assertThat(stored.getErrorMessage()).isEqualTo("boom");
        assertThat(transactionRepository.countByUploadId(upload.getId())).isZero();
    }

    @Test
    void markFailed_terminalUpload_isLeftAlone() {
        FileUpload upload = uploadRepository.save(upload(UploadStatus.AWAITING_REVIEW));
        transactionRepository.save(transaction(upload));

        assertThat(statusGate.markFailed(upload.getId(), "late failure")).isFalse();
        assertThat(statusGate.markAwaitingReview(upload.getId(), "DELIMITED_TEXT", 1, 0, 0, 1, false)).isFalse();

        assertThat(uploadRepository.findById(upload.getId()).orElseThrow().getStatus())
                .isEqualTo(UploadStatus.AWAITING_REVIEW);
        assertThat(transactionRepository.countByUploadId(upload.getId())).isEqualTo(1);
    }

    @Test
    void discardIfFailed_onlyTouchesFailedUploads() {
        FileUpload failed = uploadRepository.save(upload(UploadStatus.FAILED));
        FileUpload reviewed = uploadRepository.save(upload(UploadStatus.AWAITING_REVIEW));
        transactionRepository.save(transaction(failed));
        transactionRepository.save(transaction(reviewed));

        assertThat(statusGate.discardIfFailed(failed.getId())).isEqualTo(1);
        assertThat(statusGate.discardIfFailed(reviewed.getId())).isZero();
        assertThat(transactionRepository.countByUploadId(reviewed.getId())).isEqualTo(1);
    }

    private static FileUpload upload(UploadStatus status) {
        FileUpload upload = new FileUpload();
        upload.setUserId(UUID.randomUUID());
        upload.setOriginalFilename("statement.csv");
        upload.setFileSize(3);
        upload.setFileBytes(new byte[] {1, 2, 3});
        upload.setStatus(status);
        return upload;
    }

    private static FinancialTransaction transaction(FileUpload upload) {
        return FinancialTransaction.builder()
                .userId(upload.getUserId())
                .upload(upload)
                .transactionDate(LocalDateTime.of(2024, 1, 15, 0, 0))
                .amount(new BigDecimal("100.00"))
                .transactionType(TransactionType.EXPENSE)
                .sourcePlatform("gcash")
                .build();
    }
}
