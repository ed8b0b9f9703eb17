package com.proofly.backend.services.uploads;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import com.proofly.backend.config.IngestionProperties;
import com.proofly.backend.dto.uploads.TransactionReviewEdit;
import com.proofly.backend.dto.uploads.UploadReviewRequest;
import com.proofly.backend.dto.uploads.UploadReviewResultDTO;
import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.FileKind;
import com.proofly.backend.enums.SourcePlatform;
import com.proofly.backend.enums.TransactionCategory;
import com.proofly.backend.enums.UploadStatus;
import com.proofly.backend.exceptions.BadRequestException;
import com.proofly.backend.exceptions.BusinessException;
import com.proofly.backend.exceptions.ConflictException;
import com.proofly.backend.repositories.FileUploadRepository;
import com.proofly.backend.repositories.FinancialTransactionRepository;
import com.proofly.backend.services.util.HashUtil;

@SuppressWarnings("null")
class FileUploadServiceTest {

    private final FileUploadRepository uploadRepository = Mockito.mock(FileUploadRepository.class);
    private final FinancialTransactionRepository transactionRepository = Mockito.mock(FinancialTransactionRepository.class);

    private final FileUploadService service = new FileUploadService(
            uploadRepository,
            transactionRepository,
            IngestionProperties.defaults()
    );

    @Test
    void createUpload_reusesExistingUpload_forSameContent() {
        UUID userId = UUID.randomUUID();
        byte[] bytes = "same-content".getBytes(StandardCharsets.UTF_8);
        FileUpload existing = upload(userId, UploadStatus.AWAITING_REVIEW);

        when(uploadRepository.findTopByUserIdAndFileSha256OrderByCreatedAtDesc(userId, HashUtil.sha256Hex(bytes)))
                .thenReturn(Optional.of(existing));

        FileUpload result = service.createUpload(userId, "a.csv", "text/csv", bytes, FileKind.EWALLET_STATEMENT,
                SourcePlatform.GCASH, null, null);

        assertThat(result).isSameAs(existing);
        verify(uploadRepository, never()).save(Mockito.<FileUpload>any());
    }

    @Test
    void createUpload_createsNewUpload_whenMostRecentFailed() {
        UUID userId = UUID.randomUUID();
        byte[] bytes = "same-content".getBytes(StandardCharsets.UTF_8);

        when(uploadRepository.findTopByUserIdAndFileSha256OrderByCreatedAtDesc(userId, HashUtil.sha256Hex(bytes)))
                .thenReturn(Optional.of(upload(userId, UploadStatus.FAILED)));
        when(uploadRepository.save(Mockito.<FileUpload>any())).thenAnswer(inv -> inv.getArgument(0));

        FileUpload result = service.createUpload(userId, " a.csv ", "text/csv", bytes, null, null,
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        ArgumentCaptor<FileUpload> captor = ArgumentCaptor.forClass(FileUpload.class);
        verify(uploadRepository).save(captor.capture());
        FileUpload saved = captor.getValue();
        assertThat(result).isSameAs(saved);
        assertThat(saved.getStatus()).isEqualTo(UploadStatus.UPLOADED);
        assertThat(saved.getOriginalFilename()).isEqualTo("a.csv");
        assertThat(saved.getFileKind()).isEqualTo(FileKind.OTHER);
        assertThat(saved.getSource()).isEqualTo(SourcePlatform.OTHER);
        assertThat(saved.getFileSize()).isEqualTo(bytes.length);
        assertThat(saved.getFileSha256()).hasSize(64);
    }

    @Test
    void createUpload_rejectsEmptyFileAndInvertedRange() {
        UUID userId = UUID.randomUUID();

        assertThatThrownBy(() -> service.createUpload(userId, "a.csv", null, new byte[0], null, null, null, null))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> service.createUpload(userId, "a.csv", null, new byte[] {1}, null, null,
                LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Date range");
    }

    @Test
    void deleteUpload_refusesWhileProcessing() {
        UUID userId = UUID.randomUUID();
        FileUpload processing = upload(userId, UploadStatus.PROCESSING);
        when(uploadRepository.findByIdAndUserId(processing.getId(), userId)).thenReturn(Optional.of(processing));

        assertThatThrownBy(() -> service.deleteUpload(userId, processing.getId()))
                .isInstanceOf(ConflictException.class);
        verify(transactionRepository, never()).deleteByUploadIdAndUserId(processing.getId(), userId);
    }

    @Test
    void deleteUpload_removesTransactionsThenUpload() {
        UUID userId = UUID.randomUUID();
        FileUpload done = upload(userId, UploadStatus.PROCESSED);
        when(uploadRepository.findByIdAndUserId(done.getId(), userId)).thenReturn(Optional.of(done));
        when(transactionRepository.deleteByUploadIdAndUserId(done.getId(), userId)).thenReturn(3);

        assertThat(service.deleteUpload(userId, done.getId())).isEqualTo(3);
        verify(uploadRepository).deleteById(done.getId());
    }

    @Test
    void reviewUpload_appliesEditsAndRejections_thenMarksProcessed() {
        UUID userId = UUID.randomUUID();
        FileUpload upload = upload(userId, UploadStatus.AWAITING_REVIEW);
        UUID rejectedId = UUID.randomUUID();
        FinancialTransaction edited = FinancialTransaction.builder().id(UUID.randomUUID()).userId(userId).upload(upload).build();

        when(uploadRepository.findByIdAndUserId(upload.getId(), userId)).thenReturn(Optional.of(upload));
        when(transactionRepository.deleteByUploadIdAndUserIdAndIdIn(upload.getId(), userId, Set.of(rejectedId))).thenReturn(1);
        when(transactionRepository.findByIdAndUserId(edited.getId(), userId)).thenReturn(Optional.of(edited));
        when(uploadRepository.transitionStatus(Mockito.eq(upload.getId()), Mockito.eq(UploadStatus.AWAITING_REVIEW),
                Mockito.eq(UploadStatus.PROCESSED), Mockito.any())).thenReturn(1);
        when(transactionRepository.countByUploadId(upload.getId())).thenReturn(4L);

        UploadReviewResultDTO result = service.reviewUpload(userId, upload.getId(), new UploadReviewRequest(
                List.of(new TransactionReviewEdit(edited.getId(), null, "Fixed", null, TransactionCategory.RENT, null)),
                Set.of(rejectedId)));

        assertThat(result.rejected()).isEqualTo(1);
        assertThat(result.edited()).isEqualTo(1);
        assertThat(result.remaining()).isEqualTo(4L);
        assertThat(edited.getDescription()).isEqualTo("Fixed");
        assertThat(edited.getCategory()).isEqualTo(TransactionCategory.RENT);
        assertThat(edited.isManuallyVerified()).isTrue();
    }

    @Test
    void reviewUpload_rejectsUploadNotAwaitingReview() {
        UUID userId = UUID.randomUUID();
        FileUpload upload = upload(userId, UploadStatus.PROCESSING);
        when(uploadRepository.findByIdAndUserId(upload.getId(), userId)).thenReturn(Optional.of(upload));

        assertThatThrownBy(() -> service.reviewUpload(userId, upload.getId(), new UploadReviewRequest(null, null)))
                .isInstanceOf(BusinessException.class);
    }

    private static FileUpload upload(UUID userId, UploadStatus status) {
        FileUpload u = new FileUpload();
        u.setId(UUID.randomUUID());
        u.setUserId(userId);
        u.setStatus(status);
        u.setOriginalFilename("a.csv");
        return u;
    }
}
