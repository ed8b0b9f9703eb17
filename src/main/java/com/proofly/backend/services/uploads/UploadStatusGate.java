package com.proofly.backend.services.uploads;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.enums.UploadStatus;
import com.proofly.backend.repositories.FileUploadRepository;
import com.proofly.backend.repositories.FinancialTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Status transitions of an upload, each a compare-and-swap on the status column in its own
 * transaction. Whoever wins {@code UPLOADED -> PROCESSING} is the only writer of that upload's
 * transactions. A failed upload keeps none of them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadStatusGate {

    static final int MAX_ERROR_LENGTH = 2000;

    private final FileUploadRepository uploadRepository;
    private final FinancialTransactionRepository transactionRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<UploadWork> claim(UUID uploadId) {
        int updated = uploadRepository.transitionStatus(uploadId, UploadStatus.UPLOADED, UploadStatus.PROCESSING,
                LocalDateTime.now());
        if (updated == 0) {
            return Optional.empty();
        }
        FileUpload upload = uploadRepository.findById(uploadId).orElse(null);
        if (upload == null) {
            return Optional.empty();
        }
        upload.setProcessingStartedAt(LocalDateTime.now());
        uploadRepository.save(upload);
        return Optional.of(new UploadWork(
                upload.getId(),
                upload.getUserId(),
                upload.getOriginalFilename(),
                upload.getFileBytes(),
                upload.getSource()
        ));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markAwaitingReview(UUID uploadId, String detectedFormat, int rowsRead, int rowsSkipped,
                                      int softFailures, int created, boolean synthetic) {
        int updated = uploadRepository.transitionStatus(uploadId, UploadStatus.PROCESSING,
                UploadStatus.AWAITING_REVIEW, LocalDateTime.now());
        if (updated == 0) {
            log.warn("[UploadStatusGate] uploadId={} was not PROCESSING when finishing", uploadId);
            return false;
        }
        FileUpload upload = uploadRepository.findById(uploadId).orElseThrow();
        upload.setDetectedFormat(detectedFormat);
        upload.setRowsRead(rowsRead);
        upload.setRowsSkipped(rowsSkipped);
        upload.setSoftFailures(softFailures);
        upload.setTransactionsCreated(created);
        upload.setSyntheticData(synthetic);
        upload.setErrorMessage(null);
        upload.setProcessedAt(LocalDateTime.now());
        uploadRepository.save(upload);
        return true;
    }

    /** {@code PROCESSING -> FAILED}, removing whatever the pipeline already materialized. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID uploadId, String message) {
        int updated = uploadRepository.transitionStatus(uploadId, UploadStatus.PROCESSING, UploadStatus.FAILED,
                LocalDateTime.now());
        if (updated == 0) {
            return false;
        }
        int removed = transactionRepository.deleteByUploadId(uploadId);
        if (removed > 0) {
            log.warn("[UploadStatusGate] uploadId={} failed; removed {} materialized transactions", uploadId, removed);
        }
        FileUpload upload = uploadRepository.findById(uploadId).orElseThrow();
        upload.setErrorMessage(trimError(message));
        upload.setTransactionsCreated(0);
        upload.setProcessedAt(LocalDateTime.now());
        uploadRepository.save(upload);
        return true;
    }

    /** Removes rows a late pipeline run wrote for an upload that was already failed. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int discardIfFailed(UUID uploadId) {
        UploadStatus status = uploadRepository.findById(uploadId).map(FileUpload::getStatus).orElse(null);
        if (status != UploadStatus.FAILED) {
            return 0;
        }
        return transactionRepository.deleteByUploadId(uploadId);
    }

    static String trimError(String message) {
        if (message == null) return null;
        String m = message.trim();
        if (m.length() <= MAX_ERROR_LENGTH) return m;
        return m.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
