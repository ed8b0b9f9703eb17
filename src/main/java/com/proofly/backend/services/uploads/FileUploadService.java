package com.proofly.backend.services.uploads;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.config.IngestionProperties;
import com.proofly.backend.dto.uploads.TransactionReviewEdit;
import com.proofly.backend.dto.uploads.UploadReviewRequest;
import com.proofly.backend.dto.uploads.UploadReviewResultDTO;
import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.FileKind;
import com.proofly.backend.enums.SourcePlatform;
import com.proofly.backend.enums.UploadStatus;
import com.proofly.backend.exceptions.BadRequestException;
import com.proofly.backend.exceptions.BusinessException;
import com.proofly.backend.exceptions.ConflictException;
import com.proofly.backend.exceptions.ResourceNotFoundException;
import com.proofly.backend.repositories.FileUploadRepository;
import com.proofly.backend.repositories.FinancialTransactionRepository;
import com.proofly.backend.services.util.HashUtil;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class FileUploadService {

    private final FileUploadRepository uploadRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final IngestionProperties properties;

    /**
     * Stores a new upload in {@code UPLOADED}. Re-sending the same bytes returns the user's most
     * recent upload of that content unless it failed.
     */
    @Transactional
    public FileUpload createUpload(UUID userId,
                                   String filename,
                                   String contentType,
                                   byte[] content,
                                   FileKind fileKind,
                                   SourcePlatform source,
                                   LocalDate dateRangeStart,
                                   LocalDate dateRangeEnd) {
        if (content == null || content.length == 0) {
            throw new BadRequestException("File is empty");
        }
        if (content.length > properties.maxUploadBytes()) {
            throw new BadRequestException("File exceeds the maximum size of " + properties.maxUploadBytes() + " bytes");
        }
        if (filename == null || filename.isBlank()) {
            throw new BadRequestException("Filename is required");
        }
        if (dateRangeStart != null && dateRangeEnd != null && dateRangeEnd.isBefore(dateRangeStart)) {
            throw new BadRequestException("Date range end must not be before its start");
        }

        String sha256 = HashUtil.sha256Hex(content);
        Optional<FileUpload> existing = uploadRepository.findTopByUserIdAndFileSha256OrderByCreatedAtDesc(userId, sha256);
        if (existing.isPresent() && existing.get().getStatus() != UploadStatus.FAILED) {
            log.info("[FileUpload] reusing uploadId={} for identical content userId={}", existing.get().getId(), userId);
            return existing.get();
        }

        FileUpload upload = new FileUpload();
        upload.setUserId(userId);
        upload.setOriginalFilename(filename.trim());
        upload.setContentType(contentType);
        upload.setFileSize(content.length);
        upload.setFileKind(fileKind != null ? fileKind : FileKind.OTHER);
        upload.setSource(source != null ? source : SourcePlatform.OTHER);
        upload.setStatus(UploadStatus.UPLOADED);
        upload.setFileSha256(sha256);
        upload.setFileBytes(content);
        upload.setDateRangeStart(dateRangeStart);
        upload.setDateRangeEnd(dateRangeEnd);
        FileUpload saved = uploadRepository.save(upload);
        log.info("[FileUpload] created uploadId={} userId={} file={} size={}", saved.getId(), userId, filename, content.length);
        return saved;
    }

    @Transactional(readOnly = true)
    public FileUpload getForUser(UUID userId, UUID uploadId) {
        return uploadRepository.findByIdAndUserId(uploadId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Upload not found"));
    }

    @Transactional(readOnly = true)
    public Page<FileUpload> listForUser(UUID userId, UploadStatus status, Pageable pageable) {
        if (status != null) {
            return uploadRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status, pageable);
        }
        return uploadRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
    }

    /** Deletes the upload and its transactions. Returns the number of transactions removed. */
    @Transactional
    public int deleteUpload(UUID userId, UUID uploadId) {
        FileUpload upload = getForUser(userId, uploadId);
        if (upload.getStatus() == UploadStatus.PROCESSING) {
            throw new ConflictException("Upload is being processed; try again once it finishes");
        }
        int removed = transactionRepository.deleteByUploadIdAndUserId(uploadId, userId);
        uploadRepository.deleteById(upload.getId());
        log.info("[FileUpload] deleted uploadId={} transactionsRemoved={}", uploadId, removed);
        return removed;
    }

    /**
     * Applies a reviewer's decisions: drops rejected rows, applies edits (marking them verified)
     * and moves the upload from {@code AWAITING_REVIEW} to {@code PROCESSED}.
     */
    @Transactional
    public UploadReviewResultDTO reviewUpload(UUID userId, UUID uploadId, UploadReviewRequest request) {
        FileUpload upload = getForUser(userId, uploadId);
        if (upload.getStatus() != UploadStatus.AWAITING_REVIEW) {
            throw new BusinessException("Upload is not awaiting review (status " + upload.getStatus() + ")");
        }

        int rejected = 0;
        if (!request.rejectedIds().isEmpty()) {
            rejected = transactionRepository.deleteByUploadIdAndUserIdAndIdIn(uploadId, userId, request.rejectedIds());
        }

        int edited = 0;
        for (TransactionReviewEdit edit : request.edits()) {
            if (request.rejectedIds().contains(edit.id())) continue;
            FinancialTransaction tx = transactionRepository.findByIdAndUserId(edit.id(), userId)
                    .filter(t -> t.getUpload() != null && Objects.equals(t.getUpload().getId(), uploadId))
                    .orElseThrow(() -> new ResourceNotFoundException("Transaction " + edit.id() + " not found in this upload"));
            if (edit.amount() != null) tx.setAmount(edit.amount().abs());
            if (edit.description() != null) tx.setDescription(edit.description());
            if (edit.transactionType() != null) tx.setTransactionType(edit.transactionType());
            if (edit.category() != null) tx.setCategory(edit.category());
            if (edit.counterparty() != null) tx.setCounterparty(edit.counterparty());
            tx.setManuallyVerified(true);
            transactionRepository.save(tx);
            edited++;
        }

        int moved = uploadRepository.transitionStatus(uploadId, UploadStatus.AWAITING_REVIEW, UploadStatus.PROCESSED,
                LocalDateTime.now());
        if (moved == 0) {
            throw new ConflictException("Upload was reviewed concurrently");
        }

        long remaining = transactionRepository.countByUploadId(uploadId);
        log.info("[FileUpload] reviewed uploadId={} rejected={} edited={} remaining={}", uploadId, rejected, edited, remaining);
        return new UploadReviewResultDTO(uploadId, UploadStatus.PROCESSED.name(), rejected, edited, remaining);
    }
}
