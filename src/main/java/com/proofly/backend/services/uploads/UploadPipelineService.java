package com.proofly.backend.services.uploads;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.proofly.backend.config.IngestionProperties;
import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.enums.UploadStatus;
import com.proofly.backend.exceptions.UnsupportedFormatException;
import com.proofly.backend.repositories.FileUploadRepository;
import com.proofly.backend.services.ingestion.DocumentExtractionService;
import com.proofly.backend.services.ingestion.DocumentParsingException;
import com.proofly.backend.services.ingestion.ExtractionResult;
import com.proofly.backend.services.normalization.FieldNormalizer;
import com.proofly.backend.services.normalization.NormalizedTransaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one upload through extraction, normalization and materialization.
 * Only the caller that moves the upload out of {@code UPLOADED} does any work; every other
 * call returns without side effects. Errors end the upload in {@code FAILED} and are not rethrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadPipelineService {

    static final String INTERNAL_FAILURE_MESSAGE = "Processing failed due to an internal error. Please try uploading the file again.";
    static final String STALE_MESSAGE = "Processing did not finish in time. Please try uploading the file again.";

    private final UploadStatusGate statusGate;
    private final DocumentExtractionService extractionService;
    private final FieldNormalizer normalizer;
    private final TransactionMaterializer materializer;
    private final FileUploadRepository uploadRepository;
    private final IngestionProperties properties;

    @Async("documentProcessingExecutor")
    public void startProcessing(UUID uploadId) {
        if (uploadId == null) return;
        process(uploadId);
    }

    public UploadProcessingResult process(UUID uploadId) {
        Optional<UploadWork> claimed = statusGate.claim(uploadId);
        if (claimed.isEmpty()) {
            UploadStatus current = uploadRepository.findById(uploadId).map(u -> u.getStatus()).orElse(null);
            log.info("[UploadPipeline] uploadId={} not claimable (status={}); skipping", uploadId, current);
            return UploadProcessingResult.skipped(uploadId, current);
        }

        UploadWork work = claimed.get();
        long start = System.currentTimeMillis();
        try {
            ExtractionResult extraction = extractionService.extract(work.filename(), work.content(), work.source());

            List<NormalizedTransaction> normalized = new ArrayList<>();
            int skipped = 0;
            int softFailures = 0;
            for (Map<String, String> row : extraction.rows()) {
                Optional<NormalizedTransaction> tx = normalizer.normalize(row);
                if (tx.isEmpty()) {
                    skipped++;
                    continue;
                }
                if (tx.get().hasWarnings()) softFailures++;
                normalized.add(tx.get());
            }

            int created = materializer.materialize(work, normalized, extraction.synthetic());

            boolean finished = statusGate.markAwaitingReview(uploadId, extraction.format().name(),
                    extraction.rows().size(), skipped, softFailures, created, extraction.synthetic());
            if (!finished) {
                int discarded = statusGate.discardIfFailed(uploadId);
                log.warn("[UploadPipeline] uploadId={} was failed while processing; discarded={}", uploadId, discarded);
                return UploadProcessingResult.failed(uploadId, STALE_MESSAGE);
            }

            log.info("[UploadPipeline] uploadId={} format={} rowsRead={} skipped={} softFailures={} created={} synthetic={} elapsedMs={}",
                    uploadId, extraction.format(), extraction.rows().size(), skipped, softFailures, created,
                    extraction.synthetic(), System.currentTimeMillis() - start);

            return new UploadProcessingResult(uploadId, UploadStatus.AWAITING_REVIEW, true,
                    extraction.rows().size(), skipped, softFailures, created, extraction.synthetic(), null);
        } catch (UnsupportedFormatException | DocumentParsingException e) {
            log.warn("[UploadPipeline] uploadId={} parse failure: {}", uploadId, e.getMessage());
            statusGate.markFailed(uploadId, e.getMessage());
            return UploadProcessingResult.failed(uploadId, e.getMessage());
        } catch (Exception e) {
            log.error("[UploadPipeline] uploadId={} failed", uploadId, e);
            statusGate.markFailed(uploadId, INTERNAL_FAILURE_MESSAGE);
            return UploadProcessingResult.failed(uploadId, INTERNAL_FAILURE_MESSAGE);
        }
    }

    /** Fails uploads left in {@code PROCESSING} past the configured timeout. Returns how many were failed. */
    public int failStaleUploads() {
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.processingTimeout());
        int failed = 0;
        for (FileUpload upload : uploadRepository.findByStatusAndProcessingStartedAtBefore(UploadStatus.PROCESSING, cutoff)) {
            if (statusGate.markFailed(upload.getId(), STALE_MESSAGE)) {
                failed++;
                log.warn("[UploadPipeline] failed stale uploadId={} processingStartedAt={}",
                        upload.getId(), upload.getProcessingStartedAt());
            }
        }
        return failed;
    }
}
