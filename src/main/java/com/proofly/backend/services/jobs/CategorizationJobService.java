package com.proofly.backend.services.jobs;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.config.AiUsageProperties;
import com.proofly.backend.config.CategorizationProperties;
import com.proofly.backend.dto.jobs.CategorizationJobRequest;
import com.proofly.backend.entities.CategorizationJob;
import com.proofly.backend.entities.FinancialTransaction;
import com.proofly.backend.enums.JobStatus;
import com.proofly.backend.enums.JobType;
import com.proofly.backend.exceptions.AiServiceException;
import com.proofly.backend.exceptions.BadRequestException;
import com.proofly.backend.exceptions.BusinessException;
import com.proofly.backend.exceptions.ResourceNotFoundException;
import com.proofly.backend.repositories.CategorizationJobRepository;
import com.proofly.backend.repositories.FileUploadRepository;
import com.proofly.backend.repositories.FinancialTransactionRepository;
import com.proofly.backend.services.ai.AiCompletion;
import com.proofly.backend.services.anomalies.TransactionAnomalyService;
import com.proofly.backend.services.categorization.CategorizationOutcome;
import com.proofly.backend.services.categorization.CategorizationResultWriter;
import com.proofly.backend.services.categorization.FinancialSummaryService;
import com.proofly.backend.services.categorization.MergeStats;
import com.proofly.backend.services.categorization.SummaryOutcome;
import com.proofly.backend.services.categorization.TransactionCategorizationService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts categorization, summary and anomaly-scan jobs and runs them in the background.
 * A job moves {@code PENDING -> PROCESSING -> COMPLETED | FAILED}; errors end up on the job,
 * never on the caller's thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategorizationJobService {

    static final String INTERNAL_FAILURE_MESSAGE = "The job failed due to an internal error";
    static final String STUCK_MESSAGE = "The job did not finish within the allowed time";

    static final String KEY_TRANSACTION_IDS = "transaction_ids";
    static final String KEY_TRANSACTION_COUNT = "transaction_count";
    static final String KEY_UPLOAD_ID = "upload_id";
    static final String KEY_DATE_FROM = "date_from";
    static final String KEY_DATE_TO = "date_to";
    static final String KEY_SCAN_ALL = "scan_all";

    private final CategorizationJobRepository jobRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final FileUploadRepository uploadRepository;
    private final CategorizationJobGate jobGate;
    private final TransactionCategorizationService categorizationService;
    private final CategorizationResultWriter resultWriter;
    private final FinancialSummaryService summaryService;
    private final TransactionAnomalyService anomalyService;
    private final CategorizationProperties properties;
    private final AiUsageProperties usageProperties;

    @Transactional
    public CategorizationJob createCategorizationJob(UUID userId, CategorizationJobRequest request) {
        List<FinancialTransaction> selected;
        Map<String, Object> input = new LinkedHashMap<>();

        if (!request.transactionIds().isEmpty()) {
            if (request.transactionIds().size() > properties.maxBatchSize()) {
                throw new BadRequestException("At most " + properties.maxBatchSize() + " transactions per job");
            }
            selected = transactionRepository.findByUserIdAndIdIn(userId, request.transactionIds());
        } else if (request.uploadId() != null) {
            uploadRepository.findByIdAndUserId(request.uploadId(), userId)
                    .orElseThrow(() -> new ResourceNotFoundException("Upload not found"));
            selected = transactionRepository.findByUserIdAndUploadIdOrderByTransactionDateAsc(userId, request.uploadId());
            input.put(KEY_UPLOAD_ID, request.uploadId().toString());
        } else if (request.wantsUncategorized()) {
            selected = transactionRepository.findByUserIdAndAiCategorizedFalseOrderByTransactionDateDesc(userId)
                    .stream()
                    .filter(t -> !t.isManuallyVerified())
                    .toList();
        } else {
            throw new BadRequestException("Provide transactionIds, uploadId or uncategorizedOnly");
        }

        if (selected.isEmpty()) {
            throw new ResourceNotFoundException("No transactions found");
        }
        if (selected.size() > properties.maxBatchSize()) {
            log.info("[CategorizationJob] userId={} selection of {} trimmed to {}", userId, selected.size(),
                    properties.maxBatchSize());
            selected = selected.subList(0, properties.maxBatchSize());
        }

        input.put(KEY_TRANSACTION_COUNT, selected.size());
        input.put(KEY_TRANSACTION_IDS, selected.stream().map(t -> t.getId().toString()).toList());
        return saveJob(userId, JobType.CATEGORIZE_TRANSACTIONS, input);
    }

    @Transactional
    public CategorizationJob createSummaryJob(UUID userId, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new BadRequestException("dateTo must not be before dateFrom");
        }
        List<FinancialTransaction> inRange = transactionsInRange(userId, from, to);
        if (inRange.isEmpty()) {
            throw new ResourceNotFoundException("No transactions found for the specified date range");
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put(KEY_DATE_FROM, from.toString());
        input.put(KEY_DATE_TO, to.toString());
        input.put(KEY_TRANSACTION_COUNT, inRange.size());
        return saveJob(userId, JobType.GENERATE_SUMMARY, input);
    }

    @Transactional
    public CategorizationJob createAnomalyJob(UUID userId, List<UUID> transactionIds) {
        Map<String, Object> input = new LinkedHashMap<>();
        if (transactionIds == null || transactionIds.isEmpty()) {
            if (transactionRepository.findByUserIdOrderByTransactionDateDesc(userId).isEmpty()) {
                throw new ResourceNotFoundException("No transactions found");
            }
            input.put(KEY_SCAN_ALL, true);
        } else {
            List<FinancialTransaction> owned = transactionRepository.findByUserIdAndIdIn(userId, transactionIds);
            if (owned.isEmpty()) {
                throw new ResourceNotFoundException("No transactions found");
            }
            input.put(KEY_TRANSACTION_IDS, owned.stream().map(t -> t.getId().toString()).toList());
            input.put(KEY_TRANSACTION_COUNT, owned.size());
        }
        return saveJob(userId, JobType.DETECT_ANOMALIES, input);
    }

    private CategorizationJob saveJob(UUID userId, JobType type, Map<String, Object> input) {
        CategorizationJob job = new CategorizationJob();
        job.setUserId(userId);
        job.setJobType(type);
        job.setStatus(JobStatus.PENDING);
        job.setInputData(input);
        CategorizationJob saved = jobRepository.save(job);
        log.info("[CategorizationJob] created jobId={} type={} userId={}", saved.getId(), type, userId);
        return saved;
    }

    @Async("categorizationExecutor")
    public void startJob(UUID jobId) {
        if (jobId == null) return;
        runJob(jobId);
    }

    /**
     * Runs a pending job to a terminal state. A job that is no longer pending (already running,
     * finished or cancelled) is left alone.
     */
    public void runJob(UUID jobId) {
        CategorizationJob job = jobGate.start(jobId).orElse(null);
        if (job == null) {
            log.info("[CategorizationJob] jobId={} not pending, skipping", jobId);
            return;
        }

        long start = System.currentTimeMillis();
        try {
            JobResult result = switch (job.getJobType()) {
                case CATEGORIZE_TRANSACTIONS -> runCategorization(job);
                case GENERATE_SUMMARY -> runSummary(job);
                case DETECT_ANOMALIES -> runAnomalyScan(job);
            };
            double elapsed = elapsedSeconds(start);
            jobGate.complete(jobId, result.output(), result.completion(), costOf(result.completion()), elapsed);
            log.info("[CategorizationJob] completed jobId={} type={} elapsedSeconds={}", jobId, job.getJobType(), elapsed);
        } catch (AiServiceException e) {
            log.error("[CategorizationJob] AI service failure jobId={}", jobId, e);
            jobGate.fail(jobId, e.getMessage(), elapsedSeconds(start));
        } catch (Exception e) {
            log.error("[CategorizationJob] failed jobId={}", jobId, e);
            jobGate.fail(jobId, INTERNAL_FAILURE_MESSAGE, elapsedSeconds(start));
        }
    }

    private JobResult runCategorization(CategorizationJob job) {
        List<UUID> ids = idsOf(job.getInputData());
        List<FinancialTransaction> batch = inSubmittedOrder(
                transactionRepository.findByUserIdAndIdIn(job.getUserId(), ids), ids);

        CategorizationOutcome outcome = categorizationService.categorize(batch);
        List<UUID> submitted = batch.stream().map(FinancialTransaction::getId).toList();
        MergeStats stats = resultWriter.apply(job.getUserId(), submitted, outcome.results());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("categorized_count", stats.updated());
        output.put("total_count", batch.size());
        output.put("merge", stats.toMap());
        if (!batch.isEmpty() && outcome.results().isEmpty()) {
            output.put("warning", "The AI response could not be parsed; no transactions were updated");
        }
        return new JobResult(output, outcome.completion());
    }

    private JobResult runSummary(CategorizationJob job) {
        LocalDate from = LocalDate.parse(String.valueOf(job.getInputData().get(KEY_DATE_FROM)));
        LocalDate to = LocalDate.parse(String.valueOf(job.getInputData().get(KEY_DATE_TO)));
        List<FinancialTransaction> inRange = transactionsInRange(job.getUserId(), from, to);

        SummaryOutcome outcome = summaryService.summarize(inRange, from, to);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("summary", outcome.summary());
        output.put("statistics", outcome.statistics());
        return new JobResult(output, outcome.completion());
    }

    private JobResult runAnomalyScan(CategorizationJob job) {
        List<UUID> ids = Boolean.TRUE.equals(job.getInputData().get(KEY_SCAN_ALL)) ? List.of() : idsOf(job.getInputData());
        return new JobResult(anomalyService.scan(job.getUserId(), ids), null);
    }

    @Transactional(readOnly = true)
    public CategorizationJob getForUser(UUID userId, UUID jobId) {
        return jobRepository.findByIdAndUserId(jobId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found"));
    }

    @Transactional(readOnly = true)
    public Page<CategorizationJob> listForUser(UUID userId, JobStatus status, JobType type, Pageable pageable) {
        if (status != null && type != null) {
            return jobRepository.findByUserIdAndStatusAndJobTypeOrderByCreatedAtDesc(userId, status, type, pageable);
        }
        if (status != null) {
            return jobRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status, pageable);
        }
        if (type != null) {
            return jobRepository.findByUserIdAndJobTypeOrderByCreatedAtDesc(userId, type, pageable);
        }
        return jobRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
    }

    /** Cancels a job that has not started. Anything already running is out of reach. */
    public CategorizationJob cancel(UUID userId, UUID jobId) {
        CategorizationJob job = getForUser(userId, jobId);
        if (job.getStatus() == JobStatus.CANCELLED) {
            return job;
        }
        if (!jobGate.cancel(jobId)) {
            throw new BusinessException("Only pending jobs can be cancelled");
        }
        log.info("[CategorizationJob] cancelled jobId={} userId={}", jobId, userId);
        return getForUser(userId, jobId);
    }

    /** Fails {@code PROCESSING} jobs older than the configured timeout. Returns how many were failed. */
    public int failStuckJobs() {
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.jobTimeout());
        int failed = 0;
        for (CategorizationJob job : jobRepository.findByStatusAndStartedAtBefore(JobStatus.PROCESSING, cutoff)) {
            if (jobGate.fail(job.getId(), STUCK_MESSAGE, null)) {
                failed++;
                log.warn("[CategorizationJob] failed stuck jobId={} startedAt={}", job.getId(), job.getStartedAt());
            }
        }
        return failed;
    }

    BigDecimal costOf(AiCompletion completion) {
        if (completion == null) return null;
        return usageProperties.inputCostPerToken().multiply(BigDecimal.valueOf(completion.inputTokens()))
                .add(usageProperties.outputCostPerToken().multiply(BigDecimal.valueOf(completion.outputTokens())))
                .setScale(6, RoundingMode.HALF_UP);
    }

    private List<FinancialTransaction> transactionsInRange(UUID userId, LocalDate from, LocalDate to) {
        return transactionRepository.findByUserIdAndTransactionDateBetweenOrderByTransactionDateAsc(
                userId, from.atStartOfDay(), to.atTime(LocalTime.MAX));
    }

    private static List<UUID> idsOf(Map<String, Object> input) {
        Object raw = input == null ? null : input.get(KEY_TRANSACTION_IDS);
        List<UUID> ids = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object o : list) {
                if (o != null) ids.add(UUID.fromString(o.toString()));
            }
        }
        return ids;
    }

    private static List<FinancialTransaction> inSubmittedOrder(List<FinancialTransaction> loaded, List<UUID> ids) {
        Map<UUID, Integer> position = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            position.put(ids.get(i), i);
        }
        List<FinancialTransaction> ordered = new ArrayList<>(loaded);
        ordered.sort(Comparator.comparing(t -> position.getOrDefault(t.getId(), Integer.MAX_VALUE)));
        return ordered;
    }

    private static double elapsedSeconds(long startMillis) {
        return (System.currentTimeMillis() - startMillis) / 1000.0;
    }

    record JobResult(Map<String, Object> output, AiCompletion completion) {}
}
