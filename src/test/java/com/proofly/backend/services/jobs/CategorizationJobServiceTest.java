package com.proofly.backend.services.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

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
import com.proofly.backend.services.categorization.TransactionCategorizationService;

@SuppressWarnings({"null", "unchecked"})
class CategorizationJobServiceTest {

    private final CategorizationJobRepository jobRepository = Mockito.mock(CategorizationJobRepository.class);
    private final FinancialTransactionRepository transactionRepository = Mockito.mock(FinancialTransactionRepository.class);
    private final FileUploadRepository uploadRepository = Mockito.mock(FileUploadRepository.class);
    private final CategorizationJobGate jobGate = Mockito.mock(CategorizationJobGate.class);
    private final TransactionCategorizationService categorizationService = Mockito.mock(TransactionCategorizationService.class);
    private final CategorizationResultWriter resultWriter = Mockito.mock(CategorizationResultWriter.class);
    private final FinancialSummaryService summaryService = Mockito.mock(FinancialSummaryService.class);
    private final TransactionAnomalyService anomalyService = Mockito.mock(TransactionAnomalyService.class);

    private final CategorizationJobService service = new CategorizationJobService(
            jobRepository,
            transactionRepository,
            uploadRepository,
            jobGate,
            categorizationService,
            resultWriter,
            summaryService,
            anomalyService,
            new CategorizationProperties(null, false, 2, null, null),
            AiUsageProperties.defaults()
    );

    private final UUID userId = UUID.randomUUID();

    @Test
    void createCategorizationJob_storesSelectedIds_asPendingJob() {
        FinancialTransaction a = tx();
        FinancialTransaction b = tx();
        List<UUID> ids = List.of(a.getId(), b.getId());
        when(transactionRepository.findByUserIdAndIdIn(userId, ids)).thenReturn(List.of(a, b));
        when(jobRepository.save(any(CategorizationJob.class))).thenAnswer(inv -> inv.getArgument(0));

        CategorizationJob job = service.createCategorizationJob(userId, new CategorizationJobRequest(ids, null, null));

        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getJobType()).isEqualTo(JobType.CATEGORIZE_TRANSACTIONS);
        assertThat(job.getInputData())
                .containsEntry(CategorizationJobService.KEY_TRANSACTION_COUNT, 2)
                .containsEntry(CategorizationJobService.KEY_TRANSACTION_IDS, List.of(a.getId().toString(), b.getId().toString()));
    }

    @Test
    void createCategorizationJob_rejectsTooManyExplicitIds() {
        List<UUID> ids = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

        assertThatThrownBy(() -> service.createCategorizationJob(userId, new CategorizationJobRequest(ids, null, null)))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void createCategorizationJob_requiresSomeSelector() {
        assertThatThrownBy(() -> service.createCategorizationJob(userId, new CategorizationJobRequest(null, null, false)))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void createCategorizationJob_uploadOfAnotherUser_isNotFound() {
        UUID uploadId = UUID.randomUUID();
        when(uploadRepository.findByIdAndUserId(uploadId, userId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createCategorizationJob(userId, new CategorizationJobRequest(null, uploadId, null)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Upload not found");
    }

    @Test
    void createCategorizationJob_uncategorizedOnly_skipsVerified_andTrimsToBatchSize() {
        FinancialTransaction verified = tx();
        verified.setManuallyVerified(true);
        FinancialTransaction a = tx();
        FinancialTransaction b = tx();
        FinancialTransaction c = tx();
        when(transactionRepository.findByUserIdAndAiCategorizedFalseOrderByTransactionDateDesc(userId))
                .thenReturn(List.of(verified, a, b, c));
        when(jobRepository.save(any(CategorizationJob.class))).thenAnswer(inv -> inv.getArgument(0));

        CategorizationJob job = service.createCategorizationJob(userId, new CategorizationJobRequest(null, null, true));

        assertThat(job.getInputData())
                .containsEntry(CategorizationJobService.KEY_TRANSACTION_IDS, List.of(a.getId().toString(), b.getId().toString()));
    }

    @Test
    void createSummaryJob_withoutTransactions_isNotFound() {
        when(transactionRepository.findByUserIdAndTransactionDateBetweenOrderByTransactionDateAsc(eq(userId), any(), any()))
                .thenReturn(List.of());

        assertThatThrownBy(() -> service.createSummaryJob(userId, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.createSummaryJob(userId, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 31)))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void createAnomalyJob_withoutIds_scansEverything() {
        when(transactionRepository.findByUserIdOrderByTransactionDateDesc(userId)).thenReturn(List.of(tx()));
        when(jobRepository.save(any(CategorizationJob.class))).thenAnswer(inv -> inv.getArgument(0));

        CategorizationJob job = service.createAnomalyJob(userId, null);

        assertThat(job.getJobType()).isEqualTo(JobType.DETECT_ANOMALIES);
        assertThat(job.getInputData()).containsEntry(CategorizationJobService.KEY_SCAN_ALL, true);
    }

    @Test
    void runJob_categorization_completesWithMergeStatsAndCost() {
        FinancialTransaction a = tx();
        FinancialTransaction b = tx();
        CategorizationJob job = job(JobType.CATEGORIZE_TRANSACTIONS, List.of(a, b));
        AiCompletion completion = new AiCompletion("[]", 1000, 500, 1500, "gpt-4o-mini", 120);

        when(jobGate.start(job.getId())).thenReturn(Optional.of(job));
        // repository returns rows out of order; the batch must follow the submitted order
        when(transactionRepository.findByUserIdAndIdIn(eq(userId), any())).thenReturn(List.of(b, a));
        when(categorizationService.categorize(any())).thenReturn(new CategorizationOutcome(List.of(), completion));
        when(resultWriter.apply(eq(userId), any(), any())).thenReturn(new MergeStats(2, 0, 0, 0, 0));

        service.runJob(job.getId());

        ArgumentCaptor<List<FinancialTransaction>> batch = ArgumentCaptor.forClass(List.class);
        verify(categorizationService).categorize(batch.capture());
        assertThat(batch.getValue()).containsExactly(a, b);

        ArgumentCaptor<Map<String, Object>> output = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<BigDecimal> cost = ArgumentCaptor.forClass(BigDecimal.class);
        verify(jobGate).complete(eq(job.getId()), output.capture(), eq(completion), cost.capture(), anyDouble());
        assertThat(output.getValue())
                .containsEntry("categorized_count", 0)
                .containsEntry("total_count", 2)
                .containsKey("warning");
        assertThat(cost.getValue()).isEqualByComparingTo("0.000450");
    }

    @Test
    void runJob_aiFailure_failsJobWithServiceMessage() {
        CategorizationJob job = job(JobType.CATEGORIZE_TRANSACTIONS, List.of(tx()));
        when(jobGate.start(job.getId())).thenReturn(Optional.of(job));
        when(transactionRepository.findByUserIdAndIdIn(eq(userId), any())).thenReturn(List.of());
        when(categorizationService.categorize(any())).thenThrow(new AiServiceException("AI service timed out"));

        service.runJob(job.getId());

        verify(jobGate).fail(eq(job.getId()), eq("AI service timed out"), any());
        verify(jobGate, never()).complete(any(), any(), any(), any(), anyDouble());
    }

    @Test
    void runJob_unexpectedFailure_hidesInternalDetail() {
        CategorizationJob job = job(JobType.DETECT_ANOMALIES, List.of());
        job.getInputData().put(CategorizationJobService.KEY_SCAN_ALL, true);
        when(jobGate.start(job.getId())).thenReturn(Optional.of(job));
        when(anomalyService.scan(eq(userId), any())).thenThrow(new IllegalStateException("NPE somewhere"));

        service.runJob(job.getId());

        verify(jobGate).fail(eq(job.getId()), eq(CategorizationJobService.INTERNAL_FAILURE_MESSAGE), any());
    }

    @Test
    void runJob_notPending_isNoOp() {
        UUID jobId = UUID.randomUUID();
        when(jobGate.start(jobId)).thenReturn(Optional.empty());

        service.runJob(jobId);

        verify(categorizationService, never()).categorize(any());
        verify(jobGate, never()).fail(any(), any(), any());
    }

    @Test
    void cancel_runningJob_isRejected() {
        CategorizationJob job = job(JobType.GENERATE_SUMMARY, List.of());
        job.setStatus(JobStatus.PROCESSING);
        when(jobRepository.findByIdAndUserId(job.getId(), userId)).thenReturn(Optional.of(job));
        when(jobGate.cancel(job.getId())).thenReturn(false);

        assertThatThrownBy(() -> service.cancel(userId, job.getId()))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    void failStuckJobs_countsOnlyJobsActuallyFailed() {
        CategorizationJob stuck = job(JobType.CATEGORIZE_TRANSACTIONS, List.of());
        CategorizationJob raced = job(JobType.CATEGORIZE_TRANSACTIONS, List.of());
        when(jobRepository.findByStatusAndStartedAtBefore(eq(JobStatus.PROCESSING), any())).thenReturn(List.of(stuck, raced));
        when(jobGate.fail(stuck.getId(), CategorizationJobService.STUCK_MESSAGE, null)).thenReturn(true);
        when(jobGate.fail(raced.getId(), CategorizationJobService.STUCK_MESSAGE, null)).thenReturn(false);

        assertThat(service.failStuckJobs()).isEqualTo(1);
    }

    @Test
    void costOf_nullCompletion_isNull() {
        assertThat(service.costOf(null)).isNull();
    }

    private FinancialTransaction tx() {
        return FinancialTransaction.builder().id(UUID.randomUUID()).userId(userId).build();
    }

    private CategorizationJob job(JobType type, List<FinancialTransaction> txs) {
        CategorizationJob job = new CategorizationJob();
        job.setId(UUID.randomUUID());
        job.setUserId(userId);
        job.setJobType(type);
        job.setStatus(JobStatus.PROCESSING);
        Map<String, Object> input = new LinkedHashMap<>();
        List<String> ids = new ArrayList<>();
        txs.forEach(t -> ids.add(t.getId().toString()));
        input.put(CategorizationJobService.KEY_TRANSACTION_IDS, ids);
        job.setInputData(input);
        return job;
    }
}
