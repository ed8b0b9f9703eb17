package com.proofly.backend.services.jobs;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.entities.CategorizationJob;
import com.proofly.backend.enums.JobStatus;
import com.proofly.backend.repositories.CategorizationJobRepository;
import com.proofly.backend.services.ai.AiCompletion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Job status transitions, each a compare-and-swap committed in its own transaction. A job is
 * started once and finished once; later attempts see 0 updated rows and back off.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategorizationJobGate {

    static final int MAX_ERROR_LENGTH = 2000;

    private final CategorizationJobRepository jobRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<CategorizationJob> start(UUID jobId) {
        int updated = jobRepository.startIfStatus(jobId, JobStatus.PENDING, JobStatus.PROCESSING, LocalDateTime.now());
        if (updated == 0) {
            return Optional.empty();
        }
        return jobRepository.findById(jobId);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean complete(UUID jobId, Map<String, Object> output, AiCompletion completion, BigDecimal costUsd,
                            double elapsedSeconds) {
        int updated = jobRepository.finishIfStatus(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, LocalDateTime.now());
        if (updated == 0) {
            log.warn("[CategorizationJobGate] jobId={} was not PROCESSING when completing", jobId);
            return false;
        }
        CategorizationJob job = jobRepository.findById(jobId).orElseThrow();
        job.setOutputData(output);
        job.setProcessingTimeSeconds(elapsedSeconds);
        if (completion != null) {
            job.setTokensUsed((int) Math.min(Integer.MAX_VALUE, completion.totalTokens()));
            job.setModelUsed(completion.model());
            job.setCostUsd(costUsd);
        }
        jobRepository.save(job);
        return true;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean fail(UUID jobId, String message, Double elapsedSeconds) {
        int updated = jobRepository.finishIfStatus(jobId, JobStatus.PROCESSING, JobStatus.FAILED, LocalDateTime.now());
        if (updated == 0) {
            return false;
        }
        CategorizationJob job = jobRepository.findById(jobId).orElseThrow();
        job.setErrorMessage(trimError(message));
        if (elapsedSeconds != null) {
            job.setProcessingTimeSeconds(elapsedSeconds);
        }
        jobRepository.save(job);
        return true;
    }

    /** Only a job that has not started can be cancelled. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean cancel(UUID jobId) {
        return jobRepository.finishIfStatus(jobId, JobStatus.PENDING, JobStatus.CANCELLED, LocalDateTime.now()) == 1;
    }

    static String trimError(String message) {
        if (message == null) return null;
        String m = message.trim();
        if (m.length() <= MAX_ERROR_LENGTH) return m;
        return m.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
