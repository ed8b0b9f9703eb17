package com.proofly.backend.scheduler;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.proofly.backend.services.jobs.CategorizationJobService;
import com.proofly.backend.services.reports.IncomeReportService;
import com.proofly.backend.services.uploads.UploadPipelineService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Background sweeps for work that would otherwise stay in a non-terminal state forever.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final CategorizationJobService jobService;
    private final IncomeReportService reportService;
    private final UploadPipelineService uploadPipeline;

    /**
     * Fails categorization jobs stuck in PROCESSING past the configured timeout.
     */
    @Scheduled(cron = "${proofly.categorization.sweep-cron:0 */5 * * * *}")
    public void failStuckJobs() {
        try {
            int failed = jobService.failStuckJobs();
            if (failed > 0) {
                log.warn("[Maintenance] stuck categorization jobs failed count={}", failed);
            }
        } catch (Exception e) {
            log.error("[Maintenance] stuck job sweep failed", e);
        }
    }

    /**
     * Fails uploads whose processing never finished, for example after a restart mid-run.
     */
    @Scheduled(cron = "${proofly.ingestion.stale-sweep-cron:0 */5 * * * *}")
    public void failStaleUploads() {
        try {
            int failed = uploadPipeline.failStaleUploads();
            if (failed > 0) {
                log.warn("[Maintenance] stale uploads failed count={}", failed);
            }
        } catch (Exception e) {
            log.error("[Maintenance] stale upload sweep failed", e);
        }
    }

    /**
     * Moves completed reports past their expiry date to EXPIRED.
     */
    @Scheduled(cron = "${proofly.reports.expiry-cron:0 0 * * * *}")
    public void expireReports() {
        try {
            reportService.expireOverdue();
        } catch (Exception e) {
            log.error("[Maintenance] report expiry sweep failed", e);
        }
    }
}
