package com.proofly.backend.services.reports;

import java.util.UUID;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.enums.ReportStatus;
import com.proofly.backend.repositories.IncomeReportRepository;
import com.proofly.backend.services.reports.artifacts.ReportArtifactGenerator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders the report document in the background and records the outcome on the report.
 * Failures end in {@code FAILED} with a readable message; nothing propagates to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportGenerationService {

    static final String GENERATION_FAILED_MESSAGE = "The report document could not be generated. Please try again later.";

    private final IncomeReportRepository reportRepository;
    private final ReportArtifactGenerator artifactGenerator;
    private final IncomeReportGate reportGate;

    @Async("reportGenerationExecutor")
    public void startGeneration(UUID reportId) {
        if (reportId == null) return;
        generate(reportId);
    }

    public boolean generate(UUID reportId) {
        IncomeReport report = reportRepository.findById(reportId).orElse(null);
        if (report == null) {
            log.warn("[ReportGeneration] report not found: {}", reportId);
            return false;
        }
        if (report.getStatus() != ReportStatus.GENERATING) {
            log.info("[ReportGeneration] reportId={} status={} nothing to do", reportId, report.getStatus());
            return false;
        }

        try {
            long start = System.currentTimeMillis();
            byte[] artifact = artifactGenerator.render(report);
            boolean done = reportGate.complete(reportId, artifact);
            log.info("[ReportGeneration] reportId={} completed={} bytes={} elapsedMs={}",
                    reportId, done, artifact.length, System.currentTimeMillis() - start);
            return done;
        } catch (Exception e) {
            log.error("[ReportGeneration] failed reportId={}", reportId, e);
            reportGate.fail(reportId, GENERATION_FAILED_MESSAGE);
            return false;
        }
    }
}
