package com.proofly.backend.services.reports;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.enums.ReportStatus;
import com.proofly.backend.repositories.IncomeReportRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes of an income report that must commit on their own: the first insert (so a unique
 * constraint violation can be retried with fresh identifiers) and the generation outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IncomeReportGate {

    static final int MAX_ERROR_LENGTH = 2000;

    private final IncomeReportRepository reportRepository;
    private final ReportIdentityService identityService;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IncomeReport insert(IncomeReport report) {
        return reportRepository.saveAndFlush(report);
    }

    /** {@code GENERATING -> COMPLETED} with the artifact and its hash. False if the report had moved on. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean complete(UUID reportId, byte[] artifact) {
        int updated = reportRepository.transitionStatus(reportId, ReportStatus.GENERATING, ReportStatus.COMPLETED,
                LocalDateTime.now());
        if (updated == 0) {
            log.warn("[IncomeReportGate] reportId={} was not GENERATING when completing", reportId);
            return false;
        }
        IncomeReport report = reportRepository.findById(reportId).orElseThrow();
        identityService.attachArtifact(report, artifact);
        report.setGeneratedAt(LocalDateTime.now());
        report.setErrorMessage(null);
        reportRepository.save(report);
        return true;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean fail(UUID reportId, String message) {
        int updated = reportRepository.transitionStatus(reportId, ReportStatus.GENERATING, ReportStatus.FAILED,
                LocalDateTime.now());
        if (updated == 0) {
            return false;
        }
        IncomeReport report = reportRepository.findById(reportId).orElseThrow();
        report.setErrorMessage(trimError(message));
        reportRepository.save(report);
        return true;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean expire(UUID reportId) {
        return reportRepository.transitionStatus(reportId, ReportStatus.COMPLETED, ReportStatus.EXPIRED,
                LocalDateTime.now()) == 1;
    }

    static String trimError(String message) {
        if (message == null) return null;
        String m = message.trim();
        if (m.length() <= MAX_ERROR_LENGTH) return m;
        return m.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
