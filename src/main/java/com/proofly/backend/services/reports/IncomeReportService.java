package com.proofly.backend.services.reports;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.config.ReportProperties;
import com.proofly.backend.dto.reports.CreateIncomeReportRequest;
import com.proofly.backend.dto.reports.PublicVerificationDTO;
import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.enums.ReportPurpose;
import com.proofly.backend.enums.ReportStatus;
import com.proofly.backend.enums.ReportType;
import com.proofly.backend.enums.SignatureStatus;
import com.proofly.backend.exceptions.BadRequestException;
import com.proofly.backend.exceptions.BusinessException;
import com.proofly.backend.exceptions.ReportExpiredException;
import com.proofly.backend.exceptions.ResourceNotFoundException;
import com.proofly.backend.repositories.IncomeReportRepository;
import com.proofly.backend.services.reports.artifacts.ReportArtifactGenerator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class IncomeReportService {

    public static final String NO_DATA_MESSAGE = "No transaction data available for the selected period";
    static final String REPORT_CURRENCY = "PHP";
    static final int HASH_PREFIX_LENGTH = 16;

    private final IncomeReportRepository reportRepository;
    private final ReportAggregationService aggregationService;
    private final ReportIdentityService identityService;
    private final IncomeReportGate reportGate;
    private final ReportGenerationService generationService;
    private final ReportArtifactGenerator artifactGenerator;
    private final ReportProperties properties;

    /**
     * Creates a report with its figures computed synchronously, then hands document generation
     * to the background. A range without transactions yields a {@code FAILED} report with
     * confidence 0 rather than an error.
     */
    public IncomeReport createReport(UUID userId, String ownerEmail, String ownerName, CreateIncomeReportRequest request) {
        if (request.dateTo().isBefore(request.dateFrom())) {
            throw new BadRequestException("dateTo must not be before dateFrom");
        }

        IncomeReport report = new IncomeReport();
        report.setUserId(userId);
        report.setOwnerEmail(ownerEmail);
        report.setOwnerName(ownerName);
        report.setTitle(request.title() != null && !request.title().isBlank()
                ? request.title().trim()
                : "Income Report " + request.dateFrom() + " to " + request.dateTo());
        report.setReportType(request.reportType() != null ? request.reportType() : ReportType.CUSTOM);
        report.setPurpose(request.purpose() != null ? request.purpose() : ReportPurpose.OTHER);
        report.setPurposeDescription(request.purposeDescription());
        report.setDateFrom(request.dateFrom());
        report.setDateTo(request.dateTo());

        ReportFigures figures = aggregationService.compute(userId, request.dateFrom(), request.dateTo());
        if (figures.isEmpty()) {
            applyFigures(report, ReportFigures.empty());
            report.setStatus(ReportStatus.FAILED);
            report.setErrorMessage(NO_DATA_MESSAGE);
        } else {
            applyFigures(report, figures);
            report.setSummary(ReportNarrativeBuilder.defaultSummary(figures, request.dateFrom(), request.dateTo(),
                    REPORT_CURRENCY));
            report.setInsights(new ArrayList<>(ReportNarrativeBuilder.insights(figures, request.dateFrom(), request.dateTo())));
            report.setStatus(ReportStatus.GENERATING);
        }

        IncomeReport saved = insertWithIdentity(report);
        log.info("[IncomeReport] created reportId={} userId={} status={} confidence={}",
                saved.getId(), userId, saved.getStatus(), saved.getConfidenceScore());

        if (saved.getStatus() == ReportStatus.GENERATING) {
            generationService.startGeneration(saved.getId());
        }
        return saved;
    }

    /** Inserts the report, re-issuing code and token when the unique constraints reject them. */
    IncomeReport insertWithIdentity(IncomeReport report) {
        DataIntegrityViolationException last = null;
        for (int attempt = 1; attempt <= properties.identityMaxAttempts(); attempt++) {
            identityService.issue(report);
            try {
                return reportGate.insert(report);
            } catch (DataIntegrityViolationException e) {
                last = e;
                log.warn("[IncomeReport] identity collision on insert attempt={}", attempt);
                report.setId(null);
            }
        }
        throw new IllegalStateException("Could not store report with a unique identity", last);
    }

    static void applyFigures(IncomeReport report, ReportFigures f) {
        report.setTotalIncome(f.totalIncome());
        report.setTotalExpenses(f.totalExpenses());
        report.setNetIncome(f.netIncome());
        report.setAverageMonthlyIncome(f.averageMonthlyIncome());
        report.setTransactionCount(f.transactionCount());
        report.setIncomeBreakdown(new LinkedHashMap<>(f.incomeBreakdown()));
        report.setExpenseBreakdown(new LinkedHashMap<>(f.expenseBreakdown()));
        report.setMonthlyTrends(new LinkedHashMap<>(f.monthlyTrends()));
        report.setDataSources(new ArrayList<>(f.dataSources()));
        report.setAnomalies(new ArrayList<>(f.anomalies()));
        report.setConfidenceScore(f.confidenceScore());
    }

    @Transactional(readOnly = true)
    public Page<IncomeReport> listForUser(UUID userId, Pageable pageable) {
        return reportRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
    }

    @Transactional(readOnly = true)
    public IncomeReport getForUser(UUID userId, UUID reportId) {
        return reportRepository.findByIdAndUserId(reportId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Report not found"));
    }

    @Transactional
    public void deleteReport(UUID userId, UUID reportId) {
        IncomeReport report = getForUser(userId, reportId);
        reportRepository.delete(report);
        log.info("[IncomeReport] deleted reportId={} userId={}", reportId, userId);
    }

    /** Owner download; allowed for completed and expired reports that have a document. */
    @Transactional
    public ReportDownload downloadForOwner(UUID userId, UUID reportId) {
        IncomeReport report = getForUser(userId, reportId);
        return download(report);
    }

    /** Third-party download with the access token. Expired reports are refused. */
    @Transactional
    public ReportDownload downloadByToken(String accessToken) {
        IncomeReport report = reportRepository.findByAccessToken(accessToken)
                .orElseThrow(() -> new ResourceNotFoundException("Report not found"));
        if (isExpired(report)) {
            throw new ReportExpiredException("Report has expired");
        }
        return download(report);
    }

    private ReportDownload download(IncomeReport report) {
        byte[] content = report.getArtifactBytes();
        if (report.getDocumentHash() == null || content == null) {
            throw new BusinessException("Report document is not available");
        }
        reportRepository.incrementDownloadCount(report.getId());
        String filename = "income_report_" + report.getDateFrom() + "_" + report.getDateTo() + "."
                + artifactGenerator.fileExtension();
        log.info("[IncomeReport] download reportId={}", report.getId());
        return new ReportDownload(filename, artifactGenerator.contentType(), content);
    }

    @Transactional(readOnly = true)
    public PublicVerificationDTO verifyPublic(String verificationCode) {
        String code = verificationCode == null ? "" : verificationCode.trim().toUpperCase(Locale.ROOT);
        IncomeReport report = reportRepository.findByVerificationCode(code)
                .orElseThrow(() -> {
                    log.warn("[IncomeReport] unknown verification code requested");
                    return new ResourceNotFoundException("Invalid verification code");
                });

        SignatureStatus signature = report.getSignatureStatus();
        return PublicVerificationDTO.builder()
                .verificationCode(report.getVerificationCode())
                .documentTitle(report.getTitle())
                .dateFrom(report.getDateFrom())
                .dateTo(report.getDateTo())
                .createdAt(report.getCreatedAt())
                .totalIncome(formatMoney(report.getTotalIncome()))
                .netIncome(formatMoney(report.getNetIncome()))
                .confidenceScore(report.getConfidenceScore())
                .ownerEmail(maskEmail(report.getOwnerEmail()))
                .verified(signature == SignatureStatus.APPROVED)
                .verificationStatus(signature.name())
                .message(signature.getPublicMessage())
                .decidedAt(signature.isTerminal() ? report.getSignatureDecidedAt() : null)
                .adminNotes(signature == SignatureStatus.REJECTED ? report.getSignatureNotes() : null)
                .documentHash(hashPrefix(report.getDocumentHash()))
                .expired(isExpired(report))
                .build();
    }

    /** Moves completed reports past their expiry to {@code EXPIRED}. Returns how many moved. */
    public int expireOverdue() {
        List<IncomeReport> overdue = reportRepository.findByStatusAndExpiresAtBefore(ReportStatus.COMPLETED,
                LocalDateTime.now());
        int expired = 0;
        for (IncomeReport r : overdue) {
            if (reportGate.expire(r.getId())) expired++;
        }
        if (expired > 0) {
            log.info("[IncomeReport] expired {} reports", expired);
        }
        return expired;
    }

    static boolean isExpired(IncomeReport report) {
        if (report.getStatus() == ReportStatus.EXPIRED) return true;
        return report.getExpiresAt() != null && LocalDateTime.now().isAfter(report.getExpiresAt());
    }

    static String maskEmail(String email) {
        if (email == null) return null;
        int at = email.indexOf('@');
        if (at <= 0) return null;
        String local = email.substring(0, at);
        return local.substring(0, Math.min(3, local.length())) + "***" + email.substring(at);
    }

    static String hashPrefix(String hash) {
        if (hash == null || hash.isBlank()) return null;
        return hash.substring(0, Math.min(HASH_PREFIX_LENGTH, hash.length())) + "...";
    }

    private static String formatMoney(BigDecimal v) {
        if (v == null) return null;
        return REPORT_CURRENCY + " " + String.format(Locale.ROOT, "%,.2f", v);
    }
}
