package com.proofly.backend.services.reports;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.enums.ReportStatus;
import com.proofly.backend.enums.SignatureStatus;
import com.proofly.backend.exceptions.BusinessException;
import com.proofly.backend.exceptions.ConflictException;
import com.proofly.backend.exceptions.ResourceNotFoundException;
import com.proofly.backend.repositories.IncomeReportRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Signature review of finished reports:
 * {@code NOT_SUBMITTED -> PENDING -> APPROVED | REJECTED}. Each step is a compare-and-swap on
 * the signature column; repeating a step that already happened returns the report unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignatureVerificationService {

    private final IncomeReportRepository reportRepository;

    @Transactional
    public IncomeReport submit(UUID userId, UUID reportId) {
        IncomeReport report = reportRepository.findByIdAndUserId(reportId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Report not found"));

        if (report.getSignatureStatus() != SignatureStatus.NOT_SUBMITTED) {
            return report;
        }
        if (report.getStatus() != ReportStatus.COMPLETED || report.getDocumentHash() == null) {
            throw new BusinessException("Report must be completed with a generated document before verification");
        }

        LocalDateTime now = LocalDateTime.now();
        int moved = reportRepository.transitionSignature(reportId, SignatureStatus.NOT_SUBMITTED,
                SignatureStatus.PENDING, now);
        IncomeReport current = reportRepository.findById(reportId).orElseThrow();
        if (moved == 1) {
            current.setSignatureSubmittedAt(now);
            reportRepository.save(current);
            log.info("[Signature] submitted reportId={} userId={}", reportId, userId);
        }
        return current;
    }

    @Transactional
    public IncomeReport approve(UUID adminId, UUID reportId, String notes) {
        return decide(adminId, reportId, SignatureStatus.APPROVED, notes);
    }

    @Transactional
    public IncomeReport reject(UUID adminId, UUID reportId, String notes) {
        return decide(adminId, reportId, SignatureStatus.REJECTED, notes);
    }

    @Transactional(readOnly = true)
    public Page<IncomeReport> listPending(Pageable pageable) {
        return reportRepository.findBySignatureStatusOrderBySignatureSubmittedAtAsc(SignatureStatus.PENDING, pageable);
    }

    private IncomeReport decide(UUID adminId, UUID reportId, SignatureStatus target, String notes) {
        IncomeReport report = reportRepository.findById(reportId)
                .orElseThrow(() -> new ResourceNotFoundException("Report not found"));

        SignatureStatus current = report.getSignatureStatus();
        if (current == target) {
            return report;
        }
        if (!current.allowedNext().contains(target)) {
            throw new BusinessException("Signature cannot move from " + current + " to " + target);
        }

        LocalDateTime now = LocalDateTime.now();
        int moved = reportRepository.transitionSignature(reportId, current, target, now);
        if (moved == 0) {
            throw new ConflictException("Signature status was changed concurrently");
        }
        IncomeReport updated = reportRepository.findById(reportId).orElseThrow();
        updated.setSignatureDecidedBy(adminId);
        updated.setSignatureDecidedAt(now);
        updated.setSignatureNotes(notes);
        reportRepository.save(updated);
        log.info("[Signature] reportId={} {} by adminId={}", reportId, target, adminId);
        return updated;
    }
}
