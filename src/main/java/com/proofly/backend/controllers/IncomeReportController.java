package com.proofly.backend.controllers;

import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.proofly.backend.dto.ApiResponse;
import com.proofly.backend.dto.PageResponseDTO;
import com.proofly.backend.dto.reports.CreateIncomeReportRequest;
import com.proofly.backend.dto.reports.IncomeReportResponseDTO;
import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.security.GatewayPrincipal;
import com.proofly.backend.security.SecurityService;
import com.proofly.backend.services.reports.IncomeReportService;
import com.proofly.backend.services.reports.ReportDownload;
import com.proofly.backend.services.reports.SignatureVerificationService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class IncomeReportController {

    private final IncomeReportService reportService;
    private final SignatureVerificationService signatureService;
    private final SecurityService securityService;

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<IncomeReportResponseDTO>> create(
            @Valid @RequestBody CreateIncomeReportRequest request
    ) {
        GatewayPrincipal principal = securityService.currentPrincipal();
        IncomeReport report = reportService.createReport(
                principal.userId(), principal.email(), principal.name(), request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(IncomeReportResponseDTO.from(report), "Report requested"));
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<PageResponseDTO<IncomeReportResponseDTO>>> list(
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size
    ) {
        PageResponseDTO<IncomeReportResponseDTO> result = PageResponseDTO.of(
                reportService.listForUser(securityService.currentUserId(), PageRequest.of(page, Math.min(size, 100))),
                IncomeReportResponseDTO::from);
        return ResponseEntity.ok(ApiResponse.success(result, "Reports"));
    }

    @GetMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<IncomeReportResponseDTO>> get(@PathVariable UUID id) {
        IncomeReport report = reportService.getForUser(securityService.currentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(IncomeReportResponseDTO.from(report), "Report"));
    }

    @GetMapping("/{id}/download")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<byte[]> download(@PathVariable UUID id) {
        return asAttachment(reportService.downloadForOwner(securityService.currentUserId(), id));
    }

    @PostMapping("/{id}/signature")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<IncomeReportResponseDTO>> submitForSignature(@PathVariable UUID id) {
        IncomeReport report = signatureService.submit(securityService.currentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(IncomeReportResponseDTO.from(report),
                "Report submitted for signature verification"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable UUID id) {
        reportService.deleteReport(securityService.currentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(null, "Report deleted"));
    }

    static ResponseEntity<byte[]> asAttachment(ReportDownload download) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + download.filename())
                .contentType(MediaType.parseMediaType(download.contentType()))
                .body(download.content());
    }
}
