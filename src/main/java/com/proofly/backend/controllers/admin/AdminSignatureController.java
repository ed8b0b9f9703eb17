package com.proofly.backend.controllers.admin;

import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.proofly.backend.dto.ApiResponse;
import com.proofly.backend.dto.PageResponseDTO;
import com.proofly.backend.dto.reports.IncomeReportResponseDTO;
import com.proofly.backend.dto.reports.SignatureDecisionRequest;
import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.security.SecurityService;
import com.proofly.backend.services.reports.SignatureVerificationService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/admin/signatures")
@PreAuthorize("hasRole('ADMIN')")
@RequiredArgsConstructor
public class AdminSignatureController {

    private final SignatureVerificationService signatureService;
    private final SecurityService securityService;

    @GetMapping("/pending")
    public ResponseEntity<ApiResponse<PageResponseDTO<IncomeReportResponseDTO>>> pending(
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size
    ) {
        PageResponseDTO<IncomeReportResponseDTO> result = PageResponseDTO.of(
                signatureService.listPending(PageRequest.of(page, Math.min(size, 100))),
                IncomeReportResponseDTO::from);
        return ResponseEntity.ok(ApiResponse.success(result, "Pending signature requests"));
    }

    @PostMapping("/{reportId}/approve")
    public ResponseEntity<ApiResponse<IncomeReportResponseDTO>> approve(
            @PathVariable UUID reportId,
            @Valid @RequestBody(required = false) SignatureDecisionRequest request
    ) {
        IncomeReport report = signatureService.approve(securityService.currentUserId(), reportId, notesOf(request));
        return ResponseEntity.ok(ApiResponse.success(IncomeReportResponseDTO.from(report), "Signature approved"));
    }

    @PostMapping("/{reportId}/reject")
    public ResponseEntity<ApiResponse<IncomeReportResponseDTO>> reject(
            @PathVariable UUID reportId,
            @Valid @RequestBody(required = false) SignatureDecisionRequest request
    ) {
        IncomeReport report = signatureService.reject(securityService.currentUserId(), reportId, notesOf(request));
        return ResponseEntity.ok(ApiResponse.success(IncomeReportResponseDTO.from(report), "Signature rejected"));
    }

    private static String notesOf(SignatureDecisionRequest request) {
        return request != null ? request.notes() : null;
    }
}
