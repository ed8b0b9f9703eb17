package com.proofly.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.proofly.backend.dto.ApiResponse;
import com.proofly.backend.dto.reports.PublicVerificationDTO;
import com.proofly.backend.services.reports.IncomeReportService;

import lombok.RequiredArgsConstructor;

/**
 * Endpoints for third parties (lenders, agencies) holding a verification code or an access token.
 * No account is required.
 */
@RestController
@RequestMapping("/api/public")
@RequiredArgsConstructor
public class PublicVerificationController {

    private final IncomeReportService reportService;

    @GetMapping("/verify/{code}")
    public ResponseEntity<ApiResponse<PublicVerificationDTO>> verify(@PathVariable String code) {
        PublicVerificationDTO view = reportService.verifyPublic(code);
        return ResponseEntity.ok(ApiResponse.success(view, view.getMessage()));
    }

    @GetMapping("/reports/{accessToken}/download")
    public ResponseEntity<byte[]> download(@PathVariable String accessToken) {
        return IncomeReportController.asAttachment(reportService.downloadByToken(accessToken));
    }
}
