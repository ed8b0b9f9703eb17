package com.proofly.backend.controllers;

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
import com.proofly.backend.dto.jobs.AnomalyScanRequest;
import com.proofly.backend.dto.jobs.CategorizationJobRequest;
import com.proofly.backend.dto.jobs.CategorizationJobResponseDTO;
import com.proofly.backend.dto.jobs.SummaryJobRequest;
import com.proofly.backend.entities.CategorizationJob;
import com.proofly.backend.enums.JobStatus;
import com.proofly.backend.enums.JobType;
import com.proofly.backend.security.SecurityService;
import com.proofly.backend.services.jobs.CategorizationJobService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/ai/jobs")
@RequiredArgsConstructor
public class CategorizationJobController {

    private final CategorizationJobService jobService;
    private final SecurityService securityService;

    @PostMapping("/categorize")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<CategorizationJobResponseDTO>> categorize(
            @RequestBody CategorizationJobRequest request
    ) {
        CategorizationJob job = jobService.createCategorizationJob(securityService.currentUserId(), request);
        jobService.startJob(job.getId());
        return accepted(job, "Categorization job queued");
    }

    @PostMapping("/summary")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<CategorizationJobResponseDTO>> summary(
            @Valid @RequestBody SummaryJobRequest request
    ) {
        CategorizationJob job = jobService.createSummaryJob(
                securityService.currentUserId(), request.dateFrom(), request.dateTo());
        jobService.startJob(job.getId());
        return accepted(job, "Summary job queued");
    }

    @PostMapping("/anomalies")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<CategorizationJobResponseDTO>> anomalies(
            @RequestBody(required = false) AnomalyScanRequest request
    ) {
        CategorizationJob job = jobService.createAnomalyJob(
                securityService.currentUserId(), request != null ? request.transactionIds() : null);
        jobService.startJob(job.getId());
        return accepted(job, "Anomaly scan queued");
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<PageResponseDTO<CategorizationJobResponseDTO>>> list(
            @RequestParam(value = "status", required = false) JobStatus status,
            @RequestParam(value = "jobType", required = false) JobType jobType,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size
    ) {
        PageResponseDTO<CategorizationJobResponseDTO> result = PageResponseDTO.of(
                jobService.listForUser(securityService.currentUserId(), status, jobType,
                        PageRequest.of(page, Math.min(size, 100))),
                CategorizationJobResponseDTO::from);
        return ResponseEntity.ok(ApiResponse.success(result, "Jobs"));
    }

    @GetMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<CategorizationJobResponseDTO>> get(@PathVariable UUID id) {
        CategorizationJob job = jobService.getForUser(securityService.currentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(CategorizationJobResponseDTO.from(job), "Job status"));
    }

    @PostMapping("/{id}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<CategorizationJobResponseDTO>> cancel(@PathVariable UUID id) {
        CategorizationJob job = jobService.cancel(securityService.currentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(CategorizationJobResponseDTO.from(job), "Job cancelled"));
    }

    private static ResponseEntity<ApiResponse<CategorizationJobResponseDTO>> accepted(CategorizationJob job, String message) {
        return ResponseEntity.accepted().body(ApiResponse.success(CategorizationJobResponseDTO.from(job), message));
    }
}
