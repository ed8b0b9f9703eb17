package com.proofly.backend.controllers;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
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
import org.springframework.web.multipart.MultipartFile;

import com.proofly.backend.dto.ApiResponse;
import com.proofly.backend.dto.PageResponseDTO;
import com.proofly.backend.dto.uploads.FileUploadResponseDTO;
import com.proofly.backend.dto.uploads.UploadReviewRequest;
import com.proofly.backend.dto.uploads.UploadReviewResultDTO;
import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.enums.FileKind;
import com.proofly.backend.enums.SourcePlatform;
import com.proofly.backend.enums.UploadStatus;
import com.proofly.backend.exceptions.BadRequestException;
import com.proofly.backend.security.SecurityService;
import com.proofly.backend.services.uploads.FileUploadService;
import com.proofly.backend.services.uploads.UploadPipelineService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/uploads")
@RequiredArgsConstructor
public class FileUploadController {

    private final FileUploadService uploadService;
    private final UploadPipelineService pipelineService;
    private final SecurityService securityService;

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<FileUploadResponseDTO>> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "fileKind", required = false) FileKind fileKind,
            @RequestParam(value = "source", required = false) String source,
            @RequestParam(value = "dateRangeStart", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateRangeStart,
            @RequestParam(value = "dateRangeEnd", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateRangeEnd
    ) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("File is missing or empty");
        }
        UUID userId = securityService.currentUserId();

        FileUpload upload = uploadService.createUpload(
                userId,
                file.getOriginalFilename(),
                file.getContentType(),
                file.getBytes(),
                fileKind,
                SourcePlatform.fromCode(source),
                dateRangeStart,
                dateRangeEnd
        );

        // the pipeline ignores uploads that already left UPLOADED, so a reused upload is safe here
        pipelineService.startProcessing(upload.getId());

        return ResponseEntity.accepted()
                .body(ApiResponse.success(FileUploadResponseDTO.from(upload), "Upload queued for processing"));
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<PageResponseDTO<FileUploadResponseDTO>>> list(
            @RequestParam(value = "status", required = false) UploadStatus status,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size
    ) {
        UUID userId = securityService.currentUserId();
        PageResponseDTO<FileUploadResponseDTO> result = PageResponseDTO.of(
                uploadService.listForUser(userId, status, PageRequest.of(page, Math.min(size, 100))),
                FileUploadResponseDTO::from);
        return ResponseEntity.ok(ApiResponse.success(result, "Uploads"));
    }

    @GetMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<FileUploadResponseDTO>> get(@PathVariable UUID id) {
        FileUpload upload = uploadService.getForUser(securityService.currentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(FileUploadResponseDTO.from(upload), "Upload status"));
    }

    @PostMapping("/{id}/process")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<FileUploadResponseDTO>> process(@PathVariable UUID id) {
        FileUpload upload = uploadService.getForUser(securityService.currentUserId(), id);
        pipelineService.startProcessing(upload.getId());
        return ResponseEntity.accepted()
                .body(ApiResponse.success(FileUploadResponseDTO.from(upload), "Processing requested"));
    }

    @PostMapping("/{id}/review")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<UploadReviewResultDTO>> review(
            @PathVariable UUID id,
            @Valid @RequestBody UploadReviewRequest request
    ) {
        UploadReviewResultDTO result = uploadService.reviewUpload(securityService.currentUserId(), id, request);
        return ResponseEntity.ok(ApiResponse.success(result, "Upload reviewed"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> delete(@PathVariable UUID id) {
        int removed = uploadService.deleteUpload(securityService.currentUserId(), id);
        return ResponseEntity.ok(ApiResponse.success(Map.of("transactionsRemoved", removed), "Upload deleted"));
    }
}
