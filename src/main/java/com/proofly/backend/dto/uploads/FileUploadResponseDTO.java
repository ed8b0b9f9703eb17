package com.proofly.backend.dto.uploads;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import com.proofly.backend.entities.FileUpload;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FileUploadResponseDTO {
    private UUID id;
    private String originalFilename;
    private String contentType;
    private long fileSize;
    private String fileKind;
    private String source;
    private String status;
    private String detectedFormat;
    private LocalDate dateRangeStart;
    private LocalDate dateRangeEnd;
    private int rowsRead;
    private int rowsSkipped;
    private int softFailures;
    private int transactionsCreated;
    private boolean syntheticData;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime processedAt;

    public static FileUploadResponseDTO from(FileUpload upload) {
        return FileUploadResponseDTO.builder()
                .id(upload.getId())
                .originalFilename(upload.getOriginalFilename())
                .contentType(upload.getContentType())
                .fileSize(upload.getFileSize())
                .fileKind(upload.getFileKind() != null ? upload.getFileKind().name() : null)
                .source(upload.getSource() != null ? upload.getSource().getCode() : null)
                .status(upload.getStatus() != null ? upload.getStatus().name() : null)
                .detectedFormat(upload.getDetectedFormat())
                .dateRangeStart(upload.getDateRangeStart())
                .dateRangeEnd(upload.getDateRangeEnd())
                .rowsRead(upload.getRowsRead())
                .rowsSkipped(upload.getRowsSkipped())
                .softFailures(upload.getSoftFailures())
                .transactionsCreated(upload.getTransactionsCreated())
                .syntheticData(upload.isSyntheticData())
                .errorMessage(upload.getErrorMessage())
                .createdAt(upload.getCreatedAt())
                .processedAt(upload.getProcessedAt())
                .build();
    }
}
