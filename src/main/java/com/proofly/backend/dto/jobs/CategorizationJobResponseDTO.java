package com.proofly.backend.dto.jobs;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import com.proofly.backend.entities.CategorizationJob;
import com.proofly.backend.enums.JobStatus;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CategorizationJobResponseDTO {
    private UUID id;
    private String jobType;
    private String status;
    private int progressPercentage;
    private Map<String, Object> inputData;
    private Map<String, Object> outputData;
    private String errorMessage;
    private Integer tokensUsed;
    private BigDecimal costUsd;
    private Double processingTimeSeconds;
    private String modelUsed;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public static CategorizationJobResponseDTO from(CategorizationJob job) {
        return CategorizationJobResponseDTO.builder()
                .id(job.getId())
                .jobType(job.getJobType() != null ? job.getJobType().name() : null)
                .status(job.getStatus() != null ? job.getStatus().name() : null)
                .progressPercentage(progressOf(job.getStatus()))
                .inputData(job.getInputData())
                .outputData(job.getOutputData())
                .errorMessage(job.getErrorMessage())
                .tokensUsed(job.getTokensUsed())
                .costUsd(job.getCostUsd())
                .processingTimeSeconds(job.getProcessingTimeSeconds())
                .modelUsed(job.getModelUsed())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }

    private static int progressOf(JobStatus status) {
        if (status == null) return 0;
        return switch (status) {
            case PENDING -> 0;
            case PROCESSING -> 50;
            case COMPLETED, FAILED, CANCELLED -> 100;
        };
    }
}
