package com.proofly.backend.entities;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.proofly.backend.enums.FileKind;
import com.proofly.backend.enums.SourcePlatform;
import com.proofly.backend.enums.UploadStatus;

import jakarta.persistence.Basic;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "file_uploads", indexes = {
        @Index(name = "idx_file_uploads_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_file_uploads_user_sha", columnList = "user_id, file_sha256")
})
@Getter
@Setter
public class FileUpload {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "original_filename", nullable = false)
    private String originalFilename;

    @Column(name = "content_type")
    private String contentType;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "file_kind", nullable = false)
    private FileKind fileKind = FileKind.OTHER;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false)
    private SourcePlatform source = SourcePlatform.OTHER;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private UploadStatus status = UploadStatus.UPLOADED;

    @Column(name = "file_sha256", length = 64)
    private String fileSha256;

    @Basic(fetch = FetchType.LAZY)
    @Column(name = "file_bytes", nullable = false, columnDefinition = "bytea")
    private byte[] fileBytes;

    @Column(name = "detected_format", length = 32)
    private String detectedFormat;

    @Column(name = "date_range_start")
    private LocalDate dateRangeStart;

    @Column(name = "date_range_end")
    private LocalDate dateRangeEnd;

    @Column(name = "rows_read")
    private int rowsRead;

    @Column(name = "rows_skipped")
    private int rowsSkipped;

    @Column(name = "soft_failures")
    private int softFailures;

    @Column(name = "transactions_created")
    private int transactionsCreated;

    @Column(name = "synthetic_data", nullable = false)
    private boolean syntheticData;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Column(name = "processing_started_at")
    private LocalDateTime processingStartedAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;
}
