package com.proofly.backend.repositories;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.proofly.backend.entities.FileUpload;
import com.proofly.backend.enums.UploadStatus;

public interface FileUploadRepository extends JpaRepository<FileUpload, UUID> {

    Optional<FileUpload> findByIdAndUserId(UUID id, UUID userId);

    Optional<FileUpload> findTopByUserIdAndFileSha256OrderByCreatedAtDesc(UUID userId, String fileSha256);

    Page<FileUpload> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    Page<FileUpload> findByUserIdAndStatusOrderByCreatedAtDesc(UUID userId, UploadStatus status, Pageable pageable);

    List<FileUpload> findByStatusAndProcessingStartedAtBefore(UploadStatus status, LocalDateTime cutoff);

    /**
     * Atomic status transition. Returns 1 when the row was in {@code from} and has moved to {@code to},
     * 0 when another writer got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE FileUpload u SET u.status = :to, u.updatedAt = :now "
            + "WHERE u.id = :id AND u.status = :from")
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") UploadStatus from,
                         @Param("to") UploadStatus to,
                         @Param("now") LocalDateTime now);
}
