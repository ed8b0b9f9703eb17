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

import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.enums.ReportStatus;
import com.proofly.backend.enums.SignatureStatus;

public interface IncomeReportRepository extends JpaRepository<IncomeReport, UUID> {

    Optional<IncomeReport> findByIdAndUserId(UUID id, UUID userId);

    Optional<IncomeReport> findByVerificationCode(String verificationCode);

    Optional<IncomeReport> findByAccessToken(String accessToken);

    boolean existsByVerificationCode(String verificationCode);

    boolean existsByAccessToken(String accessToken);

    Page<IncomeReport> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    Page<IncomeReport> findBySignatureStatusOrderBySignatureSubmittedAtAsc(SignatureStatus status, Pageable pageable);

    List<IncomeReport> findByStatusAndExpiresAtBefore(ReportStatus status, LocalDateTime cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IncomeReport r SET r.status = :to, r.updatedAt = :now "
            + "WHERE r.id = :id AND r.status = :from")
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") ReportStatus from,
                         @Param("to") ReportStatus to,
                         @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IncomeReport r SET r.signatureStatus = :to, r.updatedAt = :now "
            + "WHERE r.id = :id AND r.signatureStatus = :from")
    int transitionSignature(@Param("id") UUID id,
                            @Param("from") SignatureStatus from,
                            @Param("to") SignatureStatus to,
                            @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE IncomeReport r SET r.downloadCount = r.downloadCount + 1 WHERE r.id = :id")
    int incrementDownloadCount(@Param("id") UUID id);
}
