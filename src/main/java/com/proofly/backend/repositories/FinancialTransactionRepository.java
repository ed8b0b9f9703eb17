package com.proofly.backend.repositories;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.proofly.backend.entities.FinancialTransaction;

public interface FinancialTransactionRepository extends JpaRepository<FinancialTransaction, UUID>,
        JpaSpecificationExecutor<FinancialTransaction> {

    Optional<FinancialTransaction> findByIdAndUserId(UUID id, UUID userId);

    List<FinancialTransaction> findByUserIdAndIdIn(UUID userId, Collection<UUID> ids);

    List<FinancialTransaction> findByUserIdAndTransactionDateBetweenOrderByTransactionDateAsc(
            UUID userId,
            LocalDateTime start,
            LocalDateTime end
    );

    List<FinancialTransaction> findByUserIdAndUploadIdOrderByTransactionDateAsc(UUID userId, UUID uploadId);

    List<FinancialTransaction> findByUserIdAndAiCategorizedFalseOrderByTransactionDateDesc(UUID userId);

    List<FinancialTransaction> findByUserIdOrderByTransactionDateDesc(UUID userId);

    long countByUploadId(UUID uploadId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FinancialTransaction t WHERE t.upload.id = :uploadId")
    int deleteByUploadId(@Param("uploadId") UUID uploadId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FinancialTransaction t WHERE t.upload.id = :uploadId AND t.userId = :userId")
    int deleteByUploadIdAndUserId(@Param("uploadId") UUID uploadId, @Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FinancialTransaction t WHERE t.upload.id = :uploadId AND t.userId = :userId AND t.id IN :ids")
    int deleteByUploadIdAndUserIdAndIdIn(@Param("uploadId") UUID uploadId,
                                         @Param("userId") UUID userId,
                                         @Param("ids") Collection<UUID> ids);
}
