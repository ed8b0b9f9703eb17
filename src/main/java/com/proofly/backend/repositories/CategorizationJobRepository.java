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

import com.proofly.backend.entities.CategorizationJob;
import com.proofly.backend.enums.JobStatus;
import com.proofly.backend.enums.JobType;

public interface CategorizationJobRepository extends JpaRepository<CategorizationJob, UUID> {

    Optional<CategorizationJob> findByIdAndUserId(UUID id, UUID userId);

    Page<CategorizationJob> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    Page<CategorizationJob> findByUserIdAndStatusOrderByCreatedAtDesc(UUID userId, JobStatus status, Pageable pageable);

    Page<CategorizationJob> findByUserIdAndJobTypeOrderByCreatedAtDesc(UUID userId, JobType jobType, Pageable pageable);

    Page<CategorizationJob> findByUserIdAndStatusAndJobTypeOrderByCreatedAtDesc(
            UUID userId,
            JobStatus status,
            JobType jobType,
            Pageable pageable
    );

    List<CategorizationJob> findByStatusAndStartedAtBefore(JobStatus status, LocalDateTime cutoff);

    /** Moves PENDING to PROCESSING and stamps the start time in the same statement. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CategorizationJob j SET j.status = :to, j.startedAt = :now "
            + "WHERE j.id = :id AND j.status = :from")
    int startIfStatus(@Param("id") UUID id,
                      @Param("from") JobStatus from,
                      @Param("to") JobStatus to,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CategorizationJob j SET j.status = :to, j.completedAt = :now "
            + "WHERE j.id = :id AND j.status = :from")
    int finishIfStatus(@Param("id") UUID id,
                       @Param("from") JobStatus from,
                       @Param("to") JobStatus to,
                       @Param("now") LocalDateTime now);
}
