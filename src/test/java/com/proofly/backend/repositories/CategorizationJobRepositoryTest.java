package com.proofly.backend.repositories;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import com.proofly.backend.entities.CategorizationJob;
import com.proofly.backend.enums.JobStatus;
import com.proofly.backend.enums.JobType;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class CategorizationJobRepositoryTest {

    @Autowired
    CategorizationJobRepository jobRepository;

    @Test
    void startIfStatus_onlyFirstStartWins() {
        UUID id = jobRepository.saveAndFlush(job(JobStatus.PENDING)).getId();
        LocalDateTime now = LocalDateTime.now();

        assertThat(jobRepository.startIfStatus(id, JobStatus.PENDING, JobStatus.PROCESSING, now)).isEqualTo(1);
        assertThat(jobRepository.startIfStatus(id, JobStatus.PENDING, JobStatus.PROCESSING, now)).isZero();

        CategorizationJob stored = jobRepository.findById(id).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(stored.getStartedAt()).isNotNull();
    }

    @Test
    void finishIfStatus_completedJobIsNeverRevisited() {
        UUID id = jobRepository.saveAndFlush(job(JobStatus.PROCESSING)).getId();
        LocalDateTime now = LocalDateTime.now();

        assertThat(jobRepository.finishIfStatus(id, JobStatus.PROCESSING, JobStatus.COMPLETED, now)).isEqualTo(1);
        assertThat(jobRepository.finishIfStatus(id, JobStatus.PROCESSING, JobStatus.FAILED, now)).isZero();
        assertThat(jobRepository.startIfStatus(id, JobStatus.PENDING, JobStatus.PROCESSING, now)).isZero();

        CategorizationJob stored = jobRepository.findById(id).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(stored.getCompletedAt()).isNotNull();
    }

    @Test
    void cancelledJob_cannotBeStarted() {
        UUID id = jobRepository.saveAndFlush(job(JobStatus.PENDING)).getId();
        LocalDateTime now = LocalDateTime.now();

        assertThat(jobRepository.finishIfStatus(id, JobStatus.PENDING, JobStatus.CANCELLED, now)).isEqualTo(1);
        assertThat(jobRepository.startIfStatus(id, JobStatus.PENDING, JobStatus.PROCESSING, now)).isZero();
        assertThat(jobRepository.findById(id).orElseThrow().getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void findByStatusAndStartedAtBefore_onlyStuckProcessing() {
        CategorizationJob stuck = job(JobStatus.PROCESSING);
        stuck.setStartedAt(LocalDateTime.now().minusHours(1));
        CategorizationJob fresh = job(JobStatus.PROCESSING);
        fresh.setStartedAt(LocalDateTime.now());
        UUID stuckId = jobRepository.saveAndFlush(stuck).getId();
        jobRepository.saveAndFlush(fresh);

        assertThat(jobRepository.findByStatusAndStartedAtBefore(JobStatus.PROCESSING, LocalDateTime.now().minusMinutes(10)))
                .extracting(CategorizationJob::getId)
                .containsExactly(stuckId);
    }

    private static CategorizationJob job(JobStatus status) {
        CategorizationJob job = new CategorizationJob();
        job.setUserId(UUID.randomUUID());
        job.setJobType(JobType.CATEGORIZE_TRANSACTIONS);
        job.setStatus(status);
        return job;
    }
}
