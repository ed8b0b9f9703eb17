package com.proofly.backend.repositories;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.enums.ReportStatus;
import com.proofly.backend.enums.SignatureStatus;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class IncomeReportRepositoryTest {

    @Autowired
    IncomeReportRepository reportRepository;

    @Autowired
    TestEntityManager entityManager;

    @Test
    void transitionStatus_onlyMovesFromExpectedStatus() {
        IncomeReport report = reportRepository.saveAndFlush(report("CODE00000001", "token-1"));
        LocalDateTime now = LocalDateTime.now();

        assertThat(reportRepository.transitionStatus(report.getId(), ReportStatus.GENERATING,
                ReportStatus.COMPLETED, now)).isEqualTo(1);
        assertThat(reportRepository.transitionStatus(report.getId(), ReportStatus.GENERATING,
                ReportStatus.FAILED, now)).isZero();
        assertThat(reportRepository.findById(report.getId()).orElseThrow().getStatus())
                .isEqualTo(ReportStatus.COMPLETED);
    }

    @Test
    void transitionSignature_secondDecisionLoses() {
        IncomeReport report = report("CODE00000002", "token-2");
        report.setSignatureStatus(SignatureStatus.PENDING);
        UUID id = reportRepository.saveAndFlush(report).getId();
        LocalDateTime now = LocalDateTime.now();

        assertThat(reportRepository.transitionSignature(id, SignatureStatus.PENDING,
                SignatureStatus.APPROVED, now)).isEqualTo(1);
        assertThat(reportRepository.transitionSignature(id, SignatureStatus.PENDING,
                SignatureStatus.REJECTED, now)).isZero();
        assertThat(reportRepository.findById(id).orElseThrow().getSignatureStatus())
                .isEqualTo(SignatureStatus.APPROVED);
    }

    @Test
    void verificationCode_isUnique() {
        reportRepository.saveAndFlush(report("CODE00000003", "token-3"));

        assertThat(reportRepository.existsByVerificationCode("CODE00000003")).isTrue();
        assertThat(reportRepository.findByAccessToken("token-3")).isPresent();
        assertThatThrownBy(() -> reportRepository.saveAndFlush(report("CODE00000003", "token-4")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void findByStatusAndExpiresAtBefore_onlyOverdueCompleted() {
        IncomeReport overdue = report("CODE00000005", "token-5");
        overdue.setStatus(ReportStatus.COMPLETED);
        overdue.setExpiresAt(LocalDateTime.now().minusDays(1));
        IncomeReport fresh = report("CODE00000006", "token-6");
        fresh.setStatus(ReportStatus.COMPLETED);
        fresh.setExpiresAt(LocalDateTime.now().plusDays(1));
        reportRepository.saveAndFlush(overdue);
        reportRepository.saveAndFlush(fresh);

        assertThat(reportRepository.findByStatusAndExpiresAtBefore(ReportStatus.COMPLETED, LocalDateTime.now()))
                .extracting(IncomeReport::getVerificationCode)
                .containsExactly("CODE00000005");
    }

    @Test
    void verificationCodeAndAccessToken_areNotOverwrittenByLaterSaves() {
        IncomeReport report = reportRepository.saveAndFlush(report("CODE00000007", "token-7"));

        report.setVerificationCode("CODE99999999");
        report.setAccessToken("token-replaced");
        report.setTitle("Renamed");
        reportRepository.saveAndFlush(report);
        entityManager.clear();

        IncomeReport stored = reportRepository.findById(report.getId()).orElseThrow();
        assertThat(stored.getVerificationCode()).isEqualTo("CODE00000007");
        assertThat(stored.getAccessToken()).isEqualTo("token-7");
        assertThat(stored.getTitle()).isEqualTo("Renamed");
    }

    private static IncomeReport report(String code, String token) {
        IncomeReport report = new IncomeReport();
        report.setUserId(UUID.randomUUID());
        report.setTitle("Income Report");
        report.setDateFrom(LocalDate.of(2024, 1, 1));
        report.setDateTo(LocalDate.of(2024, 1, 31));
        report.setVerificationCode(code);
        report.setAccessToken(token);
        return report;
    }
}
