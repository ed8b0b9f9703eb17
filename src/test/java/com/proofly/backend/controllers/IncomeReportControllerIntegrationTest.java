package com.proofly.backend.controllers;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.proofly.backend.entities.IncomeReport;
import com.proofly.backend.enums.ReportStatus;
import com.proofly.backend.exceptions.BusinessException;
import com.proofly.backend.security.GatewayAuthenticationFilter;
import com.proofly.backend.services.reports.IncomeReportService;
import com.proofly.backend.services.reports.ReportDownload;
import com.proofly.backend.services.reports.SignatureVerificationService;

@SpringBootTest
@AutoConfigureMockMvc
class IncomeReportControllerIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    IncomeReportService reportService;

    @MockBean
    SignatureVerificationService signatureService;

    private final UUID userId = UUID.randomUUID();

    @Test
    void create_requiresAuthentication() throws Exception {
        mockMvc.perform(post("/api/reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dateFrom\":\"2024-01-01\",\"dateTo\":\"2024-01-31\"}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(reportService);
    }

    @Test
    void create_passesGatewayIdentityAndReturnsAccepted() throws Exception {
        IncomeReport report = report();
        when(reportService.createReport(eq(userId), eq("ana@example.com"), eq("Ana"), any())).thenReturn(report);

        mockMvc.perform(post("/api/reports")
                        .header(GatewayAuthenticationFilter.USER_ID_HEADER, userId.toString())
                        .header(GatewayAuthenticationFilter.EMAIL_HEADER, "ana@example.com")
                        .header(GatewayAuthenticationFilter.NAME_HEADER, "Ana")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dateFrom\":\"2024-01-01\",\"dateTo\":\"2024-01-31\",\"purpose\":\"LOAN_APPLICATION\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("GENERATING"))
                .andExpect(jsonPath("$.data.verificationCode").value("ABCDEF123456"));
    }

    @Test
    void create_missingDates_validationFailed() throws Exception {
        mockMvc.perform(post("/api/reports")
                        .header(GatewayAuthenticationFilter.USER_ID_HEADER, userId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));
    }

    @Test
    void download_returnsAttachment() throws Exception {
        UUID reportId = UUID.randomUUID();
        when(reportService.downloadForOwner(userId, reportId)).thenReturn(
                new ReportDownload("income_report_2024-01-01_2024-01-31.pdf", "application/pdf", new byte[] {37, 80}));

        mockMvc.perform(get("/api/reports/{id}/download", reportId)
                        .header(GatewayAuthenticationFilter.USER_ID_HEADER, userId.toString()))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=income_report_2024-01-01_2024-01-31.pdf"))
                .andExpect(header().string("Content-Type", "application/pdf"));
    }

    @Test
    void submitForSignature_notCompleted_unprocessable() throws Exception {
        UUID reportId = UUID.randomUUID();
        when(signatureService.submit(userId, reportId))
                .thenThrow(new BusinessException("Report must be completed with a generated document before verification"));

        mockMvc.perform(post("/api/reports/{id}/signature", reportId)
                        .header(GatewayAuthenticationFilter.USER_ID_HEADER, userId.toString()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false));
    }

    private IncomeReport report() {
        IncomeReport report = new IncomeReport();
        report.setId(UUID.randomUUID());
        report.setUserId(userId);
        report.setTitle("Income Report 2024-01-01 to 2024-01-31");
        report.setDateFrom(LocalDate.of(2024, 1, 1));
        report.setDateTo(LocalDate.of(2024, 1, 31));
        report.setTotalIncome(new BigDecimal("5000.00"));
        report.setStatus(ReportStatus.GENERATING);
        report.setVerificationCode("ABCDEF123456");
        return report;
    }
}
