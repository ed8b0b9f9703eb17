package com.proofly.backend.dto.reports;

import java.time.LocalDate;

import com.proofly.backend.enums.ReportPurpose;
import com.proofly.backend.enums.ReportType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateIncomeReportRequest(
        @Size(max = 255) String title,
        ReportType reportType,
        ReportPurpose purpose,
        @Size(max = 1000) String purposeDescription,
        @NotNull LocalDate dateFrom,
        @NotNull LocalDate dateTo
) {}
