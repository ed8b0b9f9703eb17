package com.proofly.backend.dto.jobs;

import java.time.LocalDate;

import jakarta.validation.constraints.NotNull;

public record SummaryJobRequest(@NotNull LocalDate dateFrom, @NotNull LocalDate dateTo) {}
