package com.proofly.backend.dto.reports;

import jakarta.validation.constraints.Size;

public record SignatureDecisionRequest(@Size(max = 2000) String notes) {}
