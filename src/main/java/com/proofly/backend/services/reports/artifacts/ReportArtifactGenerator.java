package com.proofly.backend.services.reports.artifacts;

import com.proofly.backend.entities.IncomeReport;

/**
 * Renders the downloadable document of a finished report. Implementations read only the
 * computed fields and the verification identity; they never modify the report.
 */
public interface ReportArtifactGenerator {

    String contentType();

    String fileExtension();

    byte[] render(IncomeReport report);
}
