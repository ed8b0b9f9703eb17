package com.proofly.backend.services.reports.artifacts;

import java.io.ByteArrayOutputStream;

import org.springframework.stereotype.Component;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import com.proofly.backend.entities.IncomeReport;

@Component
public class PdfReportArtifactGenerator implements ReportArtifactGenerator {

    @Override
    public String contentType() {
        return "application/pdf";
    }

    @Override
    public String fileExtension() {
        return "pdf";
    }

    @Override
    public byte[] render(IncomeReport report) {
        String html = IncomeReportTemplates.toHtml(report);
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            PdfRendererBuilder builder = new PdfRendererBuilder();
            builder.useFastMode();
            builder.withHtmlContent(html, null);
            builder.toStream(out);
            builder.run();
            return out.toByteArray();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to render income report PDF", e);
        }
    }
}
