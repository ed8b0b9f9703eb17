package com.proofly.backend.services.ingestion;

import java.util.List;
import java.util.Map;

/**
 * Raw extractor output. Table formats fill {@code rows} (header to cell value);
 * text formats fill {@code lines} and leave row matching to the text parser.
 */
public record ExtractedDocument(
        DocumentFormat format,
        List<Map<String, String>> rows,
        List<String> lines
) {
    public ExtractedDocument {
        rows = rows == null ? List.of() : List.copyOf(rows);
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static ExtractedDocument ofRows(DocumentFormat format, List<Map<String, String>> rows) {
        return new ExtractedDocument(format, rows, List.of());
    }

    public static ExtractedDocument ofLines(DocumentFormat format, List<String> lines) {
        return new ExtractedDocument(format, List.of(), lines);
    }
}
