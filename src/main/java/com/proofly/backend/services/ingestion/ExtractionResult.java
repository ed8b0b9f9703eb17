package com.proofly.backend.services.ingestion;

import java.util.List;
import java.util.Map;

/**
 * Rows ready for normalization. {@code synthetic} is true when the rows come from the
 * sample generator rather than the document itself.
 */
public record ExtractionResult(
        DocumentFormat format,
        List<Map<String, String>> rows,
        boolean synthetic,
        int sourceLineCount
) {
    public ExtractionResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
