package com.proofly.backend.services.ingestion;

public enum DocumentFormat {
    DELIMITED_TEXT,
    SPREADSHEET,
    PDF_TEXT
}
