package com.proofly.backend.services.ingestion.extractors;

import com.proofly.backend.services.ingestion.DocumentFormat;
import com.proofly.backend.services.ingestion.ExtractedDocument;

public interface DocumentExtractor {

    DocumentFormat format();

    boolean supports(String extension);

    ExtractedDocument extract(byte[] content);
}
