package com.proofly.backend.services.ingestion;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.proofly.backend.config.IngestionProperties;
import com.proofly.backend.enums.SourcePlatform;
import com.proofly.backend.exceptions.UnsupportedFormatException;
import com.proofly.backend.services.ingestion.extractors.DocumentExtractor;
import com.proofly.backend.services.ingestion.extractors.DocumentExtractorFactory;
import com.proofly.backend.services.ingestion.text.SyntheticSampleGenerator;
import com.proofly.backend.services.ingestion.text.TextLineTransactionParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Selects an extractor by file extension and turns the document into raw rows.
 * Text documents go through line matching; when nothing matches, the synthetic sample
 * generator takes over and the result is marked synthetic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentExtractionService {

    private final DocumentExtractorFactory extractorFactory;
    private final TextLineTransactionParser textLineParser;
    private final SyntheticSampleGenerator sampleGenerator;
    private final IngestionProperties properties;

    public ExtractionResult extract(String filename, byte[] content, SourcePlatform platform) {
        String extension = DocumentExtractorFactory.extensionOf(filename);
        DocumentExtractor extractor = extractorFactory.forExtension(extension)
                .orElseThrow(() -> new UnsupportedFormatException(extension,
                        "Unsupported file type: " + (extension.isEmpty() ? "(none)" : extension)));

        ExtractedDocument document = extractor.extract(content);

        if (document.format() != DocumentFormat.PDF_TEXT) {
            return new ExtractionResult(document.format(), document.rows(), false, document.rows().size());
        }

        List<Map<String, String>> matched = textLineParser.parse(document.lines());
        if (!matched.isEmpty()) {
            log.info("[DocumentExtraction] file={} lines={} matched={}", filename, document.lines().size(), matched.size());
            return new ExtractionResult(document.format(), matched, false, document.lines().size());
        }

        if (!Boolean.TRUE.equals(properties.syntheticFallbackEnabled())) {
            log.warn("[DocumentExtraction] no transaction lines recognized file={} lines={}",
                    filename, document.lines().size());
            return new ExtractionResult(document.format(), List.of(), false, document.lines().size());
        }

        log.warn("[DocumentExtraction] no transaction lines recognized file={} lines={}; using synthetic sample for source={}",
                filename, document.lines().size(), platform);
        List<Map<String, String>> sample = sampleGenerator.generate(platform, LocalDate.now());
        return new ExtractionResult(document.format(), sample, true, document.lines().size());
    }
}
