package com.proofly.backend.services.ingestion.extractors;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import com.proofly.backend.config.IngestionProperties;
import com.proofly.backend.services.ingestion.DocumentFormat;
import com.proofly.backend.services.ingestion.DocumentParsingException;
import com.proofly.backend.services.ingestion.ExtractedDocument;

import lombok.extern.slf4j.Slf4j;

/**
 * Comma, tab, semicolon or pipe separated text with a header line.
 * The delimiter is sniffed from the first bytes of the content.
 */
@Component
@Slf4j
public class DelimitedTextExtractor implements DocumentExtractor {

    private static final Set<String> EXTENSIONS = Set.of("csv", "tsv", "txt");
    private static final char[] CANDIDATES = {',', '\t', ';', '|'};
    private static final int MAX_SNIFF_LINES = 10;

    private final int sampleSize;

    public DelimitedTextExtractor(IngestionProperties properties) {
        this.sampleSize = properties.sniffSampleBytes();
    }

    @Override
    public DocumentFormat format() {
        return DocumentFormat.DELIMITED_TEXT;
    }

    @Override
    public boolean supports(String extension) {
        return extension != null && EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    @Override
    public ExtractedDocument extract(byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentParsingException("File is empty");
        }

        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        if (text.isBlank()) {
            throw new DocumentParsingException("File is empty");
        }

        char delimiter = sniffDelimiter(text.substring(0, Math.min(text.length(), sampleSize)));
        log.debug("[DelimitedText] delimiter='{}'", delimiter == '\t' ? "\\t" : String.valueOf(delimiter));

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setIgnoreSurroundingSpaces(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .setTrim(true)
                .build();

        List<Map<String, String>> rows = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(text))) {
            List<String> headers = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                int cells = Math.min(headers.size(), record.size());
                for (int i = 0; i < cells; i++) {
                    String header = headers.get(i);
                    if (header == null || header.isBlank()) continue;
                    row.putIfAbsent(header, record.get(i));
                }
                if (!isBlankRow(row)) {
                    rows.add(row);
                }
            }
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new DocumentParsingException("Could not read delimited file: " + e.getMessage(), e);
        }

        return ExtractedDocument.ofRows(DocumentFormat.DELIMITED_TEXT, rows);
    }

    /**
     * Picks the candidate that appears the same non-zero number of times on every sampled line,
     * preferring the highest count. Falls back to the most frequent candidate on the header line,
     * then to a comma.
     */
    static char sniffDelimiter(String sample) {
        if (sample == null || sample.isEmpty()) return ',';

        String[] split = sample.split("\\r?\\n");
        List<String> lines = new ArrayList<>();
        // the last line of a truncated sample is usually partial
        int usable = split.length > 1 && !sample.endsWith("\n") ? split.length - 1 : split.length;
        for (int i = 0; i < usable && lines.size() < MAX_SNIFF_LINES; i++) {
            if (!split[i].isBlank()) lines.add(split[i]);
        }
        if (lines.isEmpty()) return ',';

        char best = 0;
        int bestCount = 0;
        for (char candidate : CANDIDATES) {
            int first = countOutsideQuotes(lines.get(0), candidate);
            if (first == 0) continue;
            boolean consistent = true;
            for (int i = 1; i < lines.size(); i++) {
                if (countOutsideQuotes(lines.get(i), candidate) != first) {
                    consistent = false;
                    break;
                }
            }
            if (consistent && first > bestCount) {
                best = candidate;
                bestCount = first;
            }
        }
        if (best != 0) return best;

        int headerBest = 0;
        char headerChoice = ',';
        for (char candidate : CANDIDATES) {
            int count = countOutsideQuotes(lines.get(0), candidate);
            if (count > headerBest) {
                headerBest = count;
                headerChoice = candidate;
            }
        }
        return headerChoice;
    }

    private static int countOutsideQuotes(String line, char c) {
        int count = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                quoted = !quoted;
            } else if (ch == c && !quoted) {
                count++;
            }
        }
        return count;
    }

    private static boolean isBlankRow(Map<String, String> row) {
        for (String v : row.values()) {
            if (v != null && !v.isBlank()) return false;
        }
        return true;
    }
}
