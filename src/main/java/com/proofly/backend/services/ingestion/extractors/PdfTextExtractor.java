package com.proofly.backend.services.ingestion.extractors;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import com.proofly.backend.services.ingestion.DocumentFormat;
import com.proofly.backend.services.ingestion.DocumentParsingException;
import com.proofly.backend.services.ingestion.ExtractedDocument;

/**
 * Text layer of a PDF, split into trimmed non-blank lines. Scanned PDFs without a
 * text layer yield no lines.
 */
@Component
public class PdfTextExtractor implements DocumentExtractor {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.PDF_TEXT;
    }

    @Override
    public boolean supports(String extension) {
        return extension != null && "pdf".equals(extension.toLowerCase(Locale.ROOT));
    }

    @Override
    public ExtractedDocument extract(byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentParsingException("File is empty");
        }

        try (PDDocument document = PDDocument.load(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(document);

            List<String> lines = new ArrayList<>();
            if (text != null) {
                for (String raw : text.split("\\r?\\n")) {
                    String line = raw.replace('\u00A0', ' ').trim();
                    if (!line.isEmpty()) lines.add(line);
                }
            }
            return ExtractedDocument.ofLines(DocumentFormat.PDF_TEXT, lines);
        } catch (InvalidPasswordException e) {
            throw new DocumentParsingException("PDF is password protected", e);
        } catch (IOException e) {
            throw new DocumentParsingException("Could not read PDF: " + e.getMessage(), e);
        }
    }
}
