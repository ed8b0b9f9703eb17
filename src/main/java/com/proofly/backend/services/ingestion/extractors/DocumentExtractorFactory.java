package com.proofly.backend.services.ingestion.extractors;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

@Component
public class DocumentExtractorFactory {

    private final List<DocumentExtractor> extractors;

    public DocumentExtractorFactory(List<DocumentExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public Optional<DocumentExtractor> forExtension(String extension) {
        if (extension == null || extension.isBlank()) return Optional.empty();
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        for (DocumentExtractor extractor : extractors) {
            if (extractor.supports(ext)) {
                return Optional.of(extractor);
            }
        }
        return Optional.empty();
    }

    public static String extensionOf(String filename) {
        if (filename == null) return "";
        String name = filename.trim();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) return "";
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
