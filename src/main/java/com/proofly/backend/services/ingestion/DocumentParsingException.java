package com.proofly.backend.services.ingestion;

/**
 * Thrown when a document of a supported format cannot be read (corrupt, encrypted, empty).
 */
public class DocumentParsingException extends IllegalArgumentException {

    public DocumentParsingException(String message) {
        super(message);
    }

    public DocumentParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
