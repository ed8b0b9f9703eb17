package com.proofly.backend.exceptions;

/**
 * Raised when an uploaded document cannot be parsed by any extractor. Terminal for the upload.
 */
public class UnsupportedFormatException extends RuntimeException {

    private final String extension;

    public UnsupportedFormatException(String extension, String message) {
        super(message);
        this.extension = extension;
    }

    public UnsupportedFormatException(String extension, String message, Throwable cause) {
        super(message, cause);
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
