package com.example.formulamap.service.text;

/**
 * Raised when a document cannot be turned into text.
 */
public class DocumentReadException extends RuntimeException {

    public DocumentReadException(String message) {
        super(message);
    }

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
