package com.pdfextract.backend.services.extraction;

/**
 * No JSON object could be recovered from a provider response.
 */
public class ResponseParseException extends RuntimeException {

    public ResponseParseException(String message) {
        super(message);
    }
}
