package com.pdfextract.backend.services.consolidation;

public class ConsolidationException extends RuntimeException {

    public ConsolidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
