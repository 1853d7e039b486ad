package com.pdfextract.backend.services.pdf;

public class PdfProcessingException extends RuntimeException {

    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
