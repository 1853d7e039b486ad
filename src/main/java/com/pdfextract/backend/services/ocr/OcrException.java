package com.pdfextract.backend.services.ocr;

public class OcrException extends RuntimeException {

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
