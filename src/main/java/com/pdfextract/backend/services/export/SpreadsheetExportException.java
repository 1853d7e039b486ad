package com.pdfextract.backend.services.export;

public class SpreadsheetExportException extends RuntimeException {

    public SpreadsheetExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
