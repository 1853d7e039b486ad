package com.pdfextract.backend.services.pdf;

/**
 * Whether a PDF carries a usable text layer.
 */
public enum PdfKind {
    TEXT,
    SCANNED
}
