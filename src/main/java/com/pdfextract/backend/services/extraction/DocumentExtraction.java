package com.pdfextract.backend.services.extraction;

import java.time.LocalDateTime;
import java.util.List;

import com.pdfextract.backend.enums.DocumentType;

/**
 * Outcome of the extraction pipeline for one file. A failed extraction always carries an error.
 */
public record DocumentExtraction(
        String fileId,
        String filename,
        DocumentType documentType,
        List<ExtractedField> fields,
        LocalDateTime extractionTime,
        boolean success,
        String error
) {

    public DocumentExtraction {
        fields = fields == null ? List.of() : List.copyOf(fields);
        if (extractionTime == null) {
            extractionTime = LocalDateTime.now();
        }
        if (documentType == null) {
            documentType = DocumentType.UNKNOWN;
        }
        if (!success && (error == null || error.isBlank())) {
            error = "Extraction failed";
        }
    }

    public static DocumentExtraction succeeded(String fileId, String filename, DocumentType documentType,
                                               List<ExtractedField> fields) {
        return new DocumentExtraction(fileId, filename, documentType, fields, LocalDateTime.now(), true, null);
    }

    public static DocumentExtraction failed(String fileId, String filename, DocumentType documentType, String error) {
        return new DocumentExtraction(fileId, filename, documentType, List.of(), LocalDateTime.now(), false, error);
    }
}
