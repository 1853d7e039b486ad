package com.pdfextract.backend.services.extraction;

public record ExtractedField(String fieldName, FieldValue value, Double confidence) {

    public ExtractedField {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName is required");
        }
        if (value == null) {
            value = FieldValue.nullValue();
        }
        if (confidence != null && (confidence < 0d || confidence > 1d)) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    public ExtractedField(String fieldName, FieldValue value) {
        this(fieldName, value, null);
    }
}
