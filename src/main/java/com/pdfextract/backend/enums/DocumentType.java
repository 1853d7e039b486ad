package com.pdfextract.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
    INVOICE("invoice"),
    UTILITY_BILL("utility_bill"),
    UNKNOWN("unknown");

    private final String value;

    DocumentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DocumentType fromValue(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        String v = raw.trim();
        for (DocumentType type : values()) {
            if (type.value.equalsIgnoreCase(v) || type.name().equalsIgnoreCase(v)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported document type: " + raw);
    }
}
