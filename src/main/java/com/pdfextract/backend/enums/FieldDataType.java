package com.pdfextract.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldDataType {
    STRING("string"),
    NUMBER("number"),
    DATE("date");

    private final String value;

    FieldDataType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
