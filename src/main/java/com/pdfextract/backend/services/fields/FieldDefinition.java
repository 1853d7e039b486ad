package com.pdfextract.backend.services.fields;

import com.pdfextract.backend.enums.FieldDataType;

public record FieldDefinition(String name, String description, FieldDataType dataType, boolean required) {

    public static FieldDefinition required(String name, String description, FieldDataType dataType) {
        return new FieldDefinition(name, description, dataType, true);
    }

    public static FieldDefinition optional(String name, String description, FieldDataType dataType) {
        return new FieldDefinition(name, description, dataType, false);
    }

    public static FieldDefinition custom(String name) {
        return new FieldDefinition(name, "Extract " + name, FieldDataType.STRING, false);
    }
}
