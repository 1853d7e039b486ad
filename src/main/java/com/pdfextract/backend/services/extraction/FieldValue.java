package com.pdfextract.backend.services.extraction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.pdfextract.backend.enums.FieldDataType;

/**
 * Value of an extracted field: text, number, date or null.
 */
public sealed interface FieldValue
        permits FieldValue.TextValue, FieldValue.NumberValue, FieldValue.DateValue, FieldValue.NullValue {

    Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    /**
     * Plain Java value: String, BigDecimal, LocalDate or null.
     */
    Object raw();

    default boolean isNull() {
        return false;
    }

    static FieldValue text(String value) {
        return value == null ? NullValue.INSTANCE : new TextValue(value);
    }

    static FieldValue number(BigDecimal value) {
        return value == null ? NullValue.INSTANCE : new NumberValue(value);
    }

    static FieldValue date(LocalDate value) {
        return value == null ? NullValue.INSTANCE : new DateValue(value);
    }

    static FieldValue nullValue() {
        return NullValue.INSTANCE;
    }

    /**
     * Maps a provider JSON value. Booleans and nested structures are kept as their JSON text.
     */
    static FieldValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return NullValue.INSTANCE;
        if (node.isTextual()) return new TextValue(node.textValue());
        if (node.isNumber()) return new NumberValue(node.decimalValue());
        if (node.isBoolean()) return new TextValue(String.valueOf(node.booleanValue()));
        return new TextValue(node.toString());
    }

    /**
     * Converts this value to the declared type where that is lossless; otherwise returns it unchanged.
     */
    default FieldValue coerceTo(FieldDataType type) {
        if (type == null || isNull()) return this;
        return switch (type) {
            case STRING -> this instanceof TextValue ? this : new TextValue(String.valueOf(displayValue()));
            case NUMBER -> this instanceof TextValue t ? parseNumber(t.value()) : this;
            case DATE -> this instanceof TextValue t ? parseDate(t.value()) : this;
        };
    }

    private Object displayValue() {
        Object raw = raw();
        return raw instanceof BigDecimal bd ? bd.toPlainString() : raw;
    }

    private FieldValue parseNumber(String text) {
        String cleaned = text.trim()
                .replace(",", "")
                .replace(" ", "")
                .replaceAll("^[$€£¥]", "");
        if (!NUMERIC.matcher(cleaned).matches()) return this;
        return new NumberValue(new BigDecimal(cleaned));
    }

    private FieldValue parseDate(String text) {
        String trimmed = text.trim();
        if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
            trimmed = trimmed.substring(0, 10);
        }
        try {
            return new DateValue(LocalDate.parse(trimmed));
        } catch (DateTimeParseException e) {
            return this;
        }
    }

    record TextValue(String value) implements FieldValue {
        @JsonValue
        @Override
        public Object raw() {
            return value;
        }
    }

    record NumberValue(BigDecimal value) implements FieldValue {
        @JsonValue
        @Override
        public Object raw() {
            return value;
        }
    }

    record DateValue(LocalDate value) implements FieldValue {
        @JsonValue
        @Override
        public Object raw() {
            return value;
        }
    }

    final class NullValue implements FieldValue {

        static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @JsonValue
        @Override
        public Object raw() {
            return null;
        }

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String toString() {
            return "null";
        }
    }
}
