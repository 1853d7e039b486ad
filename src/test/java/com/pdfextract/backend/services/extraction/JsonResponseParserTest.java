package com.pdfextract.backend.services.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.Map;

import org.junit.jupiter.api.Test;

class JsonResponseParserTest {

    private final JsonResponseParser parser = new JsonResponseParser();

    @Test
    void parse_plainJson() {
        Map<String, FieldValue> values = parser.parse("{\"a\":1}");

        assertThat(values).containsOnlyKeys("a");
        assertThat((BigDecimal) values.get("a").raw()).isEqualByComparingTo("1");
    }

    @Test
    void parse_fencedJsonBlock() {
        Map<String, FieldValue> values = parser.parse("```json\n{\"a\":1}\n```");

        assertThat(values).containsOnlyKeys("a");
        assertThat((BigDecimal) values.get("a").raw()).isEqualByComparingTo("1");
    }

    @Test
    void parse_jsonSurroundedByProse() {
        Map<String, FieldValue> values = parser.parse("prefix {\"a\":1} suffix");

        assertThat(values).containsOnlyKeys("a");
        assertThat((BigDecimal) values.get("a").raw()).isEqualByComparingTo("1");
    }

    @Test
    void parse_fenceWithoutLanguageTag() {
        Map<String, FieldValue> values = parser.parse("Here you go:\n```\n{\"invoice_number\":\"INV-7\"}\n```\nThanks");

        assertThat(values.get("invoice_number")).isEqualTo(FieldValue.text("INV-7"));
    }

    @Test
    void parse_mapsNullsAndNestedValues() {
        Map<String, FieldValue> values = parser.parse("{\"due_date\":null,\"paid\":true,\"items\":[1,2]}");

        assertThat(values.get("due_date").isNull()).isTrue();
        assertThat(values.get("paid")).isEqualTo(FieldValue.text("true"));
        assertThat(values.get("items")).isEqualTo(FieldValue.text("[1,2]"));
    }

    @Test
    void parse_failsWhenNoStrategyYieldsJson() {
        assertThatThrownBy(() -> parser.parse("I could not read this document."))
                .isInstanceOf(ResponseParseException.class);
    }

    @Test
    void parse_failsOnEmptyResponse() {
        assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(ResponseParseException.class);
    }
}
