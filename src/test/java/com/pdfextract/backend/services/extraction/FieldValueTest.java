package com.pdfextract.backend.services.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pdfextract.backend.enums.FieldDataType;

class FieldValueTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void coerceToNumber_stripsCurrencyAndGrouping() {
        FieldValue value = FieldValue.text("$1,234.50").coerceTo(FieldDataType.NUMBER);

        assertThat(value).isInstanceOf(FieldValue.NumberValue.class);
        assertThat((BigDecimal) value.raw()).isEqualByComparingTo("1234.50");
    }

    @Test
    void coerceToNumber_keepsTextThatIsNotNumeric() {
        FieldValue original = FieldValue.text("12 kWh");

        assertThat(original.coerceTo(FieldDataType.NUMBER)).isSameAs(original);
    }

    @Test
    void coerceToDate_acceptsIsoDateAndDateTime() {
        assertThat(FieldValue.text("2024-03-15").coerceTo(FieldDataType.DATE).raw())
                .isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(FieldValue.text("2024-03-15T10:30:00").coerceTo(FieldDataType.DATE).raw())
                .isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(FieldValue.text("15/03/2024").coerceTo(FieldDataType.DATE))
                .isInstanceOf(FieldValue.TextValue.class);
    }

    @Test
    void coerceToString_rendersNumbersPlainly() {
        FieldValue value = FieldValue.number(new BigDecimal("1E+3")).coerceTo(FieldDataType.STRING);

        assertThat(value).isEqualTo(FieldValue.text("1000"));
    }

    @Test
    void nullValue_staysNullForEveryType() {
        FieldValue nothing = FieldValue.nullValue();

        for (FieldDataType type : FieldDataType.values()) {
            assertThat(nothing.coerceTo(type).isNull()).isTrue();
        }
        assertThat(FieldValue.text(null).isNull()).isTrue();
    }

    @Test
    void fromJson_mapsEveryNodeKind() throws Exception {
        var node = objectMapper.readTree("{\"s\":\"a\",\"n\":12.5,\"b\":true,\"z\":null,\"o\":{\"k\":1}}");

        assertThat(FieldValue.fromJson(node.get("s"))).isEqualTo(FieldValue.text("a"));
        assertThat((BigDecimal) FieldValue.fromJson(node.get("n")).raw()).isEqualByComparingTo("12.5");
        assertThat(FieldValue.fromJson(node.get("b"))).isEqualTo(FieldValue.text("true"));
        assertThat(FieldValue.fromJson(node.get("z")).isNull()).isTrue();
        assertThat(FieldValue.fromJson(node.get("missing")).isNull()).isTrue();
        assertThat(FieldValue.fromJson(node.get("o")).raw()).isEqualTo("{\"k\":1}");
    }

    @Test
    void serializesAsRawJsonValue() throws Exception {
        assertThat(objectMapper.writeValueAsString(FieldValue.text("x"))).isEqualTo("\"x\"");
        assertThat(objectMapper.writeValueAsString(FieldValue.number(new BigDecimal("2.50")))).isEqualTo("2.50");
        assertThat(objectMapper.writeValueAsString(FieldValue.nullValue())).isEqualTo("null");
    }
}
