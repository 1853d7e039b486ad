package com.pdfextract.backend.services.fields;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.pdfextract.backend.enums.DocumentType;
import com.pdfextract.backend.enums.FieldDataType;

class FieldSchemaRegistryTest {

    private final FieldSchemaRegistry registry = new FieldSchemaRegistry();

    @Test
    void invoiceSchema_isOrderedAndMarksRequiredFields() {
        List<FieldDefinition> fields = registry.fieldsFor(DocumentType.INVOICE);

        assertEquals(13, fields.size());
        assertEquals("invoice_number", fields.get(0).name());
        assertEquals("reference_number", fields.get(12).name());
        assertTrue(fields.get(0).required());
        assertFalse(fields.get(2).required());
    }

    @Test
    void unknownType_usesInvoiceSchema() {
        assertEquals(registry.fieldsFor(DocumentType.INVOICE), registry.fieldsFor(DocumentType.UNKNOWN));
    }

    @Test
    void utilitySchema_hasItsOwnFields() {
        List<FieldDefinition> fields = registry.fieldsFor(DocumentType.UTILITY_BILL);

        assertEquals(16, fields.size());
        assertEquals("account_number", fields.get(0).name());
        assertEquals(FieldDataType.NUMBER, registry.declaredTypes(DocumentType.UTILITY_BILL).get("consumption"));
    }

    @Test
    void customFields_areAppendedOnceAsOptionalStrings() {
        List<FieldDefinition> fields = registry.fieldsFor(DocumentType.INVOICE,
                Arrays.asList("po_box", " po_box ", "total_amount", "", null));

        assertEquals(14, fields.size());
        FieldDefinition custom = fields.get(13);
        assertEquals("po_box", custom.name());
        assertEquals("Extract po_box", custom.description());
        assertEquals(FieldDataType.STRING, custom.dataType());
        assertFalse(custom.required());
    }

    @Test
    void instruction_listsEveryFieldWithTypeAndRequirement() {
        String instruction = registry.buildInstruction(DocumentType.UTILITY_BILL, List.of("meter_id"));

        assertTrue(instruction.contains("from this utility_bill document"));
        assertTrue(instruction.contains("- bill_date: Date the bill was issued (type: date, required)"));
        assertTrue(instruction.contains("- meter_id: Extract meter_id (type: string, optional)"));
        assertTrue(instruction.endsWith("Only return the JSON object, no additional text or explanation."));
    }
}
