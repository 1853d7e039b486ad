package com.pdfextract.backend.services.fields;

import static com.pdfextract.backend.services.fields.FieldDefinition.optional;
import static com.pdfextract.backend.services.fields.FieldDefinition.required;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.pdfextract.backend.enums.DocumentType;
import com.pdfextract.backend.enums.FieldDataType;

/**
 * Fields expected per document type, plus the instruction handed to the extraction providers.
 */
@Component
public class FieldSchemaRegistry {

    static final List<FieldDefinition> INVOICE_FIELDS = List.of(
            required("invoice_number", "Unique invoice identifier/number", FieldDataType.STRING),
            required("invoice_date", "Date the invoice was issued", FieldDataType.DATE),
            optional("due_date", "Payment due date", FieldDataType.DATE),
            required("supplier_name", "Name of the supplier/vendor", FieldDataType.STRING),
            optional("supplier_address", "Supplier's address", FieldDataType.STRING),
            optional("customer_name", "Name of the customer/client", FieldDataType.STRING),
            required("subtotal", "Subtotal amount before tax", FieldDataType.NUMBER),
            optional("tax_amount", "Tax/VAT amount", FieldDataType.NUMBER),
            optional("tax_rate", "Tax/VAT rate percentage", FieldDataType.NUMBER),
            required("total_amount", "Total amount including tax", FieldDataType.NUMBER),
            optional("currency", "Currency code (USD, EUR, GBP, etc.)", FieldDataType.STRING),
            optional("payment_terms", "Payment terms or conditions", FieldDataType.STRING),
            optional("reference_number", "Reference or PO number", FieldDataType.STRING)
    );

    static final List<FieldDefinition> UTILITY_BILL_FIELDS = List.of(
            required("account_number", "Customer account number", FieldDataType.STRING),
            required("bill_date", "Date the bill was issued", FieldDataType.DATE),
            required("due_date", "Payment due date", FieldDataType.DATE),
            required("provider_name", "Utility provider name", FieldDataType.STRING),
            optional("service_address", "Service location address", FieldDataType.STRING),
            optional("billing_period_start", "Start date of billing period", FieldDataType.DATE),
            optional("billing_period_end", "End date of billing period", FieldDataType.DATE),
            optional("meter_reading_previous", "Previous meter reading", FieldDataType.NUMBER),
            optional("meter_reading_current", "Current meter reading", FieldDataType.NUMBER),
            required("consumption", "Total consumption (kWh, m³, etc.)", FieldDataType.NUMBER),
            optional("consumption_unit", "Unit of consumption (kWh, m³, gallons, etc.)", FieldDataType.STRING),
            optional("unit_rate", "Rate per unit", FieldDataType.NUMBER),
            required("charges", "Total charges before tax", FieldDataType.NUMBER),
            optional("tax_amount", "Tax amount", FieldDataType.NUMBER),
            required("total_amount", "Total amount due", FieldDataType.NUMBER),
            optional("utility_type", "Type of utility (electricity, gas, water, etc.)", FieldDataType.STRING)
    );

    /**
     * Ordered schema for {@code documentType}; anything other than a utility bill gets the invoice
     * schema. Custom names are appended as optional strings unless the schema already has them.
     */
    public List<FieldDefinition> fieldsFor(DocumentType documentType, List<String> customFields) {
        List<FieldDefinition> base = documentType == DocumentType.UTILITY_BILL ? UTILITY_BILL_FIELDS : INVOICE_FIELDS;
        List<FieldDefinition> fields = new ArrayList<>(base);
        if (customFields == null || customFields.isEmpty()) {
            return fields;
        }

        for (String raw : customFields) {
            if (raw == null || raw.isBlank()) continue;
            String name = raw.trim();
            boolean known = fields.stream().anyMatch(f -> f.name().equals(name));
            if (!known) {
                fields.add(FieldDefinition.custom(name));
            }
        }
        return fields;
    }

    public List<FieldDefinition> fieldsFor(DocumentType documentType) {
        return fieldsFor(documentType, List.of());
    }

    /**
     * Declared type per field name, used to coerce raw values during consolidation.
     */
    public Map<String, FieldDataType> declaredTypes(DocumentType documentType) {
        Map<String, FieldDataType> types = new LinkedHashMap<>();
        for (FieldDefinition field : fieldsFor(documentType)) {
            types.put(field.name(), field.dataType());
        }
        return types;
    }

    public String buildInstruction(DocumentType documentType, List<String> customFields) {
        String fieldDescriptions = fieldsFor(documentType, customFields).stream()
                .map(f -> "- " + f.name() + ": " + f.description()
                        + " (type: " + f.dataType().getValue() + ", " + (f.required() ? "required" : "optional") + ")")
                .collect(Collectors.joining("\n"));

        return "You are a document data extraction specialist. Extract the following information from this "
                + documentType.getValue() + " document.\n\n"
                + "FIELDS TO EXTRACT:\n"
                + fieldDescriptions + "\n\n"
                + "INSTRUCTIONS:\n"
                + "1. Carefully analyze the entire document\n"
                + "2. Extract each field value accurately\n"
                + "3. If a field is not found or unclear, use null\n"
                + "4. For dates, use ISO format (YYYY-MM-DD)\n"
                + "5. For numbers, extract numeric values only (no currency symbols)\n"
                + "6. Be precise and verify extracted data\n\n"
                + "Return the data as a JSON object with the field names as keys.\n"
                + "Example format:\n"
                + "{\n"
                + "    \"field_name_1\": \"value\",\n"
                + "    \"field_name_2\": 123.45,\n"
                + "    \"field_name_3\": \"2024-01-15\",\n"
                + "    \"field_name_4\": null\n"
                + "}\n\n"
                + "Only return the JSON object, no additional text or explanation.";
    }
}
