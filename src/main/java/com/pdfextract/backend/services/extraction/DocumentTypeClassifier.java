package com.pdfextract.backend.services.extraction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.pdfextract.backend.enums.DocumentType;

@Component
public class DocumentTypeClassifier {

    static final Set<String> INVOICE_INDICATORS = Set.of("invoice_number", "supplier_name", "total_amount");
    static final Set<String> UTILITY_INDICATORS = Set.of("account_number", "consumption", "meter_reading");

    /**
     * Scores the populated field names against both indicator sets. A tie, including 0-0, is unknown.
     */
    public DocumentType detectType(Map<String, FieldValue> fields) {
        if (fields == null || fields.isEmpty()) {
            return DocumentType.UNKNOWN;
        }

        int invoiceScore = score(fields, INVOICE_INDICATORS);
        int utilityScore = score(fields, UTILITY_INDICATORS);

        if (invoiceScore > utilityScore) return DocumentType.INVOICE;
        if (utilityScore > invoiceScore) return DocumentType.UTILITY_BILL;
        return DocumentType.UNKNOWN;
    }

    public DocumentType detectType(List<ExtractedField> fields) {
        if (fields == null) {
            return DocumentType.UNKNOWN;
        }
        Map<String, FieldValue> values = new LinkedHashMap<>();
        for (ExtractedField field : fields) {
            values.put(field.fieldName(), field.value());
        }
        return detectType(values);
    }

    private static int score(Map<String, FieldValue> fields, Set<String> indicators) {
        int score = 0;
        for (String indicator : indicators) {
            FieldValue value = fields.get(indicator);
            if (value != null && !value.isNull()) {
                score++;
            }
        }
        return score;
    }
}
