package com.pdfextract.backend.services.consolidation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.pdfextract.backend.enums.FieldDataType;
import com.pdfextract.backend.services.extraction.DocumentExtraction;
import com.pdfextract.backend.services.extraction.ExtractedField;
import com.pdfextract.backend.services.fields.FieldSchemaRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Merges per-document field sets into one table and derives summary figures from it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Consolidator {

    static final String CONFIDENCE_SUFFIX = "_confidence";
    static final List<String> SORT_CANDIDATES = List.of("invoice_date", "bill_date");

    private final FieldSchemaRegistry fieldSchemaRegistry;

    /**
     * One row per successful extraction: metadata columns, then each field (coerced to its declared
     * type) and a {@code <field>_confidence} column where a score exists. Failed extractions are skipped.
     */
    public ConsolidatedTable consolidate(List<DocumentExtraction> extractions) {
        if (extractions == null || extractions.isEmpty()) {
            log.info("[Consolidator] Nothing to consolidate");
            return ConsolidatedTable.empty();
        }

        try {
            Set<String> columns = new LinkedHashSet<>(ConsolidatedTable.METADATA_COLUMNS);
            List<Map<String, Object>> rows = new ArrayList<>();

            for (DocumentExtraction extraction : extractions) {
                if (!extraction.success()) {
                    log.warn("[Consolidator] Skipping failed extraction: {}", extraction.filename());
                    continue;
                }
                Map<String, Object> row = toRow(extraction);
                columns.addAll(row.keySet());
                rows.add(row);
            }

            if (rows.isEmpty()) {
                log.warn("[Consolidator] No successful extractions to consolidate");
                return ConsolidatedTable.empty();
            }

            sortRows(rows, columns);
            ConsolidatedTable table = new ConsolidatedTable(new ArrayList<>(columns), rows);
            log.info("[Consolidator] Consolidated {} records with {} columns", table.rowCount(), table.columns().size());
            return table;
        } catch (RuntimeException e) {
            throw new ConsolidationException("Failed to consolidate extractions: " + e.getMessage(), e);
        }
    }

    /**
     * Sum/mean/min/max for numeric columns (confidence columns excluded) and earliest/latest for date
     * columns. An empty table yields empty statistics.
     */
    public SummaryStatistics summarize(ConsolidatedTable table) {
        if (table == null || table.isEmpty()) {
            return new SummaryStatistics(0, table == null ? List.of() : table.columns(), Map.of(), Map.of());
        }

        Map<String, SummaryStatistics.NumericSummary> numeric = new LinkedHashMap<>();
        Map<String, SummaryStatistics.DateRange> dates = new LinkedHashMap<>();

        for (String column : table.columns()) {
            List<Object> values = nonNull(table.column(column));
            if (values.isEmpty()) continue;

            if (!column.endsWith(CONFIDENCE_SUFFIX) && values.stream().allMatch(v -> v instanceof BigDecimal)) {
                numeric.put(column, numericSummary(values));
            } else if (!ConsolidatedTable.EXTRACTION_TIME.equals(column)
                    && values.stream().allMatch(v -> v instanceof LocalDate)) {
                dates.put(column, dateRange(values));
            }
        }

        return new SummaryStatistics(table.rowCount(), table.columns(), numeric, dates);
    }

    private Map<String, Object> toRow(DocumentExtraction extraction) {
        Map<String, FieldDataType> declared = fieldSchemaRegistry.declaredTypes(extraction.documentType());

        Map<String, Object> row = new LinkedHashMap<>();
        row.put(ConsolidatedTable.FILENAME, extraction.filename());
        row.put(ConsolidatedTable.FILE_ID, extraction.fileId());
        row.put(ConsolidatedTable.DOCUMENT_TYPE, extraction.documentType().getValue());
        row.put(ConsolidatedTable.EXTRACTION_TIME, extraction.extractionTime());

        for (ExtractedField field : extraction.fields()) {
            // Later duplicates overwrite earlier ones.
            row.put(field.fieldName(), field.value().coerceTo(declared.get(field.fieldName())).raw());
            if (field.confidence() != null) {
                row.put(field.fieldName() + CONFIDENCE_SUFFIX, field.confidence());
            }
        }
        return row;
    }

    private static void sortRows(List<Map<String, Object>> rows, Set<String> columns) {
        String sortColumn = SORT_CANDIDATES.stream().filter(columns::contains).findFirst().orElse(null);
        if (sortColumn == null) return;

        // List.sort is stable, so rows with equal keys keep their input order.
        rows.sort(Comparator.comparing((Map<String, Object> row) -> row.get(sortColumn),
                Comparator.nullsLast(Consolidator::compareValues)));
    }

    private static int compareValues(Object a, Object b) {
        if (a instanceof LocalDate da && b instanceof LocalDate db) {
            return da.compareTo(db);
        }
        if (a instanceof BigDecimal na && b instanceof BigDecimal nb) {
            return na.compareTo(nb);
        }
        if (a instanceof String sa && b instanceof String sb) {
            return sa.compareTo(sb);
        }
        return a.toString().compareTo(b.toString());
    }

    private static List<Object> nonNull(List<Object> values) {
        List<Object> out = new ArrayList<>(values.size());
        for (Object v : values) {
            if (v != null) out.add(v);
        }
        return out;
    }

    private static SummaryStatistics.NumericSummary numericSummary(List<Object> values) {
        BigDecimal sum = BigDecimal.ZERO;
        BigDecimal min = null;
        BigDecimal max = null;
        for (Object v : values) {
            BigDecimal n = (BigDecimal) v;
            sum = sum.add(n);
            min = min == null || n.compareTo(min) < 0 ? n : min;
            max = max == null || n.compareTo(max) > 0 ? n : max;
        }
        BigDecimal mean = sum.divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL64);
        return new SummaryStatistics.NumericSummary(sum, mean, min, max);
    }

    private static SummaryStatistics.DateRange dateRange(List<Object> values) {
        LocalDate earliest = null;
        LocalDate latest = null;
        for (Object v : values) {
            LocalDate d = (LocalDate) v;
            earliest = earliest == null || d.isBefore(earliest) ? d : earliest;
            latest = latest == null || d.isAfter(latest) ? d : latest;
        }
        return new SummaryStatistics.DateRange(earliest, latest);
    }
}
