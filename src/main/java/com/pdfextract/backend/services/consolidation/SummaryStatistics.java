package com.pdfextract.backend.services.consolidation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate figures for a {@link ConsolidatedTable}. Maps are keyed by column name and keep column order.
 */
public record SummaryStatistics(
        int totalRecords,
        List<String> columns,
        Map<String, NumericSummary> numericColumns,
        Map<String, DateRange> dateColumns
) {

    public SummaryStatistics {
        columns = List.copyOf(columns);
        numericColumns = Collections.unmodifiableMap(new LinkedHashMap<>(numericColumns));
        dateColumns = Collections.unmodifiableMap(new LinkedHashMap<>(dateColumns));
    }

    public record NumericSummary(BigDecimal sum, BigDecimal mean, BigDecimal min, BigDecimal max) {
    }

    public record DateRange(LocalDate earliest, LocalDate latest) {
    }

    /**
     * Flat key/value view, e.g. {@code total_amount_sum}, {@code invoice_date_earliest}.
     */
    public Map<String, Object> toEntries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("total_records", totalRecords);
        entries.put("columns", String.join(", ", columns));

        numericColumns.forEach((column, s) -> {
            entries.put(column + "_sum", s.sum());
            entries.put(column + "_mean", s.mean());
            entries.put(column + "_min", s.min());
            entries.put(column + "_max", s.max());
        });
        dateColumns.forEach((column, r) -> {
            entries.put(column + "_earliest", r.earliest());
            entries.put(column + "_latest", r.latest());
        });
        return entries;
    }
}
