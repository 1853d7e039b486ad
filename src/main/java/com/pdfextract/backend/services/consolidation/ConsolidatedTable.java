package com.pdfextract.backend.services.consolidation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rectangular view over successful extractions. Every row is keyed by the same column list; absent
 * values are stored as {@code null}.
 */
public record ConsolidatedTable(List<String> columns, List<Map<String, Object>> rows) {

    public static final String FILENAME = "filename";
    public static final String FILE_ID = "file_id";
    public static final String DOCUMENT_TYPE = "document_type";
    public static final String EXTRACTION_TIME = "extraction_time";

    public static final List<String> METADATA_COLUMNS = List.of(FILENAME, FILE_ID, DOCUMENT_TYPE, EXTRACTION_TIME);

    public ConsolidatedTable {
        columns = List.copyOf(columns);
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> full = new LinkedHashMap<>();
            for (String column : columns) {
                full.put(column, row.get(column));
            }
            copied.add(Collections.unmodifiableMap(full));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public static ConsolidatedTable empty() {
        return new ConsolidatedTable(List.of(), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }

    public List<Object> column(String name) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(name));
        }
        return values;
    }
}
